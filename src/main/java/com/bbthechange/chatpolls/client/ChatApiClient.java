package com.bbthechange.chatpolls.client;

import com.bbthechange.chatpolls.config.ChatClientProperties;
import com.bbthechange.chatpolls.dto.MessagePayload;
import com.bbthechange.chatpolls.dto.PollAnswerVotersResponse;
import com.bbthechange.chatpolls.exception.ChatApiException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Client for the chat platform's poll REST endpoints.
 * Only covers the two calls a received poll needs: listing answer voters and expiring the poll.
 * Requests are sent asynchronously and never retried; failures reach the caller through the returned future.
 */
public class ChatApiClient {

    private static final Logger logger = LoggerFactory.getLogger(ChatApiClient.class);

    private static final String USER_AGENT = "ChatPollsClient/1.0";
    private static final String REQUEST_METRIC = "chat_api_requests_total";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final String baseUrl;
    private final String token;
    private final Duration requestTimeout;

    public ChatApiClient(HttpClient httpClient,
                         ObjectMapper objectMapper,
                         ChatClientProperties properties,
                         MeterRegistry meterRegistry) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.baseUrl = properties.getBaseUrl();
        this.token = properties.getToken();
        this.requestTimeout = properties.getRequestTimeout();
    }

    /**
     * Fetch one page of users who voted for a poll answer.
     *
     * @param channelId channel holding the poll message
     * @param messageId message the poll belongs to
     * @param answerId 1-based answer id
     * @param after only return users with an id greater than this, or null for the first page
     * @param limit page size, 1-100
     * @return future completing with the decoded voter list
     */
    public CompletableFuture<PollAnswerVotersResponse> getPollAnswerVoters(long channelId, long messageId,
                                                                           int answerId, Long after, int limit) {
        StringBuilder url = new StringBuilder(baseUrl)
                .append("/channels/").append(channelId)
                .append("/polls/").append(messageId)
                .append("/answers/").append(answerId)
                .append("?limit=").append(limit);
        if (after != null) {
            url.append("&after=").append(after);
        }

        logger.info("Fetching voters for answer {} of poll message {} in channel {}", answerId, messageId, channelId);

        HttpRequest request = newRequest(url.toString())
                .GET()
                .build();

        return send(request, "get_poll_answer_voters", PollAnswerVotersResponse.class);
    }

    /**
     * Immediately end a poll. Only the poll's author may do this.
     *
     * @param channelId channel holding the poll message
     * @param messageId message the poll belongs to
     * @return future completing with the updated message, including final results
     */
    public CompletableFuture<MessagePayload> endPoll(long channelId, long messageId) {
        String url = baseUrl + "/channels/" + channelId + "/polls/" + messageId + "/expire";

        logger.info("Ending poll on message {} in channel {}", messageId, channelId);

        HttpRequest request = newRequest(url)
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();

        return send(request, "end_poll", MessagePayload.class);
    }

    private HttpRequest.Builder newRequest(String url) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("User-Agent", USER_AGENT)
                .header("Content-Type", "application/json")
                .timeout(requestTimeout);
        if (token != null && !token.isEmpty()) {
            builder.header("Authorization", "Bot " + token);
        }
        return builder;
    }

    private <T> CompletableFuture<T> send(HttpRequest request, String route, Class<T> responseType) {
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> decode(response, route, responseType))
                .whenComplete((result, error) -> {
                    if (error != null) {
                        logger.warn("Chat API call {} {} failed: {}", request.method(), request.uri(), error.getMessage());
                        meterRegistry.counter(REQUEST_METRIC, "route", route, "status", "error").increment();
                    } else {
                        meterRegistry.counter(REQUEST_METRIC, "route", route, "status", "success").increment();
                    }
                });
    }

    private <T> T decode(HttpResponse<String> response, String route, Class<T> responseType) {
        int statusCode = response.statusCode();
        logger.debug("Chat API response status: {} for route: {}", statusCode, route);

        if (statusCode < 200 || statusCode >= 300) {
            throw toException(statusCode, response.body());
        }

        try {
            return objectMapper.readValue(response.body(), responseType);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to decode " + route + " response", e);
        }
    }

    /**
     * Build the exception for a rejected request.
     * Error bodies look like {"code": 10008, "message": "Unknown Message"}; anything else is ignored.
     */
    private ChatApiException toException(int statusCode, String body) {
        Integer code = null;
        String errorMessage = null;
        if (body != null && !body.isBlank()) {
            try {
                JsonNode node = objectMapper.readTree(body);
                if (node.hasNonNull("code")) {
                    code = node.get("code").asInt();
                }
                if (node.hasNonNull("message")) {
                    errorMessage = node.get("message").asText();
                }
            } catch (JsonProcessingException e) {
                logger.debug("Error response body is not JSON, status {}", statusCode);
                errorMessage = body;
            }
        }
        return ChatApiException.fromResponse(statusCode, code, errorMessage);
    }
}
