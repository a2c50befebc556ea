package com.bbthechange.chatpolls.model;

import com.bbthechange.chatpolls.client.ChatApiClient;
import com.bbthechange.chatpolls.client.ConnectionState;
import com.bbthechange.chatpolls.dto.MessagePayload;
import com.bbthechange.chatpolls.dto.PollCreateRequest;
import com.bbthechange.chatpolls.dto.PollPayload;
import com.bbthechange.chatpolls.exception.ChatApiException;
import com.bbthechange.chatpolls.exception.UnattachedResourceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PollTest {

    private static final long CHANNEL_ID = 111111111111111111L;
    private static final long MESSAGE_ID = 222222222222222222L;

    private static final String FINALIZED_POLL_JSON = """
        {
            "question": {"text": "Pick one"},
            "answers": [
                {"answer_id": 1, "poll_media": {"text": "A"}},
                {"answer_id": 2, "poll_media": {"text": "B", "emoji": {"id": "112233445566778899", "name": "party"}}}
            ],
            "allow_multiselect": false,
            "expiry": "2030-01-01T00:00:00+00:00",
            "results": {
                "is_finalized": true,
                "answer_counts": [
                    {"id": 1, "me_voted": true, "count": 3},
                    {"id": 2, "me_voted": false, "count": 1}
                ]
            }
        }
        """;

    @Mock
    private ChatApiClient chatApiClient;

    private ObjectMapper objectMapper;
    private ConnectionState state;
    private Message message;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        state = new ConnectionState(chatApiClient);
        message = new Message(state, MESSAGE_ID, CHANNEL_ID, "", null);
    }

    private Poll receivedPoll(String json) throws Exception {
        return Poll.fromPayload(objectMapper.readValue(json, PollPayload.class), message, state);
    }

    @Nested
    @DisplayName("draft polls")
    class DraftPollTests {

        @ParameterizedTest
        @ValueSource(ints = {1, 4, 8, 24, 72, 168})
        void constructor_SetsExpiryFromDuration(int hours) {
            // Given
            OffsetDateTime before = OffsetDateTime.now(ZoneOffset.UTC);

            // When
            Poll poll = new Poll("Lunch?", hours);

            // Then
            OffsetDateTime after = OffsetDateTime.now(ZoneOffset.UTC);
            assertThat(poll.getExpiry()).isBetween(before.plusHours(hours), after.plusHours(hours));
            assertThat(poll.getDuration()).isEqualTo(hours);
        }

        @Test
        void constructor_Defaults() {
            // When
            Poll poll = new Poll("Lunch?", 24);

            // Then
            assertThat(poll.getQuestion()).isEqualTo("Lunch?");
            assertThat(poll.isMultiselect()).isFalse();
            assertThat(poll.getLayoutType()).isEqualTo(PollLayoutType.DEFAULT);
            assertThat(poll.getAnswers()).isEmpty();
            assertThat(poll.getMessage()).isNull();
            assertThat(poll.isFinalized()).isFalse();
            assertThat(poll.getAnswerCounts()).isEmpty();
            assertThat(poll.totalVotes()).isZero();
            assertThat(poll.toString()).isEqualTo("Lunch?");
        }

        @Test
        void addAnswer_AssignsSequentialIdsInCallOrder() {
            // Given
            Poll poll = new Poll("Lunch?", 24, true, PollLayoutType.DEFAULT);

            // When
            Poll returned = poll.addAnswer("Pizza", "🍕")
                    .addAnswer("Sushi")
                    .addAnswer("Tacos", new PartialEmoji("taco", 998877665544332211L));

            // Then
            assertThat(returned).isSameAs(poll);
            assertThat(poll.getAnswers()).extracting(PollAnswer::getId).containsExactly(1, 2, 3);
            assertThat(poll.getAnswers()).extracting(PollAnswer::getText).containsExactly("Pizza", "Sushi", "Tacos");
            assertThat(poll.getAnswers()).extracting(PollAnswer::getMessage).containsOnlyNulls();
            assertThat(poll.getAnswer(1).orElseThrow().getEmoji().getName()).isEqualTo("🍕");
            assertThat(poll.getAnswer(2).orElseThrow().getEmoji()).isNull();
        }

        @Test
        void getAnswer_InRange_ReturnsAnswerAtPosition() {
            // Given
            Poll poll = new Poll("Lunch?", 24).addAnswer("Pizza").addAnswer("Sushi");

            // Then
            assertThat(poll.getAnswer(1)).hasValueSatisfying(a -> assertThat(a.getText()).isEqualTo("Pizza"));
            assertThat(poll.getAnswer(2)).hasValueSatisfying(a -> assertThat(a.getText()).isEqualTo("Sushi"));
        }

        @Test
        void getAnswer_OutOfRange_ReturnsEmptyWithoutThrowing() {
            // Given
            Poll poll = new Poll("Lunch?", 24).addAnswer("Pizza").addAnswer("Sushi");

            // Then
            assertThat(poll.getAnswer(3)).isEmpty();
            assertThat(poll.getAnswer(0)).isEmpty();
            assertThat(poll.getAnswer(-1)).isEmpty();
            assertThat(new Poll("Empty", 1).getAnswer(1)).isEmpty();
        }

        @Test
        void getAnswers_ReturnsCopy() {
            // Given
            Poll poll = new Poll("Lunch?", 24).addAnswer("Pizza");

            // When
            List<PollAnswer> answers = poll.getAnswers();
            answers.clear();

            // Then
            assertThat(poll.getAnswers()).hasSize(1);
        }

        @Test
        void toPayload_OmitsAnswerIds() throws Exception {
            // Given
            Poll poll = new Poll("Lunch?", 8, true, PollLayoutType.DEFAULT)
                    .addAnswer("Pizza", "🍕")
                    .addAnswer("Party", "<:party:112233445566778899>");

            // When
            PollCreateRequest payload = poll.toPayload();
            String json = objectMapper.writeValueAsString(payload);

            // Then
            assertThat(payload.isAllowMultiselect()).isTrue();
            assertThat(payload.getQuestion().getText()).isEqualTo("Lunch?");
            assertThat(payload.getDuration()).isEqualTo(8);
            assertThat(payload.getLayoutType()).isEqualTo(1);
            assertThat(payload.getAnswers()).hasSize(2);
            assertThat(payload.getAnswers().get(1).getPollMedia().getEmoji().getId()).isEqualTo(112233445566778899L);
            assertThat(json).doesNotContain("answer_id");
            assertThat(json).contains("\"allow_multiselect\":true", "\"layout_type\":1", "\"duration\":8");
        }

        @Test
        void end_WithoutMessage_ThrowsBeforeAnyRequest() {
            // Given
            Poll poll = new Poll("Lunch?", 24).addAnswer("Pizza");

            // When/Then
            assertThatThrownBy(poll::end)
                    .isInstanceOf(UnattachedResourceException.class)
                    .hasMessageContaining("message is present");
            verifyNoInteractions(chatApiClient);
        }

        @Test
        void listVoters_OnDraftAnswer_ThrowsUnattached() {
            // Given
            Poll poll = new Poll("Lunch?", 24).addAnswer("Pizza");

            // When/Then
            assertThatThrownBy(() -> poll.getAnswer(1).orElseThrow().listVoters())
                    .isInstanceOf(UnattachedResourceException.class)
                    .hasMessageContaining("non-message-attached");
            verifyNoInteractions(chatApiClient);
        }
    }

    @Nested
    @DisplayName("received polls")
    class ReceivedPollTests {

        @Test
        void fromPayload_WithResults_ParsesTalliesAndFinalizedFlag() throws Exception {
            // When
            Poll poll = receivedPoll(FINALIZED_POLL_JSON);

            // Then
            assertThat(poll.isFinalized()).isTrue();
            assertThat(poll.getQuestion()).isEqualTo("Pick one");
            assertThat(poll.getMessage()).isSameAs(message);
            assertThat(poll.getExpiry()).isEqualTo(OffsetDateTime.of(2030, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC));
            assertThat(poll.getAnswer(1)).hasValueSatisfying(a -> assertThat(a.getText()).isEqualTo("A"));
            assertThat(poll.getAnswer(2).orElseThrow().getEmoji())
                    .isEqualTo(new PartialEmoji("party", 112233445566778899L));
            assertThat(poll.getAnswerCounts()).hasValueSatisfying(counts -> {
                assertThat(counts).extracting(PollAnswerCount::getCount).containsExactly(3, 1);
                assertThat(counts).extracting(PollAnswerCount::isSelfVoted).containsExactly(true, false);
            });
            assertThat(poll.totalVotes()).isEqualTo(4);
            assertThat(poll.getAnswerCount(2)).hasValueSatisfying(c -> assertThat(c.getCount()).isEqualTo(1));
            assertThat(poll.getAnswerCount(3)).isEmpty();
        }

        @Test
        void fromPayload_WithoutResults_NotFinalizedAndNoTallies() throws Exception {
            // Given
            String json = """
                {
                    "question": {"text": "Tea or coffee?"},
                    "answers": [{"answer_id": 1, "poll_media": {"text": "Tea"}}],
                    "expiry": "2030-06-01T12:30:00.000000+00:00"
                }
                """;

            // When
            Poll poll = receivedPoll(json);

            // Then
            assertThat(poll.isFinalized()).isFalse();
            assertThat(poll.getAnswerCounts()).isEmpty();
            assertThat(poll.isMultiselect()).isFalse();
            assertThat(poll.getLayoutType()).isEqualTo(PollLayoutType.DEFAULT);
            assertThat(poll.getAnswer(1).orElseThrow().getMessage()).isSameAs(message);
        }

        @Test
        void fromPayload_UnknownLayout_Preserved() throws Exception {
            // Given
            String json = """
                {
                    "question": {"text": "Layout?"},
                    "answers": [],
                    "layout_type": 9,
                    "allow_multiselect": true,
                    "expiry": "2030-01-01T00:00:00Z"
                }
                """;

            // When
            Poll poll = receivedPoll(json);

            // Then
            assertThat(poll.getLayoutType().isKnown()).isFalse();
            assertThat(poll.getLayoutType().getValue()).isEqualTo(9);
            assertThat(poll.isMultiselect()).isTrue();
            assertThat(poll.toPayload().getLayoutType()).isEqualTo(9);
        }

        @Test
        void fromPayload_ExpiryWithoutOffset_ReadAsUtc() throws Exception {
            // Given
            String json = """
                {"question": {"text": "Q"}, "answers": [], "expiry": "2030-01-01T00:00:00"}
                """;

            // When
            Poll poll = receivedPoll(json);

            // Then
            assertThat(poll.getExpiry()).isEqualTo(OffsetDateTime.of(2030, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC));
        }

        @Test
        void fromPayload_ExpiryWithOffset_KeepsOffset() throws Exception {
            // Given
            String json = """
                {"question": {"text": "Q"}, "answers": [], "expiry": "2030-01-01T02:00:00.123456+02:00"}
                """;

            // When
            Poll poll = receivedPoll(json);

            // Then
            assertThat(poll.getExpiry().getOffset()).isEqualTo(ZoneOffset.ofHours(2));
            assertThat(poll.getExpiry().toInstant())
                    .isEqualTo(OffsetDateTime.of(2030, 1, 1, 0, 0, 0, 123456000, ZoneOffset.UTC).toInstant());
        }

        @Test
        void toPayload_AfterFromPayload_KeepsQuestionFlagsAndMedia() throws Exception {
            // Given
            Poll poll = receivedPoll(FINALIZED_POLL_JSON);

            // When
            PollCreateRequest payload = poll.toPayload();

            // Then
            assertThat(payload.getQuestion().getText()).isEqualTo("Pick one");
            assertThat(payload.isAllowMultiselect()).isFalse();
            assertThat(payload.getAnswers()).extracting(a -> a.getPollMedia().getText()).containsExactly("A", "B");
            assertThat(payload.getAnswers()).extracting(a -> a.getAnswerId()).containsOnlyNulls();
            assertThat(payload.getAnswers().get(0).getPollMedia().getEmoji()).isNull();
            assertThat(payload.getAnswers().get(1).getPollMedia().getEmoji().getName()).isEqualTo("party");
            assertThat(payload.getAnswers().get(1).getPollMedia().getEmoji().getId()).isEqualTo(112233445566778899L);
        }

        @Test
        void getAnswerCounts_ReturnsCopy() throws Exception {
            // Given
            Poll poll = receivedPoll(FINALIZED_POLL_JSON);

            // When
            poll.getAnswerCounts().orElseThrow().clear();

            // Then
            assertThat(poll.getAnswerCounts()).hasValueSatisfying(counts -> assertThat(counts).hasSize(2));
        }

        @Test
        void addAnswer_OnReceivedPoll_LinksMessage() throws Exception {
            // Given
            Poll poll = receivedPoll(FINALIZED_POLL_JSON);

            // When
            poll.addAnswer("C");

            // Then
            assertThat(poll.getAnswer(3)).hasValueSatisfying(a -> {
                assertThat(a.getId()).isEqualTo(3);
                assertThat(a.getMessage()).isSameAs(message);
            });
        }

        @Test
        void end_ReturnsRefreshedMessageAndLeavesPollUnchanged() throws Exception {
            // Given
            String openJson = """
                {
                    "question": {"text": "Pick one"},
                    "answers": [{"answer_id": 1, "poll_media": {"text": "A"}}],
                    "expiry": "2030-01-01T00:00:00+00:00"
                }
                """;
            Poll poll = receivedPoll(openJson);
            MessagePayload ended = objectMapper.readValue(
                    "{\"id\": \"" + MESSAGE_ID + "\", \"channel_id\": \"" + CHANNEL_ID + "\", \"content\": \"\", \"poll\": "
                            + FINALIZED_POLL_JSON + "}",
                    MessagePayload.class);
            when(chatApiClient.endPoll(CHANNEL_ID, MESSAGE_ID)).thenReturn(CompletableFuture.completedFuture(ended));

            // When
            Message result = poll.end().get();

            // Then
            assertThat(result.getId()).isEqualTo(MESSAGE_ID);
            assertThat(result.getChannelId()).isEqualTo(CHANNEL_ID);
            assertThat(result.getState()).isSameAs(state);
            assertThat(result.getPoll().isFinalized()).isTrue();
            assertThat(result.getPoll().getMessage()).isSameAs(result);
            assertThat(poll.isFinalized()).isFalse();
            assertThat(poll.getAnswerCounts()).isEmpty();
        }

        @Test
        void end_TransportFailure_PropagatesUnchanged() throws Exception {
            // Given
            Poll poll = receivedPoll(FINALIZED_POLL_JSON);
            ChatApiException failure = ChatApiException.fromResponse(403, 50013, "Missing Permissions");
            when(chatApiClient.endPoll(CHANNEL_ID, MESSAGE_ID)).thenReturn(CompletableFuture.failedFuture(failure));

            // When/Then
            assertThatThrownBy(() -> poll.end().get())
                    .isInstanceOf(ExecutionException.class)
                    .hasCause(failure);
        }
    }
}
