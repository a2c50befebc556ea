package com.bbthechange.chatpolls.model;

import com.bbthechange.chatpolls.client.ConnectionState;
import com.bbthechange.chatpolls.exception.UnattachedResourceException;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Voter lookup shared by answers and answer tallies.
 */
final class PollVoters {

    static final int DEFAULT_LIMIT = 25;
    static final int MAX_LIMIT = 100;

    private PollVoters() {
    }

    /**
     * Argument and attachment checks throw before any request is made.
     */
    static CompletableFuture<List<User>> list(Message message, ConnectionState state,
                                              int answerId, Long after, int limit) {
        if (message == null || state == null) {
            throw new UnattachedResourceException("You cannot fetch users in a non-message-attached poll");
        }
        if (limit < 0 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit can only be within 0 and " + MAX_LIMIT + ", got " + limit);
        }

        return state.getHttp()
                .getPollAnswerVoters(message.getChannelId(), message.getId(), answerId, after, limit)
                .thenApply(response -> response.getUsers() == null
                        ? List.<User>of()
                        : response.getUsers().stream()
                                .map(user -> new User(state, user))
                                .collect(Collectors.toList()));
    }
}
