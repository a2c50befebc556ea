package com.bbthechange.chatpolls.model;

import com.bbthechange.chatpolls.client.ConnectionState;
import com.bbthechange.chatpolls.dto.PollAnswerCountPayload;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Server-reported tally for one answer. Only exists on polls read from the API.
 */
public class PollAnswerCount {

    private final ConnectionState state;
    private final Message message;
    private final int id;
    private final boolean selfVoted;
    private final int count;

    public PollAnswerCount(ConnectionState state, Message message, PollAnswerCountPayload data) {
        this.state = state;
        this.message = message;
        this.id = data.getId();
        this.selfVoted = data.isMeVoted();
        this.count = data.getCount();
    }

    /**
     * Answer id this tally is for.
     */
    public int getId() {
        return id;
    }

    /**
     * Whether the current bot user voted for this answer.
     */
    public boolean isSelfVoted() {
        return selfVoted;
    }

    public int getCount() {
        return count;
    }

    public Message getOriginal() {
        return message;
    }

    public Poll getPoll() {
        return message != null ? message.getPoll() : null;
    }

    public CompletableFuture<List<User>> listVoters() {
        return listVoters(null, PollVoters.DEFAULT_LIMIT);
    }

    /**
     * Fetch the users who voted for the answer this tally counts.
     *
     * @param after only return users with an id greater than this, or null
     * @param limit page size, 0-100
     */
    public CompletableFuture<List<User>> listVoters(Long after, int limit) {
        return PollVoters.list(message, state, id, after, limit);
    }

    @Override
    public String toString() {
        return "PollAnswerCount{id=" + id + ", count=" + count + ", selfVoted=" + selfVoted + '}';
    }
}
