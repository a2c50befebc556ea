package com.bbthechange.chatpolls.model;

import com.bbthechange.chatpolls.client.ConnectionState;
import com.bbthechange.chatpolls.dto.MessagePayload;

/**
 * Message carrying a poll. Only the fields a poll needs to reach the API are modelled.
 */
public class Message {

    private final ConnectionState state;
    private final long id;
    private final long channelId;
    private final String content;
    private final User author;
    private Poll poll;

    public Message(ConnectionState state, long id, long channelId, String content, User author) {
        this.state = state;
        this.id = id;
        this.channelId = channelId;
        this.content = content;
        this.author = author;
    }

    /**
     * Rebuild a message from its payload. The poll, if any, is attached to the new message.
     *
     * @param payload message payload
     * @param channelId channel the message lives in
     * @param state session the message and its poll use for API calls
     */
    public static Message fromPayload(MessagePayload payload, long channelId, ConnectionState state) {
        User author = payload.getAuthor() != null ? new User(state, payload.getAuthor()) : null;
        Message message = new Message(state, payload.getId(), channelId, payload.getContent(), author);
        if (payload.getPoll() != null) {
            message.poll = Poll.fromPayload(payload.getPoll(), message, state);
        }
        return message;
    }

    public ConnectionState getState() {
        return state;
    }

    public long getId() {
        return id;
    }

    public long getChannelId() {
        return channelId;
    }

    public String getContent() {
        return content;
    }

    public User getAuthor() {
        return author;
    }

    /**
     * The message's poll, or null when it has none.
     */
    public Poll getPoll() {
        return poll;
    }

    @Override
    public String toString() {
        return "Message{id=" + id + ", channelId=" + channelId + ", hasPoll=" + (poll != null) + '}';
    }
}
