package com.bbthechange.chatpolls.model;

import com.bbthechange.chatpolls.client.ConnectionState;
import com.bbthechange.chatpolls.dto.PollAnswerPayload;
import com.bbthechange.chatpolls.dto.PollMediaPayload;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * One selectable option of a poll, identified by its 1-based position.
 *
 * Answers of a received poll keep a reference to the message so voters can be listed.
 * Answers added to a locally built poll have no message until the poll is sent and fetched again.
 */
public class PollAnswer {

    private final int id;
    private final PollMedia media;
    private final Message message;
    private final ConnectionState state;

    private PollAnswer(int id, PollMedia media, Message message) {
        this.id = id;
        this.media = media;
        this.message = message;
        this.state = message != null ? message.getState() : null;
    }

    /**
     * Parse {"answer_id": 1, "poll_media": {"text": ..., "emoji": {...}}}.
     *
     * @param message owning message, or null for an unsent poll
     */
    public static PollAnswer fromPayload(PollAnswerPayload payload, Message message) {
        return new PollAnswer(payload.getAnswerId(), PollMedia.fromPayload(payload.getPollMedia()), message);
    }

    public static PollAnswer fromParams(int id, String text, PartialEmoji emoji, Message message) {
        return new PollAnswer(id, new PollMedia(text, emoji), message);
    }

    /**
     * Same as {@link #fromParams(int, String, PartialEmoji, Message)} with the emoji given as
     * a unicode character or custom emoji markup.
     */
    public static PollAnswer fromParams(int id, String text, String emoji, Message message) {
        PartialEmoji parsed = emoji != null && !emoji.isEmpty() ? PartialEmoji.fromString(emoji) : null;
        return fromParams(id, text, parsed, message);
    }

    /**
     * Media part of this answer. The caller wraps it in {"poll_media": ...}.
     */
    public PollMediaPayload toPayload() {
        return media.toPayload();
    }

    public int getId() {
        return id;
    }

    public PollMedia getMedia() {
        return media;
    }

    public String getText() {
        return media.getText();
    }

    /**
     * @return the answer's emoji, or null when it has none
     */
    public PartialEmoji getEmoji() {
        return media.getEmoji();
    }

    public Message getMessage() {
        return message;
    }

    public CompletableFuture<List<User>> listVoters() {
        return listVoters(null, PollVoters.DEFAULT_LIMIT);
    }

    /**
     * Fetch the users who voted for this answer.
     *
     * @param after only return users with an id greater than this, or null
     * @param limit page size, 0-100
     * @throws com.bbthechange.chatpolls.exception.UnattachedResourceException if the poll has no message
     * @throws IllegalArgumentException if limit is out of range
     */
    public CompletableFuture<List<User>> listVoters(Long after, int limit) {
        return PollVoters.list(message, state, id, after, limit);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PollAnswer)) return false;
        return id == ((PollAnswer) o).id;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return media.getText();
    }
}
