package com.bbthechange.chatpolls.model;

import com.bbthechange.chatpolls.dto.PollMediaPayload;

import java.util.Objects;

/**
 * Display content of a poll answer: text (up to 55 characters) and an optional emoji.
 */
public final class PollMedia {

    private final String text;
    private final PartialEmoji emoji;

    public PollMedia(String text, PartialEmoji emoji) {
        this.text = text;
        this.emoji = emoji;
    }

    public static PollMedia fromPayload(PollMediaPayload payload) {
        PartialEmoji emoji = payload.getEmoji() != null ? PartialEmoji.fromPayload(payload.getEmoji()) : null;
        return new PollMedia(payload.getText(), emoji);
    }

    public PollMediaPayload toPayload() {
        return PollMediaPayload.builder()
                .text(text)
                .emoji(emoji != null ? emoji.toPayload() : null)
                .build();
    }

    public String getText() {
        return text;
    }

    public PartialEmoji getEmoji() {
        return emoji;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PollMedia)) return false;
        PollMedia that = (PollMedia) o;
        return Objects.equals(text, that.text) && Objects.equals(emoji, that.emoji);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, emoji);
    }

    @Override
    public String toString() {
        return "PollMedia{text='" + text + "', emoji=" + emoji + '}';
    }
}
