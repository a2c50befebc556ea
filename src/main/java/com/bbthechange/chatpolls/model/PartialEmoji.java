package com.bbthechange.chatpolls.model;

import com.bbthechange.chatpolls.dto.PollEmojiPayload;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minimal emoji identity: a custom emoji when {@code id} is set, a unicode emoji otherwise.
 */
public final class PartialEmoji {

    private static final Pattern CUSTOM_EMOJI = Pattern.compile("<?(?:(a)?:)?([A-Za-z0-9_~]+):([0-9]{13,20})>?");

    private final Long id;
    private final String name;
    private final boolean animated;

    public PartialEmoji(String name) {
        this(name, null, false);
    }

    public PartialEmoji(String name, Long id) {
        this(name, id, false);
    }

    public PartialEmoji(String name, Long id, boolean animated) {
        this.name = name;
        this.id = id;
        this.animated = animated;
    }

    /**
     * Parse chat markup such as {@code <:party:112233445566778899>} or {@code <a:dance:...>}.
     * The angle brackets and leading colon are optional, so {@code party:1122...} parses too.
     * Anything that does not look like custom emoji markup is taken as a unicode emoji name.
     */
    public static PartialEmoji fromString(String value) {
        Matcher matcher = CUSTOM_EMOJI.matcher(value);
        if (matcher.matches()) {
            return new PartialEmoji(matcher.group(2), Long.parseLong(matcher.group(3)), matcher.group(1) != null);
        }
        return new PartialEmoji(value);
    }

    public static PartialEmoji fromPayload(PollEmojiPayload payload) {
        return new PartialEmoji(payload.getName(), payload.getId(), Boolean.TRUE.equals(payload.getAnimated()));
    }

    /**
     * Name is always sent, id only for custom emoji.
     */
    public PollEmojiPayload toPayload() {
        PollEmojiPayload.PollEmojiPayloadBuilder builder = PollEmojiPayload.builder().name(name);
        if (id != null) {
            builder.id(id);
        }
        return builder.build();
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public boolean isAnimated() {
        return animated;
    }

    public boolean isCustomEmoji() {
        return id != null;
    }

    public boolean isUnicodeEmoji() {
        return id == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PartialEmoji)) return false;
        PartialEmoji that = (PartialEmoji) o;
        return animated == that.animated && Objects.equals(id, that.id) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, animated);
    }

    @Override
    public String toString() {
        if (id == null) {
            return name;
        }
        return (animated ? "<a:" : "<:") + name + ":" + id + ">";
    }
}
