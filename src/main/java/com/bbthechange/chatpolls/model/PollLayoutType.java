package com.bbthechange.chatpolls.model;

import java.util.Objects;

/**
 * Presentation style of a poll.
 * Values the library does not know yet are kept as-is so they survive a read and re-send.
 */
public final class PollLayoutType {

    public static final PollLayoutType DEFAULT = new PollLayoutType(1, "DEFAULT");

    private final int value;
    private final String name;

    private PollLayoutType(int value, String name) {
        this.value = value;
        this.name = name;
    }

    /**
     * Lenient lookup: unknown values map to an unrecognized layout carrying the raw value.
     */
    public static PollLayoutType fromValue(int value) {
        if (value == DEFAULT.value) {
            return DEFAULT;
        }
        return new PollLayoutType(value, null);
    }

    public int getValue() {
        return value;
    }

    /**
     * Name of a known layout, or "UNKNOWN_{value}".
     */
    public String getName() {
        return name != null ? name : "UNKNOWN_" + value;
    }

    public boolean isKnown() {
        return name != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PollLayoutType)) return false;
        return value == ((PollLayoutType) o).value;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return getName();
    }
}
