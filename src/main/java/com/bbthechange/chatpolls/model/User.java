package com.bbthechange.chatpolls.model;

import com.bbthechange.chatpolls.client.ConnectionState;
import com.bbthechange.chatpolls.dto.UserPayload;

import java.util.Objects;

/**
 * Minimal user record as returned in voter lists and message authors.
 */
public class User {

    private final ConnectionState state;
    private final long id;
    private final String name;
    private final String globalName;
    private final String discriminator;
    private final String avatar;
    private final boolean bot;

    public User(ConnectionState state, UserPayload data) {
        this.state = state;
        this.id = data.getId();
        this.name = data.getUsername();
        this.globalName = data.getGlobalName();
        this.discriminator = data.getDiscriminator() != null ? data.getDiscriminator() : "0";
        this.avatar = data.getAvatar();
        this.bot = Boolean.TRUE.equals(data.getBot());
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getGlobalName() {
        return globalName;
    }

    public String getDiscriminator() {
        return discriminator;
    }

    public String getAvatar() {
        return avatar;
    }

    public boolean isBot() {
        return bot;
    }

    /**
     * Global display name when the user set one, otherwise the username.
     */
    public String getDisplayName() {
        return globalName != null ? globalName : name;
    }

    public String getMention() {
        return "<@" + id + ">";
    }

    public ConnectionState getState() {
        return state;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof User)) return false;
        return id == ((User) o).id;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "User{id=" + id + ", name='" + name + "'}";
    }
}
