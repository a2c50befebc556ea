package com.bbthechange.chatpolls.client;

/**
 * Session handle shared by every object rebuilt from an API payload.
 * Attached polls, answers and tallies reach the REST API through it.
 */
public class ConnectionState {

    private final ChatApiClient http;

    public ConnectionState(ChatApiClient http) {
        this.http = http;
    }

    public ChatApiClient getHttp() {
        return http;
    }
}
