package com.bbthechange.chatpolls.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Subset of a message payload needed to rebuild a message that carries a poll.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MessagePayload {

    private Long id;

    @JsonProperty("channel_id")
    private Long channelId;

    private String content;

    private UserPayload author;

    private PollPayload poll;
}
