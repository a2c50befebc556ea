package com.bbthechange.chatpolls.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One poll answer on the wire.
 * Inbound answers carry {@code answer_id}; outbound answers leave it null so it is omitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PollAnswerPayload {

    @JsonProperty("answer_id")
    private Integer answerId;

    @JsonProperty("poll_media")
    private PollMediaPayload pollMedia;
}
