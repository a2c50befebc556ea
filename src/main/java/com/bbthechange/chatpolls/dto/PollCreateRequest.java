package com.bbthechange.chatpolls.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Poll body submitted along with a new message.
 * Answer ids are assigned by the platform, so answers only carry their media.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PollCreateRequest {

    @JsonProperty("allow_multiselect")
    private boolean allowMultiselect;

    private PollMediaPayload question;

    /**
     * Duration in hours.
     */
    private int duration;

    @JsonProperty("layout_type")
    private int layoutType;

    private List<PollAnswerPayload> answers;
}
