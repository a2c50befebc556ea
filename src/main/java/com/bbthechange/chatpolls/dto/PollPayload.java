package com.bbthechange.chatpolls.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Poll as received inside a message payload.
 * Maps {"question": {...}, "answers": [...], "expiry": "...", "results": {...}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PollPayload {

    private PollMediaPayload question;

    private List<PollAnswerPayload> answers;

    /**
     * ISO 8601 timestamp (e.g., "2030-01-01T00:00:00.000000+00:00").
     */
    private String expiry;

    @JsonProperty("allow_multiselect")
    private Boolean allowMultiselect;

    @JsonProperty("layout_type")
    private Integer layoutType;

    private PollResultsPayload results;
}
