package com.bbthechange.chatpolls.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Vote tally for a single answer inside {@code results.answer_counts}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PollAnswerCountPayload {

    /**
     * Answer id this tally belongs to.
     */
    private Integer id;

    @JsonProperty("me_voted")
    private boolean meVoted;

    private int count;
}
