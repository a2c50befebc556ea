package com.bbthechange.chatpolls.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Results section of a received poll. Absent until the platform reports tallies.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PollResultsPayload {

    @JsonProperty("is_finalized")
    private boolean finalized;

    @JsonProperty("answer_counts")
    private List<PollAnswerCountPayload> answerCounts;
}
