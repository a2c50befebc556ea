package com.bbthechange.chatpolls.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response of GET /channels/{channelId}/polls/{messageId}/answers/{answerId}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PollAnswerVotersResponse {

    private List<UserPayload> users;
}
