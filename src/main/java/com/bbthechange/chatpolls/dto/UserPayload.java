package com.bbthechange.chatpolls.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial user object returned by the voters endpoint and as a message author.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserPayload {

    private Long id;

    private String username;

    @JsonProperty("global_name")
    private String globalName;

    private String discriminator;

    /**
     * Avatar hash, null when the user has the default avatar.
     */
    private String avatar;

    private Boolean bot;
}
