package com.chatflow.presence.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identity bound to a connection once the credential has been resolved.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserIdentity {

    @JsonProperty("userId")
    private String userId;

    @JsonProperty("displayName")
    private String displayName;
}
