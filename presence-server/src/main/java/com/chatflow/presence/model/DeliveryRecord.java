package com.chatflow.presence.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryRecord {

    @JsonProperty("messageId")
    private String messageId;

    @JsonProperty("recipientUserId")
    private String recipientUserId;

    @JsonProperty("status")
    private DeliveryStatus status;

    @JsonProperty("statusAt")
    private Instant statusAt;
}
