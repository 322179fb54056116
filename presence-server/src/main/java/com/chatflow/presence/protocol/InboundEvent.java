package com.chatflow.presence.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope of every frame a client sends: {"event": ..., "ackId": ..., "data": ...}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InboundEvent {

    @JsonProperty("event")
    private String event;

    @JsonProperty("ackId")
    private String ackId; // optional, echoed back on the ack

    @JsonProperty("data")
    private JsonNode data;
}
