package com.chatflow.presence.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutboundEvent {

    @JsonProperty("event")
    private String event;

    @JsonProperty("ackId")
    private String ackId;

    @JsonProperty("data")
    private Object data;

    public static OutboundEvent of(OutboundEventType type, Object data) {
        return new OutboundEvent(type.getWireName(), null, data);
    }

    public static OutboundEvent ack(String ackId, Object data) {
        return new OutboundEvent(OutboundEventType.ACK.getWireName(), ackId, data);
    }
}
