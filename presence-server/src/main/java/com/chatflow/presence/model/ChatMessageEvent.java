package com.chatflow.presence.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of an outbound {@code new_message} event.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatMessageEvent {

    public static final String STATUS_SENT = "sent";
    public static final String STATUS_DELIVERED_FROM_QUEUE = "delivered_from_queue";

    @JsonProperty("id")
    private String id;

    @JsonProperty("roomId")
    private String roomId;

    @JsonProperty("content")
    private String content;

    @JsonProperty("type")
    private String type;

    @JsonProperty("sender")
    private UserIdentity sender;

    @JsonProperty("timestamp")
    private String timestamp; // ISO-8601 format

    @JsonProperty("deliveryStatus")
    private String deliveryStatus;

    @JsonProperty("queuedAt")
    private String queuedAt;
}
