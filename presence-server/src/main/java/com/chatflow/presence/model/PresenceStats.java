package com.chatflow.presence.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PresenceStats {

    @JsonProperty("onlineUsers")
    private int onlineUsers;

    @JsonProperty("activeRooms")
    private int activeRooms;

    @JsonProperty("queuedMessages")
    private int queuedMessages;

    @JsonProperty("typingUsers")
    private int typingUsers;

    @JsonProperty("deliveryRecords")
    private int deliveryRecords;
}
