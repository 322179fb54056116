package com.chatflow.presence.protocol;

/**
 * Events the server pushes to clients.
 */
public enum OutboundEventType {
    NEW_MESSAGE("new_message"),
    USER_JOINED("user_joined"),
    USER_LEFT("user_left"),
    USER_OFFLINE("user_offline"),
    TYPING_START("typing_start"),
    TYPING_STOP("typing_stop"),
    REACTION_ADDED("reaction_added"),
    REACTION_REMOVED("reaction_removed"),
    MESSAGE_EDITED("message_edited"),
    MESSAGE_DELETED("message_deleted"),
    MESSAGE_READ("message_read"),
    STATUS_UPDATE("status_update"),
    MESSAGE_DELIVERY_CONFIRMED("message_delivery_confirmed"),
    ERROR("error"),
    // reply correlated with the ackId of an inbound event
    ACK("ack");

    private final String wireName;

    OutboundEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
