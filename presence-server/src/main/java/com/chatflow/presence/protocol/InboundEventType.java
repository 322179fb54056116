package com.chatflow.presence.protocol;

import java.util.HashMap;
import java.util.Map;

/**
 * Events a client may send over its channel.
 */
public enum InboundEventType {
    JOIN_ROOM("join_room"),
    LEAVE_ROOM("leave_room"),
    SEND_MESSAGE("send_message"),
    TYPING_START("typing_start"),
    TYPING_STOP("typing_stop"),
    ADD_REACTION("add_reaction"),
    REMOVE_REACTION("remove_reaction"),
    EDIT_MESSAGE("edit_message"),
    DELETE_MESSAGE("delete_message"),
    MARK_READ("mark_read"),
    MESSAGE_DELIVERED("message_delivered"),
    STATUS_UPDATE("status_update"),
    PING("ping");

    private static final Map<String, InboundEventType> BY_WIRE_NAME = new HashMap<>();

    static {
        for (InboundEventType type : values()) {
            BY_WIRE_NAME.put(type.wireName, type);
        }
    }

    private final String wireName;

    InboundEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * @return the matching type, or null for an unknown event name
     */
    public static InboundEventType fromWireName(String name) {
        return name == null ? null : BY_WIRE_NAME.get(name);
    }
}
