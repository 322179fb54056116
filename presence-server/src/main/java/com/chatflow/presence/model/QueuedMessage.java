package com.chatflow.presence.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

/**
 * A chat message waiting in an offline recipient's queue.
 */
@Data
@AllArgsConstructor
public class QueuedMessage {

    private final String recipientUserId;

    private final ChatMessageEvent payload;

    private final Instant queuedAt;
}
