package com.chatflow.presence.model;

import com.chatflow.presence.channel.UserChannel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * A live connection held by the connection registry.
 */
@Getter
@ToString
@AllArgsConstructor
public class Connection {

    private final UserIdentity identity;

    @ToString.Exclude
    private final UserChannel channel;

    private final Instant connectedAt;

    public String getUserId() {
        return identity.getUserId();
    }
}
