package com.chatflow.presence.channel;

import com.chatflow.presence.protocol.OutboundEvent;

/**
 * Outbound side of one connected user's bidirectional channel.
 */
public interface UserChannel {

    String getId();

    boolean isOpen();

    /**
     * Hands the event to the transport.
     *
     * @return false if the channel is closed or the write could not be accepted
     */
    boolean send(OutboundEvent event);

    void close(String reason);
}
