package com.chatflow.presence.service;

import com.chatflow.presence.channel.UserChannel;
import com.chatflow.presence.model.Connection;
import com.chatflow.presence.model.UserIdentity;
import com.chatflow.presence.protocol.OutboundEvent;
import com.chatflow.presence.protocol.OutboundEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Maps a user to its live channel. The single source of truth for "is this user online";
 * no other component caches liveness.
 */
@Service
@Slf4j
public class ConnectionRegistry {

    private final ConcurrentHashMap<String, Connection> connections = new ConcurrentHashMap<>();

    private final Clock clock;

    private final AtomicLong eventsSent = new AtomicLong(0);
    private final AtomicLong sendFailures = new AtomicLong(0);

    public ConnectionRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Registers the channel for the user, replacing any existing connection.
     * Closing the replaced channel is the caller's responsibility.
     *
     * @return the replaced connection, or null
     */
    public Connection register(UserIdentity identity, UserChannel channel) {
        Connection connection = new Connection(identity, channel, clock.instant());
        Connection previous = connections.put(identity.getUserId(), connection);
        if (previous != null) {
            log.info("User {} reconnected, replacing channel {} with {}",
                    identity.getUserId(), previous.getChannel().getId(), channel.getId());
        } else {
            log.debug("Registered user {} on channel {}", identity.getUserId(), channel.getId());
        }
        return previous;
    }

    public void unregister(String userId) {
        if (connections.remove(userId) != null) {
            log.debug("Unregistered user {}", userId);
        }
    }

    /**
     * Removes the user only while the given channel is the registered one, so that the
     * close of a superseded channel cannot evict its replacement.
     */
    public boolean unregisterIfCurrent(String userId, UserChannel channel) {
        Connection current = connections.get(userId);
        if (current == null || current.getChannel() != channel) {
            return false;
        }
        boolean removed = connections.remove(userId, current);
        if (removed) {
            log.debug("Unregistered user {} from channel {}", userId, channel.getId());
        }
        return removed;
    }

    public boolean isOnline(String userId) {
        return userId != null && connections.containsKey(userId);
    }

    public Connection connectionOf(String userId) {
        return userId == null ? null : connections.get(userId);
    }

    /**
     * Sends an event to the user's channel. Never throws: an absent user, a closed channel or
     * a failed write all count as "not delivered" and the caller decides whether to queue.
     */
    public boolean send(String userId, OutboundEventType type, Object payload) {
        Connection connection = connectionOf(userId);
        if (connection == null) {
            return false;
        }

        UserChannel channel = connection.getChannel();
        try {
            if (channel.isOpen() && channel.send(OutboundEvent.of(type, payload))) {
                eventsSent.incrementAndGet();
                return true;
            }
            log.debug("Channel {} of user {} did not accept {}", channel.getId(), userId, type.getWireName());
        } catch (Exception e) {
            log.warn("Send of {} to user {} failed: {}", type.getWireName(), userId, e.getMessage());
        }
        sendFailures.incrementAndGet();
        return false;
    }

    public Set<String> listOnline() {
        return new HashSet<>(connections.keySet());
    }

    public List<Connection> connections() {
        return new ArrayList<>(connections.values());
    }

    public int onlineCount() {
        return connections.size();
    }

    public long getEventsSent() {
        return eventsSent.get();
    }

    public long getSendFailures() {
        return sendFailures.get();
    }
}
