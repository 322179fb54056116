package com.chatflow.presence.service;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks who is typing in which room. Each (room, user) pair is either absent (idle) or
 * holds a {@link TypingSession} whose debounce timer returns it to idle when it fires.
 */
@Service
@Slf4j
public class TypingIndicatorTracker {

    // roomId -> userId -> session
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, TypingSession>> sessions =
            new ConcurrentHashMap<>();

    private final TimerScheduler scheduler;
    private final Clock clock;
    private final Duration debounceWindow;

    public TypingIndicatorTracker(TimerScheduler scheduler, Clock clock,
            @Value("${presence.typing.debounce-ms:3000}") long debounceMillis) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.debounceWindow = Duration.ofMillis(debounceMillis);
    }

    /**
     * Idle to Typing arms a timer and returns true. A repeated start while typing resets the
     * timer and returns false.
     *
     * @param onExpire run after the session expired on its own
     */
    public boolean start(String roomId, String userId, Runnable onExpire) {
        ConcurrentHashMap<String, TypingSession> room = sessions.computeIfAbsent(roomId, k -> new ConcurrentHashMap<>());
        TypingSession existing = room.get(userId);
        if (existing != null) {
            existing.timer.reset();
            existing.expiresAt = clock.instant().plus(debounceWindow);
            log.debug("Typing timer reset for user {} in room {}", userId, roomId);
            return false;
        }

        TypingSession session = new TypingSession(roomId, userId);
        session.timer = new DebounceTimer(scheduler, debounceWindow, () -> expire(session, onExpire));
        session.expiresAt = clock.instant().plus(debounceWindow);
        room.put(userId, session);
        session.timer.start();
        log.debug("User {} started typing in room {}", userId, roomId);
        return true;
    }

    /**
     * @return true if the user was typing in the room
     */
    public boolean stop(String roomId, String userId) {
        Map<String, TypingSession> room = sessions.get(roomId);
        if (room == null) {
            return false;
        }
        TypingSession session = room.remove(userId);
        pruneRoom(roomId, room);
        if (session == null) {
            return false;
        }
        session.timer.cancel();
        log.debug("User {} stopped typing in room {}", userId, roomId);
        return true;
    }

    /**
     * Stops every typing session of the user.
     *
     * @return the rooms in which the user was typing
     */
    public Set<String> stopAll(String userId) {
        Set<String> stopped = new HashSet<>();
        for (String roomId : new HashSet<>(sessions.keySet())) {
            if (stop(roomId, userId)) {
                stopped.add(roomId);
            }
        }
        return stopped;
    }

    public boolean isTyping(String roomId, String userId) {
        Map<String, TypingSession> room = sessions.get(roomId);
        return room != null && room.containsKey(userId);
    }

    public Set<String> typingUsers(String roomId) {
        Map<String, TypingSession> room = sessions.get(roomId);
        return room == null ? Collections.emptySet() : new HashSet<>(room.keySet());
    }

    public TypingSession sessionOf(String roomId, String userId) {
        Map<String, TypingSession> room = sessions.get(roomId);
        return room == null ? null : room.get(userId);
    }

    public int activeCount() {
        return sessions.values().stream().mapToInt(Map::size).sum();
    }

    public Duration getDebounceWindow() {
        return debounceWindow;
    }

    private void expire(TypingSession session, Runnable onExpire) {
        Map<String, TypingSession> room = sessions.get(session.roomId);
        if (room == null || !room.remove(session.userId, session)) {
            return;
        }
        pruneRoom(session.roomId, room);
        log.debug("Typing expired for user {} in room {}", session.userId, session.roomId);
        onExpire.run();
    }

    private void pruneRoom(String roomId, Map<String, TypingSession> room) {
        if (room.isEmpty()) {
            sessions.remove(roomId, room);
        }
    }

    /**
     * One user typing in one room.
     */
    @Getter
    public static final class TypingSession {
        private final String roomId;
        private final String userId;
        private volatile Instant expiresAt;
        private DebounceTimer timer;

        private TypingSession(String roomId, String userId) {
            this.roomId = roomId;
            this.userId = userId;
        }
    }
}
