package com.chatflow.presence.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bidirectional user/room membership for the lifetime of a user's connection.
 * Both directions are updated under one private lock so they always agree.
 */
@Service
@Slf4j
public class RoomMembershipIndex {

    // roomId -> userIds
    private final ConcurrentHashMap<String, Set<String>> roomMembers = new ConcurrentHashMap<>();

    // userId -> roomIds
    private final ConcurrentHashMap<String, Set<String>> userRooms = new ConcurrentHashMap<>();

    private final Object lock = new Object();

    /**
     * @return true if the user was not already a member
     */
    public boolean join(String userId, String roomId) {
        synchronized (lock) {
            boolean added = roomMembers.computeIfAbsent(roomId, k -> ConcurrentHashMap.newKeySet()).add(userId);
            userRooms.computeIfAbsent(userId, k -> ConcurrentHashMap.newKeySet()).add(roomId);
            log.debug("User {} joined room {} (new={})", userId, roomId, added);
            return added;
        }
    }

    /**
     * @return true if the user was a member
     */
    public boolean leave(String userId, String roomId) {
        synchronized (lock) {
            boolean removed = removeFrom(roomMembers, roomId, userId);
            removeFrom(userRooms, userId, roomId);
            if (removed) {
                log.debug("User {} left room {}", userId, roomId);
            }
            return removed;
        }
    }

    /**
     * Drops every membership of the user.
     *
     * @return the rooms the user belonged to
     */
    public Set<String> dropAll(String userId) {
        synchronized (lock) {
            Set<String> rooms = userRooms.remove(userId);
            if (rooms == null) {
                return Collections.emptySet();
            }
            for (String roomId : rooms) {
                removeFrom(roomMembers, roomId, userId);
            }
            log.debug("Dropped {} room memberships for user {}", rooms.size(), userId);
            return new HashSet<>(rooms);
        }
    }

    public Set<String> membersOf(String roomId) {
        Set<String> members = roomId == null ? null : roomMembers.get(roomId);
        return members == null ? Collections.emptySet() : new HashSet<>(members);
    }

    public Set<String> roomsOf(String userId) {
        Set<String> rooms = userId == null ? null : userRooms.get(userId);
        return rooms == null ? Collections.emptySet() : new HashSet<>(rooms);
    }

    public boolean isMember(String userId, String roomId) {
        Set<String> members = roomMembers.get(roomId);
        return members != null && members.contains(userId);
    }

    /**
     * Number of rooms with at least one member.
     */
    public int roomCount() {
        return roomMembers.size();
    }

    // Empty sets are removed so rooms without members do not accumulate.
    private static boolean removeFrom(ConcurrentHashMap<String, Set<String>> index, String key, String value) {
        Set<String> values = index.get(key);
        if (values == null) {
            return false;
        }
        boolean removed = values.remove(value);
        if (values.isEmpty()) {
            index.remove(key, values);
        }
        return removed;
    }
}
