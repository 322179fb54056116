package com.chatflow.presence.service;

import com.chatflow.presence.model.ChatMessageEvent;
import com.chatflow.presence.model.QueuedMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-recipient bounded FIFO of messages addressed to offline users. When a queue is full
 * the oldest message is evicted and never delivered; memory stays bounded at the cost of
 * losing messages for users who stay offline long enough.
 */
@Service
@Slf4j
public class OfflineDeliveryQueue {

    private final ConcurrentHashMap<String, Deque<QueuedMessage>> queues = new ConcurrentHashMap<>();

    private final Clock clock;
    private final int capacity;

    private final AtomicLong messagesQueued = new AtomicLong(0);
    private final AtomicLong messagesEvicted = new AtomicLong(0);

    public OfflineDeliveryQueue(Clock clock, @Value("${presence.offline-queue.capacity:100}") int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Offline queue capacity must be positive: " + capacity);
        }
        this.clock = clock;
        this.capacity = capacity;
    }

    /**
     * Appends to the tail of the user's queue.
     *
     * @return true if the oldest message had to be evicted
     */
    public boolean enqueue(String userId, ChatMessageEvent message) {
        QueuedMessage queued = new QueuedMessage(userId, message, clock.instant());
        boolean[] evicted = new boolean[1];

        queues.compute(userId, (k, queue) -> {
            Deque<QueuedMessage> q = queue != null ? queue : new ArrayDeque<>();
            synchronized (q) {
                q.addLast(queued);
                evicted[0] = trimToCapacity(userId, q);
            }
            return q;
        });

        messagesQueued.incrementAndGet();
        log.debug("Message {} queued for offline user {}", message.getId(), userId);
        return evicted[0];
    }

    /**
     * Removes and returns the user's whole queue, oldest first.
     */
    public List<QueuedMessage> drain(String userId) {
        Deque<QueuedMessage> queue = queues.remove(userId);
        if (queue == null) {
            return Collections.emptyList();
        }
        synchronized (queue) {
            return new ArrayList<>(queue);
        }
    }

    /**
     * Puts messages that were drained but could not be pushed back at the head of the queue,
     * ahead of anything queued since, keeping their original queue time.
     */
    public void restore(String userId, List<QueuedMessage> undelivered) {
        if (undelivered.isEmpty()) {
            return;
        }
        queues.compute(userId, (k, queue) -> {
            Deque<QueuedMessage> q = queue != null ? queue : new ArrayDeque<>();
            synchronized (q) {
                for (int i = undelivered.size() - 1; i >= 0; i--) {
                    q.addFirst(undelivered.get(i));
                }
                trimToCapacity(userId, q);
            }
            return q;
        });
        log.debug("Restored {} undelivered messages for user {}", undelivered.size(), userId);
    }

    public int sizeOf(String userId) {
        Deque<QueuedMessage> queue = queues.get(userId);
        if (queue == null) {
            return 0;
        }
        synchronized (queue) {
            return queue.size();
        }
    }

    public int totalQueued() {
        int total = 0;
        for (Deque<QueuedMessage> queue : queues.values()) {
            synchronized (queue) {
                total += queue.size();
            }
        }
        return total;
    }

    private boolean trimToCapacity(String userId, Deque<QueuedMessage> q) {
        boolean evicted = false;
        while (q.size() > capacity) {
            QueuedMessage dropped = q.pollFirst();
            evicted = true;
            messagesEvicted.incrementAndGet();
            log.debug("Offline queue for user {} full, evicted message {}", userId, dropped.getPayload().getId());
        }
        return evicted;
    }

    public int getCapacity() {
        return capacity;
    }

    public long getMessagesQueued() {
        return messagesQueued.get();
    }

    public long getMessagesEvicted() {
        return messagesEvicted.get();
    }
}
