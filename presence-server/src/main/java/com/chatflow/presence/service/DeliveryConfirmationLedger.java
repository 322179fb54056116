package com.chatflow.presence.service;

import com.chatflow.presence.model.DeliveryRecord;
import com.chatflow.presence.model.DeliveryStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Delivery and read state per (message, recipient). One message sent to many recipients
 * yields one independent record per recipient. Records are in-memory only and expire after
 * the retention window enforced by the health monitor.
 */
@Service
@Slf4j
public class DeliveryConfirmationLedger {

    // messageId -> recipientUserId -> record
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, DeliveryRecord>> records =
            new ConcurrentHashMap<>();

    private final Clock clock;

    public DeliveryConfirmationLedger(Clock clock) {
        this.clock = clock;
    }

    /**
     * Creates or overwrites the record with status DELIVERED.
     */
    public void markDelivered(String messageId, String recipientUserId) {
        DeliveryRecord record = DeliveryRecord.builder()
                .messageId(messageId)
                .recipientUserId(recipientUserId)
                .status(DeliveryStatus.DELIVERED)
                .statusAt(clock.instant())
                .build();
        records.computeIfAbsent(messageId, k -> new ConcurrentHashMap<>()).put(recipientUserId, record);
        log.debug("Message {} delivered to {}", messageId, recipientUserId);
    }

    /**
     * Moves an existing record to READ. Without a prior record (for example after a restart)
     * nothing is created.
     *
     * @return true if a record was updated
     */
    public boolean markRead(String messageId, String recipientUserId) {
        Map<String, DeliveryRecord> byRecipient = records.get(messageId);
        if (byRecipient == null) {
            log.debug("No delivery record for message {}, ignoring read by {}", messageId, recipientUserId);
            return false;
        }
        DeliveryRecord updated = byRecipient.computeIfPresent(recipientUserId, (k, record) -> record.toBuilder()
                .status(DeliveryStatus.READ)
                .statusAt(clock.instant())
                .build());
        return updated != null;
    }

    public List<DeliveryRecord> statusesFor(String messageId) {
        Map<String, DeliveryRecord> byRecipient = messageId == null ? null : records.get(messageId);
        return byRecipient == null ? Collections.emptyList() : new ArrayList<>(byRecipient.values());
    }

    public DeliveryRecord statusOf(String messageId, String recipientUserId) {
        Map<String, DeliveryRecord> byRecipient = records.get(messageId);
        return byRecipient == null ? null : byRecipient.get(recipientUserId);
    }

    /**
     * Removes every record whose last status change is older than {@code maxAge}.
     *
     * @return number of records removed
     */
    public int pruneOlderThan(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;

        Iterator<Map.Entry<String, ConcurrentHashMap<String, DeliveryRecord>>> it = records.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, ConcurrentHashMap<String, DeliveryRecord>> entry = it.next();
            ConcurrentHashMap<String, DeliveryRecord> byRecipient = entry.getValue();
            int before = byRecipient.size();
            byRecipient.values().removeIf(record -> record.getStatusAt().isBefore(cutoff));
            removed += before - byRecipient.size();
            if (byRecipient.isEmpty()) {
                records.remove(entry.getKey(), byRecipient);
            }
        }

        if (removed > 0) {
            log.debug("Pruned {} delivery records older than {}", removed, cutoff);
        }
        return removed;
    }

    public int size() {
        return records.values().stream().mapToInt(Map::size).sum();
    }
}
