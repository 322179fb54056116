package com.chatflow.presence.service;

import com.chatflow.presence.model.Connection;
import com.chatflow.presence.model.PresenceStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Background safety net for state a disconnect handler never cleaned up. Periodically drops
 * registry entries whose channel is no longer open (abrupt network loss without a close
 * frame) and prunes expired delivery records. Both sweeps run on the presence loop and only
 * remove entries that are already dead or expired.
 */
@Service
@Slf4j
public class HealthMonitor {

    private final PresenceEventLoop eventLoop;
    private final ConnectionRegistry registry;
    private final DeliveryConfirmationLedger ledger;
    private final PresenceCoordinator coordinator;

    @Value("${presence.health.connection-sweep-interval-ms:30000}")
    private long connectionSweepIntervalMs = 30_000;

    @Value("${presence.health.ledger-prune-interval-ms:300000}")
    private long ledgerPruneIntervalMs = 300_000;

    @Value("${presence.ledger.retention-ms:3600000}")
    private long ledgerRetentionMs = 3_600_000;

    @Value("${presence.health.enabled:true}")
    private boolean enabled = true;

    private final List<TimerScheduler.ScheduledTask> sweeps = new ArrayList<>();

    private final AtomicLong staleConnectionsRemoved = new AtomicLong(0);
    private final AtomicLong deliveryRecordsPruned = new AtomicLong(0);

    public HealthMonitor(PresenceEventLoop eventLoop, ConnectionRegistry registry,
            DeliveryConfirmationLedger ledger, PresenceCoordinator coordinator) {
        this.eventLoop = eventLoop;
        this.registry = registry;
        this.ledger = ledger;
        this.coordinator = coordinator;
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("Health monitor is disabled");
            return;
        }

        Duration sweepInterval = Duration.ofMillis(connectionSweepIntervalMs);
        Duration pruneInterval = Duration.ofMillis(ledgerPruneIntervalMs);
        sweeps.add(eventLoop.scheduleAtFixedRate("connection-sweep", this::sweepConnections,
                sweepInterval, sweepInterval));
        sweeps.add(eventLoop.scheduleAtFixedRate("ledger-prune", this::pruneDeliveryRecords,
                pruneInterval, pruneInterval));

        log.info("Health monitor started: connection sweep every {}ms, ledger prune every {}ms, retention {}ms",
                connectionSweepIntervalMs, ledgerPruneIntervalMs, ledgerRetentionMs);
    }

    /**
     * Unregisters every connection whose channel is no longer open.
     *
     * @return number of connections removed
     */
    public int sweepConnections() {
        int removed = 0;
        for (Connection connection : registry.connections()) {
            if (connection.getChannel().isOpen()) {
                continue;
            }
            if (registry.unregisterIfCurrent(connection.getUserId(), connection.getChannel())) {
                removed++;
                log.info("Detected dead channel {} for user {}, removed from registry",
                        connection.getChannel().getId(), connection.getUserId());
            }
        }
        staleConnectionsRemoved.addAndGet(removed);

        PresenceStats stats = coordinator.stats();
        log.debug("Connection sweep removed {}: online={}, rooms={}, queued={}, typing={}, records={}",
                removed, stats.getOnlineUsers(), stats.getActiveRooms(), stats.getQueuedMessages(),
                stats.getTypingUsers(), stats.getDeliveryRecords());
        return removed;
    }

    /**
     * Removes delivery records older than the retention window, read or not.
     *
     * @return number of records removed
     */
    public int pruneDeliveryRecords() {
        int removed = ledger.pruneOlderThan(Duration.ofMillis(ledgerRetentionMs));
        deliveryRecordsPruned.addAndGet(removed);
        if (removed > 0) {
            log.info("Pruned {} expired delivery records", removed);
        }
        return removed;
    }

    @PreDestroy
    public void stop() {
        sweeps.forEach(TimerScheduler.ScheduledTask::cancel);
        sweeps.clear();
        log.info("Health monitor stopped");
    }

    public long getStaleConnectionsRemoved() {
        return staleConnectionsRemoved.get();
    }

    public long getDeliveryRecordsPruned() {
        return deliveryRecordsPruned.get();
    }
}
