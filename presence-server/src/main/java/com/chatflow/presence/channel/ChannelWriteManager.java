package com.chatflow.presence.channel;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Serializes writes per WebSocket session. Each session gets a bounded outbox that is
 * drained by a shared writer pool; a work-in-progress counter guarantees at most one
 * writer per session at a time, so frames are written in the order they were accepted.
 */
@Service
@Slf4j
public class ChannelWriteManager {

    private final ConcurrentHashMap<String, Outbox> outboxes = new ConcurrentHashMap<>();

    private ExecutorService writerExecutor;

    @Value("${presence.writer.threads:8}")
    private int writerThreads = 8;

    @Value("${presence.writer.queue-capacity:1000}")
    private int queueCapacity = 1000;

    private final AtomicLong framesWritten = new AtomicLong(0);
    private final AtomicLong framesDropped = new AtomicLong(0);
    private final AtomicLong writeErrors = new AtomicLong(0);

    @PostConstruct
    public void init() {
        log.info("Initializing ChannelWriteManager with {} writer threads, outbox capacity {}",
                writerThreads, queueCapacity);
        AtomicInteger counter = new AtomicInteger(0);
        writerExecutor = Executors.newFixedThreadPool(writerThreads, r -> {
            Thread t = new Thread(r, "presence-writer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void registerSession(WebSocketSession session) {
        Outbox previous = outboxes.putIfAbsent(session.getId(), new Outbox(queueCapacity));
        if (previous != null) {
            log.warn("Session {} already registered, keeping existing outbox", session.getId());
            return;
        }
        log.debug("Registered outbox for session {}", session.getId());
    }

    public void unregisterSession(String sessionId) {
        Outbox outbox = outboxes.remove(sessionId);
        if (outbox == null) {
            return;
        }
        outbox.active.set(false);
        int pending = outbox.queue.size();
        if (pending > 0) {
            log.warn("Session {} unregistered with {} frames still pending", sessionId, pending);
            framesDropped.addAndGet(pending);
        }
        log.debug("Unregistered outbox for session {}", sessionId);
    }

    public boolean isActive(String sessionId) {
        Outbox outbox = outboxes.get(sessionId);
        return outbox != null && outbox.active.get();
    }

    /**
     * Queues a frame for the session.
     *
     * @return true if accepted, false if the session is unknown, inactive or its outbox is full
     */
    public boolean sendMessage(WebSocketSession session, String payload) {
        Outbox outbox = outboxes.get(session.getId());
        if (outbox == null || !outbox.active.get()) {
            log.debug("Session {} has no active outbox, dropping frame", session.getId());
            framesDropped.incrementAndGet();
            return false;
        }

        if (!outbox.queue.offer(new TextMessage(payload))) {
            log.warn("Outbox full for session {}, dropping frame", session.getId());
            framesDropped.incrementAndGet();
            return false;
        }

        if (outbox.wip.getAndIncrement() == 0) {
            try {
                writerExecutor.execute(() -> drain(session, outbox));
            } catch (RejectedExecutionException e) {
                log.error("Writer pool rejected drain for session {}: {}", session.getId(), e.getMessage());
                outbox.wip.decrementAndGet();
                return false;
            }
        }
        return true;
    }

    private void drain(WebSocketSession session, Outbox outbox) {
        int missed = 1;
        do {
            TextMessage frame;
            while ((frame = outbox.queue.poll()) != null) {
                if (!session.isOpen()) {
                    log.warn("Session {} closed while frames were pending", session.getId());
                    unregisterSession(session.getId());
                    return;
                }
                try {
                    session.sendMessage(frame);
                    framesWritten.incrementAndGet();
                } catch (IOException e) {
                    // a failed write means the socket is gone
                    log.error("Write to session {} failed: {}", session.getId(), e.getMessage());
                    writeErrors.incrementAndGet();
                    unregisterSession(session.getId());
                    return;
                } catch (Exception e) {
                    log.error("Unexpected error writing to session {}: {}", session.getId(), e.getMessage());
                    writeErrors.incrementAndGet();
                }
            }
            missed = outbox.wip.addAndGet(-missed);
        } while (missed != 0);
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down ChannelWriteManager...");
        if (writerExecutor != null) {
            writerExecutor.shutdown();
            try {
                if (!writerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    writerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                writerExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        outboxes.clear();
    }

    public long getFramesWritten() {
        return framesWritten.get();
    }

    public long getFramesDropped() {
        return framesDropped.get();
    }

    public long getWriteErrors() {
        return writeErrors.get();
    }

    public int getActiveSessionCount() {
        return outboxes.size();
    }

    private static final class Outbox {
        private final BlockingQueue<TextMessage> queue;
        private final AtomicInteger wip = new AtomicInteger(0);
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Outbox(int capacity) {
            this.queue = new LinkedBlockingQueue<>(capacity);
        }
    }
}
