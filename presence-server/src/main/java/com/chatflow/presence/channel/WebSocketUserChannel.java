package com.chatflow.presence.channel;

import com.chatflow.presence.protocol.OutboundEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link UserChannel} backed by a WebSocket session. Writes go through the
 * {@link ChannelWriteManager} so that concurrent senders never interleave frames.
 */
@Slf4j
public class WebSocketUserChannel implements UserChannel {

    private final WebSocketSession session;
    private final ChannelWriteManager writeManager;
    private final ObjectMapper objectMapper;

    public WebSocketUserChannel(WebSocketSession session, ChannelWriteManager writeManager,
            ObjectMapper objectMapper) {
        this.session = session;
        this.writeManager = writeManager;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen() && writeManager.isActive(session.getId());
    }

    @Override
    public boolean send(OutboundEvent event) {
        if (!isOpen()) {
            return false;
        }
        try {
            return writeManager.sendMessage(session, objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} for session {}: {}", event.getEvent(), session.getId(), e.getMessage());
            return false;
        }
    }

    @Override
    public void close(String reason) {
        try {
            session.close(CloseStatus.NORMAL.withReason(reason));
        } catch (IOException e) {
            log.warn("Failed to close session {}: {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "WebSocketUserChannel[" + session.getId() + "]";
    }
}
