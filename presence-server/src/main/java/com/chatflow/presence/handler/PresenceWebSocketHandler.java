package com.chatflow.presence.handler;

import com.chatflow.presence.channel.ChannelWriteManager;
import com.chatflow.presence.channel.UserChannel;
import com.chatflow.presence.channel.WebSocketUserChannel;
import com.chatflow.presence.exception.MalformedPayloadException;
import com.chatflow.presence.model.DeliveryReceipt;
import com.chatflow.presence.model.UserIdentity;
import com.chatflow.presence.protocol.EditMessageRequest;
import com.chatflow.presence.protocol.ErrorNotice;
import com.chatflow.presence.protocol.InboundEvent;
import com.chatflow.presence.protocol.InboundEventType;
import com.chatflow.presence.protocol.MessageRefRequest;
import com.chatflow.presence.protocol.OutboundEvent;
import com.chatflow.presence.protocol.OutboundEventType;
import com.chatflow.presence.protocol.ReactionRequest;
import com.chatflow.presence.protocol.ReceiptRequest;
import com.chatflow.presence.protocol.SendMessageRequest;
import com.chatflow.presence.service.PresenceCoordinator;
import com.chatflow.presence.service.PresenceEventLoop;
import com.chatflow.presence.validator.InboundEventValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.concurrent.atomic.AtomicLong;

/**
 * WebSocket entry point of the presence core. Frames are parsed and validated on the
 * container thread; valid events are handed to the {@link PresenceEventLoop}, where the
 * {@link PresenceCoordinator} applies them. Malformed frames only ever produce an
 * {@code error} event for the sender.
 */
@Component
@Slf4j
public class PresenceWebSocketHandler extends TextWebSocketHandler {

    static final String CHANNEL_ATTRIBUTE = "channel";

    private final ObjectMapper objectMapper;
    private final PresenceCoordinator coordinator;
    private final PresenceEventLoop eventLoop;
    private final ChannelWriteManager writeManager;
    private final InboundEventValidator validator;

    private final AtomicLong eventsReceived = new AtomicLong(0);
    private final AtomicLong eventsRejected = new AtomicLong(0);
    private final AtomicLong acksSent = new AtomicLong(0);

    public PresenceWebSocketHandler(ObjectMapper objectMapper,
                                    PresenceCoordinator coordinator,
                                    PresenceEventLoop eventLoop,
                                    ChannelWriteManager writeManager,
                                    InboundEventValidator validator) {
        this.objectMapper = objectMapper;
        this.coordinator = coordinator;
        this.eventLoop = eventLoop;
        this.writeManager = writeManager;
        this.validator = validator;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        UserIdentity identity = identityOf(session);
        if (identity == null) {
            log.warn("Session {} has no resolved identity, closing", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }

        log.info("WebSocket connection established: sessionId={}, userId={}, remoteAddress={}",
                session.getId(), identity.getUserId(), session.getRemoteAddress());

        writeManager.registerSession(session);
        UserChannel channel = new WebSocketUserChannel(session, writeManager, objectMapper);
        session.getAttributes().put(CHANNEL_ATTRIBUTE, channel);

        eventLoop.execute("connect", () -> coordinator.connect(identity, channel));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        eventsReceived.incrementAndGet();

        UserIdentity identity = identityOf(session);
        UserChannel channel = channelOf(session);
        if (identity == null || channel == null) {
            log.error("Frame on session {} before the connection was registered", session.getId());
            return;
        }

        InboundEvent inbound;
        try {
            inbound = objectMapper.readValue(message.getPayload(), InboundEvent.class);
        } catch (JsonProcessingException e) {
            eventsRejected.incrementAndGet();
            log.warn("Unparseable frame from user {}: {}", identity.getUserId(), e.getOriginalMessage());
            sendError(channel, null, null, "Invalid message format");
            return;
        }

        try {
            dispatch(identity, channel, inbound);
        } catch (MalformedPayloadException e) {
            eventsRejected.incrementAndGet();
            log.warn("Rejected {} from user {}: {}", inbound.getEvent(), identity.getUserId(), e.getMessage());
            sendError(channel, inbound.getAckId(), e.getEvent(), e.getMessage());
            if (InboundEventType.SEND_MESSAGE.getWireName().equals(inbound.getEvent())) {
                sendAck(channel, inbound.getAckId(), DeliveryReceipt.failed(e.getMessage()));
            }
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        UserIdentity identity = identityOf(session);
        UserChannel channel = channelOf(session);
        log.info("WebSocket connection closed: sessionId={}, userId={}, status={}",
                session.getId(), identity != null ? identity.getUserId() : null, status);

        writeManager.unregisterSession(session.getId());
        if (identity != null && channel != null) {
            eventLoop.execute("disconnect", () -> coordinator.disconnect(identity, channel, status.toString()));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        log.error("WebSocket transport error for session {}: {}", session.getId(), exception.getMessage());
        if (session.isOpen()) {
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    private void dispatch(UserIdentity identity, UserChannel channel, InboundEvent inbound) {
        InboundEventType type = InboundEventType.fromWireName(inbound.getEvent());
        if (type == null) {
            throw new MalformedPayloadException(inbound.getEvent(), "Unknown event: " + inbound.getEvent());
        }

        switch (type) {
            case JOIN_ROOM: {
                String roomId = readRoomId(inbound);
                eventLoop.execute("join_room", () -> coordinator.joinRoom(identity, roomId));
                break;
            }
            case LEAVE_ROOM: {
                String roomId = readRoomId(inbound);
                eventLoop.execute("leave_room", () -> coordinator.leaveRoom(identity, roomId));
                break;
            }
            case SEND_MESSAGE: {
                SendMessageRequest request = read(inbound, SendMessageRequest.class);
                check(inbound, validator.validate(request));
                eventLoop.submit("send_message", () -> coordinator.sendMessage(identity, request))
                        .whenComplete((receipt, error) -> {
                            if (error != null) {
                                sendError(channel, inbound.getAckId(), inbound.getEvent(), "Failed to send message");
                                sendAck(channel, inbound.getAckId(), DeliveryReceipt.failed("Failed to send message"));
                            } else {
                                sendAck(channel, inbound.getAckId(), receipt);
                            }
                        });
                break;
            }
            case TYPING_START: {
                String roomId = readRoomId(inbound);
                eventLoop.execute("typing_start", () -> coordinator.typingStart(identity, roomId));
                break;
            }
            case TYPING_STOP: {
                String roomId = readRoomId(inbound);
                eventLoop.execute("typing_stop", () -> coordinator.typingStop(identity, roomId));
                break;
            }
            case ADD_REACTION: {
                ReactionRequest request = read(inbound, ReactionRequest.class);
                check(inbound, validator.validate(request));
                eventLoop.execute("add_reaction", () -> coordinator.addReaction(identity, request));
                break;
            }
            case REMOVE_REACTION: {
                ReactionRequest request = read(inbound, ReactionRequest.class);
                check(inbound, validator.validate(request));
                eventLoop.execute("remove_reaction", () -> coordinator.removeReaction(identity, request));
                break;
            }
            case EDIT_MESSAGE: {
                EditMessageRequest request = read(inbound, EditMessageRequest.class);
                check(inbound, validator.validate(request));
                eventLoop.execute("edit_message", () -> coordinator.editMessage(identity, request));
                break;
            }
            case DELETE_MESSAGE: {
                MessageRefRequest request = read(inbound, MessageRefRequest.class);
                check(inbound, validator.validate(request));
                eventLoop.execute("delete_message", () -> coordinator.deleteMessage(identity, request));
                break;
            }
            case MARK_READ: {
                ReceiptRequest request = read(inbound, ReceiptRequest.class);
                check(inbound, validator.validate(request));
                eventLoop.execute("mark_read", () -> coordinator.markRead(identity, request));
                break;
            }
            case MESSAGE_DELIVERED: {
                ReceiptRequest request = read(inbound, ReceiptRequest.class);
                check(inbound, validator.validate(request));
                eventLoop.execute("message_delivered", () -> coordinator.confirmDelivered(identity, request));
                break;
            }
            case STATUS_UPDATE: {
                String status = readScalar(inbound, "status");
                check(inbound, validator.validateStatus(status));
                eventLoop.execute("status_update", () -> coordinator.updateStatus(identity, status));
                break;
            }
            case PING:
                sendAck(channel, inbound.getAckId(), "pong");
                break;
            default:
                throw new MalformedPayloadException(inbound.getEvent(), "Unsupported event: " + inbound.getEvent());
        }
    }

    private String readRoomId(InboundEvent inbound) {
        String roomId = readScalar(inbound, "roomId");
        check(inbound, validator.validateRoomId(roomId));
        return roomId;
    }

    /**
     * Accepts either a bare value ({@code "data": "room-1"}) or an object carrying the field
     * ({@code "data": {"roomId": "room-1"}}).
     */
    private String readScalar(InboundEvent inbound, String field) {
        JsonNode data = inbound.getData();
        if (data == null || data.isNull()) {
            return null;
        }
        if (data.isTextual() || data.isNumber()) {
            return data.asText();
        }
        if (data.isObject()) {
            JsonNode value = data.get(field);
            return value == null || value.isNull() || value.isContainerNode() ? null : value.asText();
        }
        return null;
    }

    private <T> T read(InboundEvent inbound, Class<T> type) {
        JsonNode data = inbound.getData();
        if (data == null || !data.isObject()) {
            throw new MalformedPayloadException(inbound.getEvent(), "Payload must be an object");
        }
        try {
            return objectMapper.treeToValue(data, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedPayloadException(inbound.getEvent(), "Invalid payload", e);
        }
    }

    private void check(InboundEvent inbound, String error) {
        if (error != null) {
            throw new MalformedPayloadException(inbound.getEvent(), error);
        }
    }

    private void sendAck(UserChannel channel, String ackId, Object data) {
        if (channel.send(OutboundEvent.ack(ackId, data))) {
            acksSent.incrementAndGet();
        } else {
            log.debug("Failed to send ack {} on channel {}", ackId, channel.getId());
        }
    }

    private void sendError(UserChannel channel, String ackId, String event, String errorMessage) {
        OutboundEvent error = OutboundEvent.of(OutboundEventType.ERROR, new ErrorNotice(errorMessage, event));
        error.setAckId(ackId);
        if (!channel.send(error)) {
            log.debug("Failed to send error to channel {}", channel.getId());
        }
    }

    private UserIdentity identityOf(WebSocketSession session) {
        return (UserIdentity) session.getAttributes().get(IdentityHandshakeInterceptor.IDENTITY_ATTRIBUTE);
    }

    private UserChannel channelOf(WebSocketSession session) {
        return (UserChannel) session.getAttributes().get(CHANNEL_ATTRIBUTE);
    }

    public long getEventsReceived() {
        return eventsReceived.get();
    }

    public long getEventsRejected() {
        return eventsRejected.get();
    }

    public long getAcksSent() {
        return acksSent.get();
    }
}
