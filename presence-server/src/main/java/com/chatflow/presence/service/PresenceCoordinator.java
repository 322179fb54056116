package com.chatflow.presence.service;

import com.chatflow.presence.model.ChatMessageEvent;
import com.chatflow.presence.model.Connection;
import com.chatflow.presence.model.DeliveryReceipt;
import com.chatflow.presence.model.DeliveryRecord;
import com.chatflow.presence.model.PresenceStats;
import com.chatflow.presence.model.QueuedMessage;
import com.chatflow.presence.model.UserIdentity;
import com.chatflow.presence.channel.UserChannel;
import com.chatflow.presence.protocol.EditMessageRequest;
import com.chatflow.presence.protocol.MessageChangeNotice;
import com.chatflow.presence.protocol.MessageRefRequest;
import com.chatflow.presence.protocol.OutboundEventType;
import com.chatflow.presence.protocol.PresenceNotice;
import com.chatflow.presence.protocol.ReactionNotice;
import com.chatflow.presence.protocol.ReactionRequest;
import com.chatflow.presence.protocol.ReceiptNotice;
import com.chatflow.presence.protocol.ReceiptRequest;
import com.chatflow.presence.protocol.SendMessageRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Implements the presence protocol on top of the registry, membership index, typing tracker,
 * offline queue and delivery ledger. Every method is expected to run on the
 * {@link PresenceEventLoop}, so each call sees and leaves a consistent state.
 */
@Service
@Slf4j
public class PresenceCoordinator {

    private final ConnectionRegistry registry;
    private final RoomMembershipIndex rooms;
    private final TypingIndicatorTracker typing;
    private final OfflineDeliveryQueue offlineQueue;
    private final DeliveryConfirmationLedger ledger;
    private final Clock clock;

    private final boolean announceRepeatJoins;
    private final boolean recordQueuedDeliveries;

    private final AtomicLong messagesAccepted = new AtomicLong(0);
    private final AtomicLong messagesDelivered = new AtomicLong(0);
    private final AtomicLong messagesQueued = new AtomicLong(0);

    public PresenceCoordinator(ConnectionRegistry registry,
                               RoomMembershipIndex rooms,
                               TypingIndicatorTracker typing,
                               OfflineDeliveryQueue offlineQueue,
                               DeliveryConfirmationLedger ledger,
                               Clock clock,
                               @Value("${presence.rooms.announce-repeat-joins:true}") boolean announceRepeatJoins,
                               @Value("${presence.ledger.record-queued-deliveries:true}") boolean recordQueuedDeliveries) {
        this.registry = registry;
        this.rooms = rooms;
        this.typing = typing;
        this.offlineQueue = offlineQueue;
        this.ledger = ledger;
        this.clock = clock;
        this.announceRepeatJoins = announceRepeatJoins;
        this.recordQueuedDeliveries = recordQueuedDeliveries;
    }

    // ---------------------------------------------------------------- lifecycle

    /**
     * Registers the user and flushes its offline queue to the new channel.
     *
     * @return number of queued messages delivered
     */
    public int connect(UserIdentity identity, UserChannel channel) {
        String userId = identity.getUserId();
        Connection previous = registry.register(identity, channel);
        if (previous != null && previous.getChannel() != channel) {
            previous.getChannel().close("Superseded by a new connection");
        }

        List<QueuedMessage> queued = offlineQueue.drain(userId);
        int delivered = 0;
        for (int i = 0; i < queued.size(); i++) {
            QueuedMessage message = queued.get(i);
            ChatMessageEvent replay = message.getPayload().toBuilder()
                    .deliveryStatus(ChatMessageEvent.STATUS_DELIVERED_FROM_QUEUE)
                    .queuedAt(message.getQueuedAt().toString())
                    .build();

            if (!registry.send(userId, OutboundEventType.NEW_MESSAGE, replay)) {
                List<QueuedMessage> remainder = new ArrayList<>(queued.subList(i, queued.size()));
                offlineQueue.restore(userId, remainder);
                log.warn("Channel {} of user {} failed during queue flush, {} messages re-queued",
                        channel.getId(), userId, remainder.size());
                break;
            }
            if (recordQueuedDeliveries) {
                ledger.markDelivered(replay.getId(), userId);
            }
            delivered++;
        }

        messagesDelivered.addAndGet(delivered);
        log.info("User {} ({}) connected on channel {}, delivered {} queued messages",
                userId, identity.getDisplayName(), channel.getId(), delivered);
        return delivered;
    }

    /**
     * Cleans up after the user's channel closed. A close of a channel that has already been
     * superseded by a newer connection is ignored. The cleanup still runs when the registry
     * entry is already gone, for example after the health monitor removed the dead channel
     * before its close event arrived.
     *
     * @return true if the user was cleaned up
     */
    public boolean disconnect(UserIdentity identity, UserChannel channel, String reason) {
        String userId = identity.getUserId();
        Connection current = registry.connectionOf(userId);
        if (current != null && current.getChannel() != channel) {
            log.debug("Ignoring close of stale channel {} for user {}", channel.getId(), userId);
            return false;
        }

        for (String roomId : typing.stopAll(userId)) {
            broadcast(roomId, userId, OutboundEventType.TYPING_STOP, notice(roomId, identity));
        }

        Set<String> memberships = rooms.roomsOf(userId);
        for (String roomId : memberships) {
            broadcast(roomId, userId, OutboundEventType.USER_OFFLINE, notice(roomId, identity));
        }
        rooms.dropAll(userId);
        registry.unregisterIfCurrent(userId, channel);

        log.info("User {} disconnected from channel {} ({}), left {} rooms",
                userId, channel.getId(), reason, memberships.size());
        return true;
    }

    /**
     * Runs the disconnect cleanup for the user and closes its channel.
     *
     * @return false if the user was not connected
     */
    public boolean forceDisconnect(String userId, String reason) {
        Connection connection = registry.connectionOf(userId);
        if (connection == null) {
            return false;
        }
        disconnect(connection.getIdentity(), connection.getChannel(), reason);
        connection.getChannel().close(reason);
        return true;
    }

    // ---------------------------------------------------------------- rooms

    public void joinRoom(UserIdentity actor, String roomId) {
        boolean newlyJoined = rooms.join(actor.getUserId(), roomId);
        if (newlyJoined || announceRepeatJoins) {
            broadcast(roomId, actor.getUserId(), OutboundEventType.USER_JOINED, notice(roomId, actor));
        }
        log.debug("User {} joined room {}", actor.getUserId(), roomId);
    }

    public void leaveRoom(UserIdentity actor, String roomId) {
        rooms.leave(actor.getUserId(), roomId);
        broadcast(roomId, actor.getUserId(), OutboundEventType.USER_LEFT, notice(roomId, actor));
        log.debug("User {} left room {}", actor.getUserId(), roomId);
    }

    // ---------------------------------------------------------------- messages

    /**
     * Delivers a message to every other member of the room: immediately to online members,
     * through the offline queue to everyone else. A room nobody has joined yields a receipt
     * with zero recipients.
     */
    public DeliveryReceipt sendMessage(UserIdentity sender, SendMessageRequest request) {
        String roomId = request.getRoomId();
        SendMessageRequest.MessageContent content = request.getMessage();
        String messageId = content.getId() != null && !content.getId().isBlank()
                ? content.getId()
                : UUID.randomUUID().toString();

        ChatMessageEvent event = ChatMessageEvent.builder()
                .id(messageId)
                .roomId(roomId)
                .content(content.getContent())
                .type(content.getType() != null ? content.getType() : "text")
                .sender(sender)
                .timestamp(now())
                .deliveryStatus(ChatMessageEvent.STATUS_SENT)
                .build();
        messagesAccepted.incrementAndGet();

        List<String> online = new ArrayList<>();
        List<String> offline = new ArrayList<>();
        for (String memberId : rooms.membersOf(roomId)) {
            if (memberId.equals(sender.getUserId())) {
                continue;
            }
            if (registry.isOnline(memberId)) {
                online.add(memberId);
            } else {
                offline.add(memberId);
            }
        }

        int delivered = 0;
        for (String memberId : online) {
            if (registry.send(memberId, OutboundEventType.NEW_MESSAGE, event)) {
                ledger.markDelivered(messageId, memberId);
                delivered++;
            } else {
                // registry still listed the user but the channel is gone
                offline.add(memberId);
            }
        }

        for (String memberId : offline) {
            offlineQueue.enqueue(memberId, event);
        }

        messagesDelivered.addAndGet(delivered);
        messagesQueued.addAndGet(offline.size());
        log.debug("Message {} from {} in room {}: delivered={}, queued={}",
                messageId, sender.getUserId(), roomId, delivered, offline.size());

        return DeliveryReceipt.builder()
                .success(true)
                .messageId(messageId)
                .deliveredTo(delivered)
                .queuedFor(offline.size())
                .build();
    }

    public void editMessage(UserIdentity actor, EditMessageRequest request) {
        MessageChangeNotice notice = MessageChangeNotice.builder()
                .roomId(request.getRoomId())
                .messageId(request.getMessageId())
                .newText(request.getNewText())
                .changedBy(actor.getUserId())
                .changedByName(actor.getDisplayName())
                .changedAt(now())
                .build();
        broadcast(request.getRoomId(), actor.getUserId(), OutboundEventType.MESSAGE_EDITED, notice);
    }

    public void deleteMessage(UserIdentity actor, MessageRefRequest request) {
        MessageChangeNotice notice = MessageChangeNotice.builder()
                .roomId(request.getRoomId())
                .messageId(request.getMessageId())
                .changedBy(actor.getUserId())
                .changedByName(actor.getDisplayName())
                .changedAt(now())
                .build();
        broadcast(request.getRoomId(), actor.getUserId(), OutboundEventType.MESSAGE_DELETED, notice);
    }

    public void addReaction(UserIdentity actor, ReactionRequest request) {
        broadcast(request.getRoomId(), actor.getUserId(), OutboundEventType.REACTION_ADDED, reaction(actor, request));
    }

    public void removeReaction(UserIdentity actor, ReactionRequest request) {
        broadcast(request.getRoomId(), actor.getUserId(), OutboundEventType.REACTION_REMOVED, reaction(actor, request));
    }

    // ---------------------------------------------------------------- receipts

    /**
     * Records that the actor read the message and tells the original sender if online.
     */
    public void markRead(UserIdentity actor, ReceiptRequest request) {
        boolean updated = ledger.markRead(request.getMessageId(), actor.getUserId());
        log.debug("User {} read message {} (record updated={})", actor.getUserId(), request.getMessageId(), updated);
        notifySender(actor, request, OutboundEventType.MESSAGE_READ);
    }

    /**
     * Forwards the recipient's delivery confirmation to the original sender if online.
     */
    public void confirmDelivered(UserIdentity actor, ReceiptRequest request) {
        notifySender(actor, request, OutboundEventType.MESSAGE_DELIVERY_CONFIRMED);
    }

    // ---------------------------------------------------------------- typing & status

    public void typingStart(UserIdentity actor, String roomId) {
        boolean started = typing.start(roomId, actor.getUserId(),
                () -> broadcast(roomId, actor.getUserId(), OutboundEventType.TYPING_STOP, notice(roomId, actor)));
        if (started) {
            broadcast(roomId, actor.getUserId(), OutboundEventType.TYPING_START, notice(roomId, actor));
        }
    }

    public void typingStop(UserIdentity actor, String roomId) {
        if (typing.stop(roomId, actor.getUserId())) {
            broadcast(roomId, actor.getUserId(), OutboundEventType.TYPING_STOP, notice(roomId, actor));
        }
    }

    /**
     * Broadcasts the status to every room the user belongs to.
     */
    public void updateStatus(UserIdentity actor, String status) {
        for (String roomId : rooms.roomsOf(actor.getUserId())) {
            PresenceNotice notice = PresenceNotice.builder()
                    .roomId(roomId)
                    .userId(actor.getUserId())
                    .userName(actor.getDisplayName())
                    .status(status)
                    .timestamp(now())
                    .build();
            broadcast(roomId, actor.getUserId(), OutboundEventType.STATUS_UPDATE, notice);
        }
    }

    // ---------------------------------------------------------------- diagnostics

    public Set<String> typingUsers(String roomId) {
        return typing.typingUsers(roomId);
    }

    public List<DeliveryRecord> deliveryStatus(String messageId) {
        return ledger.statusesFor(messageId);
    }

    public Set<String> onlineMembersOf(String roomId) {
        return rooms.membersOf(roomId).stream()
                .filter(registry::isOnline)
                .collect(Collectors.toSet());
    }

    public PresenceStats stats() {
        return PresenceStats.builder()
                .onlineUsers(registry.onlineCount())
                .activeRooms(rooms.roomCount())
                .queuedMessages(offlineQueue.totalQueued())
                .typingUsers(typing.activeCount())
                .deliveryRecords(ledger.size())
                .build();
    }

    public long getMessagesAccepted() {
        return messagesAccepted.get();
    }

    public long getMessagesDelivered() {
        return messagesDelivered.get();
    }

    public long getMessagesQueued() {
        return messagesQueued.get();
    }

    // ---------------------------------------------------------------- helpers

    private int broadcast(String roomId, String excludeUserId, OutboundEventType type, Object payload) {
        int sent = 0;
        for (String memberId : rooms.membersOf(roomId)) {
            if (!memberId.equals(excludeUserId) && registry.send(memberId, type, payload)) {
                sent++;
            }
        }
        log.debug("Broadcast {} to room {}: {} recipients", type.getWireName(), roomId, sent);
        return sent;
    }

    private void notifySender(UserIdentity actor, ReceiptRequest request, OutboundEventType type) {
        String senderId = request.getSenderId();
        if (senderId == null || !registry.isOnline(senderId)) {
            return;
        }
        ReceiptNotice notice = ReceiptNotice.builder()
                .messageId(request.getMessageId())
                .confirmedBy(actor.getUserId())
                .confirmedByName(actor.getDisplayName())
                .timestamp(now())
                .build();
        registry.send(senderId, type, notice);
    }

    private PresenceNotice notice(String roomId, UserIdentity actor) {
        return PresenceNotice.builder()
                .roomId(roomId)
                .userId(actor.getUserId())
                .userName(actor.getDisplayName())
                .timestamp(now())
                .build();
    }

    private ReactionNotice reaction(UserIdentity actor, ReactionRequest request) {
        return ReactionNotice.builder()
                .roomId(request.getRoomId())
                .messageId(request.getMessageId())
                .emoji(request.getEmoji())
                .userId(actor.getUserId())
                .userName(actor.getDisplayName())
                .timestamp(now())
                .build();
    }

    private String now() {
        return clock.instant().toString();
    }
}
