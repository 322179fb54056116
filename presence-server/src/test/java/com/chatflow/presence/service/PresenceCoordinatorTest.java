package com.chatflow.presence.service;

import com.chatflow.presence.model.ChatMessageEvent;
import com.chatflow.presence.model.DeliveryReceipt;
import com.chatflow.presence.model.DeliveryStatus;
import com.chatflow.presence.model.UserIdentity;
import com.chatflow.presence.protocol.EditMessageRequest;
import com.chatflow.presence.protocol.MessageChangeNotice;
import com.chatflow.presence.protocol.MessageRefRequest;
import com.chatflow.presence.protocol.OutboundEvent;
import com.chatflow.presence.protocol.OutboundEventType;
import com.chatflow.presence.protocol.PresenceNotice;
import com.chatflow.presence.protocol.ReactionNotice;
import com.chatflow.presence.protocol.ReactionRequest;
import com.chatflow.presence.protocol.ReceiptNotice;
import com.chatflow.presence.protocol.ReceiptRequest;
import com.chatflow.presence.protocol.SendMessageRequest;
import com.chatflow.presence.support.ManualTimerScheduler;
import com.chatflow.presence.support.MutableClock;
import com.chatflow.presence.support.RecordingChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class PresenceCoordinatorTest {

    private static final UserIdentity ALICE = new UserIdentity("alice", "Alice");
    private static final UserIdentity BOB = new UserIdentity("bob", "Bob");
    private static final UserIdentity CAROL = new UserIdentity("carol", "Carol");

    private MutableClock clock;
    private ManualTimerScheduler timers;
    private ConnectionRegistry registry;
    private RoomMembershipIndex rooms;
    private TypingIndicatorTracker typing;
    private OfflineDeliveryQueue offlineQueue;
    private DeliveryConfirmationLedger ledger;
    private PresenceCoordinator coordinator;

    private RecordingChannel aliceChannel;
    private RecordingChannel bobChannel;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        timers = new ManualTimerScheduler();
        registry = new ConnectionRegistry(clock);
        rooms = new RoomMembershipIndex();
        typing = new TypingIndicatorTracker(timers, clock, 3000);
        offlineQueue = new OfflineDeliveryQueue(clock, 100);
        ledger = new DeliveryConfirmationLedger(clock);
        coordinator = coordinator(true);

        aliceChannel = new RecordingChannel("a-1");
        bobChannel = new RecordingChannel("b-1");
    }

    private PresenceCoordinator coordinator(boolean announceRepeatJoins) {
        return new PresenceCoordinator(registry, rooms, typing, offlineQueue, ledger, clock,
                announceRepeatJoins, true);
    }

    @Test
    void messageReachesOnlineRoomMember() {
        connectBothToGeneral();

        DeliveryReceipt receipt = coordinator.sendMessage(ALICE, message("general", "m1", "hi"));

        assertThat(receipt.isSuccess()).isTrue();
        assertThat(receipt.getMessageId()).isEqualTo("m1");
        assertThat(receipt.getDeliveredTo()).isEqualTo(1);
        assertThat(receipt.getQueuedFor()).isZero();

        List<ChatMessageEvent> received = bobChannel.payloadsOf(OutboundEventType.NEW_MESSAGE, ChatMessageEvent.class);
        assertThat(received).hasSize(1);
        ChatMessageEvent event = received.get(0);
        assertThat(event.getContent()).isEqualTo("hi");
        assertThat(event.getSender()).isEqualTo(ALICE);
        assertThat(event.getDeliveryStatus()).isEqualTo(ChatMessageEvent.STATUS_SENT);
        assertThat(event.getTimestamp()).isEqualTo("2024-05-01T10:00:00Z");

        assertThat(aliceChannel.eventsOf(OutboundEventType.NEW_MESSAGE)).isEmpty();
        assertThat(ledger.statusOf("m1", "bob").getStatus()).isEqualTo(DeliveryStatus.DELIVERED);
    }

    @Test
    void messageWithoutClientIdGetsGeneratedId() {
        connectBothToGeneral();

        DeliveryReceipt receipt = coordinator.sendMessage(ALICE, message("general", null, "hi"));

        assertThat(receipt.getMessageId()).isNotBlank();
        assertThat(bobChannel.payloadsOf(OutboundEventType.NEW_MESSAGE, ChatMessageEvent.class).get(0).getId())
                .isEqualTo(receipt.getMessageId());
    }

    @Test
    void messageToEmptyRoomHasNoRecipients() {
        coordinator.connect(ALICE, aliceChannel);

        DeliveryReceipt receipt = coordinator.sendMessage(ALICE, message("nobody-here", "m1", "echo"));

        assertThat(receipt.isSuccess()).isTrue();
        assertThat(receipt.getDeliveredTo()).isZero();
        assertThat(receipt.getQueuedFor()).isZero();
    }

    @Test
    void memberLostWithoutCloseGetsMessageQueuedAndReplayedOnReconnect() {
        // a clean disconnect drops bob's memberships; only a connection lost without a close keeps them
        connectBothToGeneral();
        registry.unregister("bob");
        clock.advance(Duration.ofSeconds(30));

        DeliveryReceipt receipt = coordinator.sendMessage(ALICE, message("general", "m1", "are you there?"));

        assertThat(receipt.getDeliveredTo()).isZero();
        assertThat(receipt.getQueuedFor()).isEqualTo(1);
        assertThat(offlineQueue.sizeOf("bob")).isEqualTo(1);

        clock.advance(Duration.ofMinutes(5));
        RecordingChannel reconnected = new RecordingChannel("b-2");
        assertThat(coordinator.connect(BOB, reconnected)).isEqualTo(1);

        List<ChatMessageEvent> replayed = reconnected.payloadsOf(OutboundEventType.NEW_MESSAGE, ChatMessageEvent.class);
        assertThat(replayed).hasSize(1);
        assertThat(replayed.get(0).getId()).isEqualTo("m1");
        assertThat(replayed.get(0).getDeliveryStatus()).isEqualTo(ChatMessageEvent.STATUS_DELIVERED_FROM_QUEUE);
        assertThat(replayed.get(0).getQueuedAt()).isEqualTo("2024-05-01T10:00:30Z");
        assertThat(offlineQueue.sizeOf("bob")).isZero();
        assertThat(ledger.statusOf("m1", "bob").getStatus()).isEqualTo(DeliveryStatus.DELIVERED);
    }

    @Test
    void failedWriteToListedMemberFallsBackToQueue() {
        connectBothToGeneral();
        bobChannel.rejectSends();

        DeliveryReceipt receipt = coordinator.sendMessage(ALICE, message("general", "m1", "hello"));

        assertThat(receipt.getDeliveredTo()).isZero();
        assertThat(receipt.getQueuedFor()).isEqualTo(1);
        assertThat(ledger.statusOf("m1", "bob")).isNull();
    }

    @Test
    void queueReplayPreservesOrderAndRequeuesWhatFailed() {
        offlineQueue.enqueue("bob", ChatMessageEvent.builder().id("m1").roomId("general").build());
        offlineQueue.enqueue("bob", ChatMessageEvent.builder().id("m2").roomId("general").build());
        offlineQueue.enqueue("bob", ChatMessageEvent.builder().id("m3").roomId("general").build());
        bobChannel.failAfter(1);

        assertThat(coordinator.connect(BOB, bobChannel)).isEqualTo(1);

        assertThat(bobChannel.payloadsOf(OutboundEventType.NEW_MESSAGE, ChatMessageEvent.class))
                .extracting(ChatMessageEvent::getId)
                .containsExactly("m1");
        List<String> remaining = offlineQueue.drain("bob").stream()
                .map(q -> q.getPayload().getId())
                .collect(Collectors.toList());
        assertThat(remaining).containsExactly("m2", "m3");
    }

    @Test
    void joinAnnouncesToOtherMembersOnly() {
        coordinator.connect(ALICE, aliceChannel);
        coordinator.connect(BOB, bobChannel);
        coordinator.joinRoom(ALICE, "general");

        coordinator.joinRoom(BOB, "general");

        List<PresenceNotice> joined = aliceChannel.payloadsOf(OutboundEventType.USER_JOINED, PresenceNotice.class);
        assertThat(joined).hasSize(1);
        assertThat(joined.get(0).getUserId()).isEqualTo("bob");
        assertThat(joined.get(0).getUserName()).isEqualTo("Bob");
        assertThat(joined.get(0).getRoomId()).isEqualTo("general");
        assertThat(bobChannel.eventsOf(OutboundEventType.USER_JOINED)).isEmpty();
    }

    @Test
    void repeatJoinIsAnnouncedAgainWhenConfigured() {
        connectBothToGeneral();
        aliceChannel.clear();

        coordinator.joinRoom(BOB, "general");

        assertThat(aliceChannel.eventsOf(OutboundEventType.USER_JOINED)).hasSize(1);
        assertThat(rooms.membersOf("general")).containsExactlyInAnyOrder("alice", "bob");
    }

    @Test
    void repeatJoinIsSilentWhenAnnouncementsAreOff() {
        coordinator = coordinator(false);
        connectBothToGeneral();
        aliceChannel.clear();

        coordinator.joinRoom(BOB, "general");

        assertThat(aliceChannel.eventsOf(OutboundEventType.USER_JOINED)).isEmpty();
    }

    @Test
    void leaveBroadcastsAndStopsFurtherMessages() {
        connectBothToGeneral();

        coordinator.leaveRoom(BOB, "general");
        coordinator.sendMessage(ALICE, message("general", "m1", "still here?"));

        assertThat(aliceChannel.payloadsOf(OutboundEventType.USER_LEFT, PresenceNotice.class))
                .extracting(PresenceNotice::getUserId)
                .containsExactly("bob");
        assertThat(bobChannel.eventsOf(OutboundEventType.NEW_MESSAGE)).isEmpty();
    }

    @Test
    void disconnectStopsTypingThenAnnouncesOfflineAndCleansUp() {
        connectBothToGeneral();
        coordinator.typingStart(BOB, "general");
        aliceChannel.clear();

        assertThat(coordinator.disconnect(BOB, bobChannel, "client closed")).isTrue();

        assertThat(aliceChannel.getSent())
                .extracting(OutboundEvent::getEvent)
                .containsExactly("typing_stop", "user_offline");
        assertThat(registry.isOnline("bob")).isFalse();
        assertThat(rooms.roomsOf("bob")).isEmpty();
        assertThat(typing.isTyping("general", "bob")).isFalse();

        timers.advance(Duration.ofSeconds(5));
        assertThat(aliceChannel.eventsOf(OutboundEventType.TYPING_STOP)).hasSize(1);
    }

    @Test
    void memberWhoDisconnectedCleanlyNoLongerReceivesRoomMessages() {
        connectBothToGeneral();
        coordinator.disconnect(BOB, bobChannel, "client closed");

        DeliveryReceipt receipt = coordinator.sendMessage(ALICE, message("general", "m2", "gone?"));

        assertThat(receipt.getDeliveredTo()).isZero();
        assertThat(receipt.getQueuedFor()).isZero();
        assertThat(offlineQueue.sizeOf("bob")).isZero();
    }

    @Test
    void closeArrivingAfterHealthSweepStillCleansUp() {
        connectBothToGeneral();
        coordinator.typingStart(BOB, "general");
        aliceChannel.clear();
        bobChannel.drop();
        HealthMonitor monitor = new HealthMonitor(mock(PresenceEventLoop.class), registry, ledger, coordinator);
        assertThat(monitor.sweepConnections()).isEqualTo(1);

        assertThat(coordinator.disconnect(BOB, bobChannel, "1006")).isTrue();

        assertThat(rooms.roomsOf("bob")).isEmpty();
        assertThat(typing.isTyping("general", "bob")).isFalse();
        assertThat(aliceChannel.getSent())
                .extracting(OutboundEvent::getEvent)
                .containsExactly("typing_stop", "user_offline");

        DeliveryReceipt receipt = coordinator.sendMessage(ALICE, message("general", "m2", "anyone?"));
        assertThat(receipt.getQueuedFor()).isZero();
    }

    @Test
    void closeOfSupersededChannelLeavesNewConnectionIntact() {
        connectBothToGeneral();
        RecordingChannel second = new RecordingChannel("b-2");

        coordinator.connect(BOB, second);

        assertThat(bobChannel.isOpen()).isFalse();
        assertThat(bobChannel.getCloseReason()).isNotBlank();

        assertThat(coordinator.disconnect(BOB, bobChannel, "superseded")).isFalse();
        assertThat(registry.connectionOf("bob").getChannel()).isSameAs(second);
        assertThat(rooms.isMember("bob", "general")).isTrue();
        assertThat(aliceChannel.eventsOf(OutboundEventType.USER_OFFLINE)).isEmpty();

        coordinator.sendMessage(ALICE, message("general", "m1", "hi again"));
        assertThat(second.eventsOf(OutboundEventType.NEW_MESSAGE)).hasSize(1);
    }

    @Test
    void forceDisconnectCleansUpAndClosesTheChannel() {
        connectBothToGeneral();

        assertThat(coordinator.forceDisconnect("bob", "kicked")).isTrue();

        assertThat(bobChannel.isOpen()).isFalse();
        assertThat(bobChannel.getCloseReason()).isEqualTo("kicked");
        assertThat(registry.isOnline("bob")).isFalse();
        assertThat(aliceChannel.eventsOf(OutboundEventType.USER_OFFLINE)).hasSize(1);
        assertThat(coordinator.forceDisconnect("bob", "again")).isFalse();
    }

    @Test
    void typingStartIsBroadcastOnceAndExpiresIntoTypingStop() {
        connectBothToGeneral();

        coordinator.typingStart(BOB, "general");
        timers.advance(Duration.ofSeconds(1));
        coordinator.typingStart(BOB, "general");

        assertThat(aliceChannel.eventsOf(OutboundEventType.TYPING_START)).hasSize(1);
        assertThat(coordinator.typingUsers("general")).containsExactly("bob");

        timers.advance(Duration.ofMillis(2999));
        assertThat(aliceChannel.eventsOf(OutboundEventType.TYPING_STOP)).isEmpty();
        timers.advance(Duration.ofMillis(1));
        assertThat(aliceChannel.payloadsOf(OutboundEventType.TYPING_STOP, PresenceNotice.class))
                .extracting(PresenceNotice::getUserId)
                .containsExactly("bob");
        assertThat(bobChannel.eventsOf(OutboundEventType.TYPING_STOP)).isEmpty();
    }

    @Test
    void typingStopWhenIdleBroadcastsNothing() {
        connectBothToGeneral();

        coordinator.typingStop(BOB, "general");

        assertThat(aliceChannel.eventsOf(OutboundEventType.TYPING_STOP)).isEmpty();
    }

    @Test
    void markReadUpdatesLedgerAndNotifiesSender() {
        connectBothToGeneral();
        coordinator.sendMessage(ALICE, message("general", "m1", "read me"));
        clock.advance(Duration.ofSeconds(10));

        coordinator.markRead(BOB, ReceiptRequest.builder().messageId("m1").senderId("alice").build());

        assertThat(ledger.statusOf("m1", "bob").getStatus()).isEqualTo(DeliveryStatus.READ);
        List<ReceiptNotice> notices = aliceChannel.payloadsOf(OutboundEventType.MESSAGE_READ, ReceiptNotice.class);
        assertThat(notices).hasSize(1);
        assertThat(notices.get(0).getMessageId()).isEqualTo("m1");
        assertThat(notices.get(0).getConfirmedBy()).isEqualTo("bob");
        assertThat(notices.get(0).getTimestamp()).isEqualTo("2024-05-01T10:00:10Z");
    }

    @Test
    void markReadOfUnknownMessageCreatesNoRecord() {
        connectBothToGeneral();

        coordinator.markRead(BOB, ReceiptRequest.builder().messageId("ghost").build());

        assertThat(coordinator.deliveryStatus("ghost")).isEmpty();
    }

    @Test
    void deliveryConfirmationIsForwardedToOnlineSenderOnly() {
        connectBothToGeneral();

        coordinator.confirmDelivered(BOB, ReceiptRequest.builder().messageId("m1").senderId("alice").build());
        coordinator.confirmDelivered(ALICE, ReceiptRequest.builder().messageId("m2").senderId("carol").build());

        assertThat(aliceChannel.eventsOf(OutboundEventType.MESSAGE_DELIVERY_CONFIRMED)).hasSize(1);
        assertThat(bobChannel.eventsOf(OutboundEventType.MESSAGE_DELIVERY_CONFIRMED)).isEmpty();
    }

    @Test
    void editDeleteAndReactionsReachOtherMembers() {
        connectBothToGeneral();

        coordinator.editMessage(ALICE, EditMessageRequest.builder()
                .roomId("general").messageId("m1").newText("fixed").build());
        coordinator.deleteMessage(ALICE, MessageRefRequest.builder().roomId("general").messageId("m2").build());
        ReactionRequest reaction = ReactionRequest.builder().roomId("general").messageId("m1").emoji("👍").build();
        coordinator.addReaction(ALICE, reaction);
        coordinator.removeReaction(ALICE, reaction);

        assertThat(bobChannel.getSent())
                .extracting(OutboundEvent::getEvent)
                .containsExactly("message_edited", "message_deleted", "reaction_added", "reaction_removed");
        MessageChangeNotice edit = bobChannel.payloadsOf(OutboundEventType.MESSAGE_EDITED, MessageChangeNotice.class).get(0);
        assertThat(edit.getNewText()).isEqualTo("fixed");
        assertThat(edit.getChangedBy()).isEqualTo("alice");
        ReactionNotice added = bobChannel.payloadsOf(OutboundEventType.REACTION_ADDED, ReactionNotice.class).get(0);
        assertThat(added.getEmoji()).isEqualTo("👍");
        assertThat(aliceChannel.getSent()).isEmpty();
    }

    @Test
    void statusUpdateReachesEveryRoomOfTheUser() {
        connectBothToGeneral();
        RecordingChannel carolChannel = new RecordingChannel("c-1");
        coordinator.connect(CAROL, carolChannel);
        coordinator.joinRoom(CAROL, "random");
        coordinator.joinRoom(BOB, "random");
        aliceChannel.clear();
        carolChannel.clear();

        coordinator.updateStatus(BOB, "away");

        assertThat(aliceChannel.payloadsOf(OutboundEventType.STATUS_UPDATE, PresenceNotice.class))
                .extracting(PresenceNotice::getStatus)
                .containsExactly("away");
        assertThat(carolChannel.payloadsOf(OutboundEventType.STATUS_UPDATE, PresenceNotice.class))
                .extracting(PresenceNotice::getRoomId)
                .containsExactly("random");
    }

    @Test
    void onlineMembersAndStatsReflectState() {
        connectBothToGeneral();
        registry.unregister("bob");
        coordinator.sendMessage(ALICE, message("general", "m1", "x"));

        assertThat(coordinator.onlineMembersOf("general")).containsExactly("alice");
        assertThat(coordinator.stats().getOnlineUsers()).isEqualTo(1);
        assertThat(coordinator.stats().getActiveRooms()).isEqualTo(1);
        assertThat(coordinator.stats().getQueuedMessages()).isEqualTo(1);
        assertThat(coordinator.getMessagesAccepted()).isEqualTo(1);
        assertThat(coordinator.getMessagesQueued()).isEqualTo(1);
    }

    private void connectBothToGeneral() {
        coordinator.connect(ALICE, aliceChannel);
        coordinator.connect(BOB, bobChannel);
        coordinator.joinRoom(ALICE, "general");
        coordinator.joinRoom(BOB, "general");
    }

    private static SendMessageRequest message(String roomId, String id, String content) {
        return SendMessageRequest.builder()
                .roomId(roomId)
                .message(SendMessageRequest.MessageContent.builder().id(id).content(content).type("text").build())
                .build();
    }
}
