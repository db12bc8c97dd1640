package com.realtime.chatstore.chat.service;

import com.realtime.chatstore.chat.dto.MessageDto;
import com.realtime.chatstore.chat.dto.MessagePage;
import com.realtime.chatstore.chat.dto.ReadAck;
import com.realtime.chatstore.chat.entity.LastMessage;
import com.realtime.chatstore.chat.entity.Message;
import com.realtime.chatstore.chat.entity.ParticipantId;
import com.realtime.chatstore.chat.repository.ConversationRepository;
import com.realtime.chatstore.chat.repository.LastMessageRepository;
import com.realtime.chatstore.chat.repository.MessageRepository;
import com.realtime.chatstore.chat.repository.ParticipantRepository;
import com.realtime.chatstore.common.error.AuthorizationException;
import com.realtime.chatstore.common.error.NotFoundException;
import com.realtime.chatstore.common.error.ValidationException;
import com.realtime.chatstore.support.StoreIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageServiceTest extends StoreIntegrationTest {

    @Autowired
    MessageService messageService;

    @Autowired
    ConversationService conversationService;

    @Autowired
    ReadStateService readStateService;

    @Autowired
    MessageRepository messageRepo;

    @Autowired
    LastMessageRepository lastMessageRepo;

    @Autowired
    ParticipantRepository participantRepo;

    @Autowired
    ConversationRepository conversationRepo;

    @Autowired
    LastMessageService lastMessageService;

    @Autowired
    PlatformTransactionManager txManager;

    UUID direct;

    @BeforeEach
    void setUp() {
        user(1);
        user(2);
        direct = conversationService.createDirect(id(1), id(2)).getId();
    }

    /* ===================== 전송 ===================== */

    @Test
    void replyInDirectConversationUpdatesLastMessageAndUnread() {
        messageService.send(direct, id(1), null, "hi", null, null);
        messageService.send(direct, id(2), null, "hey", null, null);

        assertThat(lastMessage(direct)).map(LastMessage::getContent).contains("hey");
        assertThat(unreadOf(direct, 1)).isEqualTo(1);
        assertThat(unreadOf(direct, 2)).isZero();
    }

    @Test
    void sendingMovesSendersReadPositionToOwnMessage() {
        messageService.send(direct, id(1), null, "one", null, null);
        messageService.send(direct, id(1), null, "two", null, null);
        assertThat(unreadOf(direct, 2)).isEqualTo(2);

        MessageDto reply = messageService.send(direct, id(2), null, "read both", null, null);

        assertThat(unreadOf(direct, 2)).isZero();
        assertThat(participantRepo.findById(new ParticipantId(direct, id(2))).orElseThrow().getLastSeenMessageId())
                .isEqualTo(reply.getId());
    }

    @Test
    void senderNeverCountsOwnMessages() {
        for (int i = 0; i < 3; i++) {
            messageService.send(direct, id(1), null, "m" + i, null, null);
        }

        assertThat(unreadOf(direct, 1)).isZero();
        assertThat(unreadOf(direct, 2)).isEqualTo(3);
    }

    @Test
    void payloadMustMatchType() {
        assertThatThrownBy(() -> messageService.send(direct, id(1), Message.Type.TEXT, " ", null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> messageService.send(direct, id(1), Message.Type.IMAGE, "caption", null, null))
                .isInstanceOf(ValidationException.class);

        MessageDto image = messageService.send(direct, id(1), Message.Type.IMAGE, null, "/uploads/a.png", null);

        assertThat(image.getType()).isEqualTo("IMAGE");
        assertThat(image.getFileUrl()).isEqualTo("/uploads/a.png");
        assertThat(messageRepo.count()).isEqualTo(1);
    }

    @Test
    void senderMustBeLiveParticipantOfExistingConversation() {
        user(3);

        assertThatThrownBy(() -> messageService.send(direct, id(3), null, "intruder", null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> messageService.send(UUID.randomUUID(), id(1), null, "lost", null, null))
                .isInstanceOf(NotFoundException.class);
        assertThat(messageRepo.count()).isZero();
        assertThat(lastMessage(direct)).isEmpty();
    }

    @Test
    void replyMustStayInTheSameConversation() {
        user(3);
        UUID other = conversationService.createDirect(id(1), id(3)).getId();
        MessageDto elsewhere = messageService.send(other, id(3), null, "over here", null, null);
        MessageDto original = messageService.send(direct, id(2), null, "question?", null, null);

        assertThatThrownBy(() -> messageService.send(direct, id(1), null, "answer", null, elsewhere.getId()))
                .isInstanceOf(ValidationException.class);

        MessageDto reply = messageService.send(direct, id(1), null, "answer", null, original.getId());
        assertThat(reply.getReplyToId()).isEqualTo(original.getId());
    }

    /* ===================== 동시 쓰기 ===================== */

    @Test
    void lateOlderMessageDoesNotReplaceNewerLastMessage() {
        Instant base = Instant.parse("2030-01-01T00:00:00Z");
        TransactionTemplate txTemplate = new TransactionTemplate(txManager);

        UUID newerId = txTemplate.execute(status -> {
            Message newer = storeAt(id(2), "newer", base.plusMillis(5));
            lastMessageService.onCreated(newer);
            return newer.getId();
        });
        // 늦게 커밋된 쪽이 더 오래된 메시지
        txTemplate.executeWithoutResult(status ->
                lastMessageService.onCreated(storeAt(id(1), "older", base)));

        LastMessage last = lastMessage(direct).orElseThrow();
        assertThat(last.getMessageId()).isEqualTo(newerId);
        assertThat(last.getContent()).isEqualTo("newer");
        assertThat(last.getCreatedAt()).isEqualTo(base.plusMillis(5));
    }

    @Test
    void concurrentSendsConvergeOnTheNewestMessage() throws Exception {
        List<Callable<?>> tasks = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            UUID sender = id(i % 2 + 1);
            String content = "burst " + i;
            tasks.add(() -> messageService.send(direct, sender, null, content, null, null));
        }

        List<Object> outcomes = race(tasks);

        assertThat(outcomes).allMatch(MessageDto.class::isInstance);
        assertThat(messageRepo.count()).isEqualTo(6);
        Message newest = messageRepo
                .findFirstByConversation_IdAndDeletedAtIsNullOrderByCreatedAtDescIdDesc(direct)
                .orElseThrow();
        assertThat(lastMessage(direct)).map(LastMessage::getMessageId).contains(newest.getId());
    }

    /* ===================== 수정 / 삭제 ===================== */

    @Test
    void deletingMirroredMessageFallsBackToOlderOne() {
        MessageDto older = messageService.send(direct, id(1), null, "older", null, null);
        MessageDto newest = messageService.send(direct, id(2), null, "newest", null, null);
        assertThat(lastMessage(direct)).map(LastMessage::getMessageId).contains(newest.getId());

        messageService.delete(newest.getId(), id(2));

        LastMessage last = lastMessage(direct).orElseThrow();
        assertThat(last.getMessageId()).isEqualTo(older.getId());
        assertThat(last.getContent()).isEqualTo("older");
        assertThat(last.getCreatedAt()).isEqualTo(older.getCreatedAt());
    }

    @Test
    void deletingTheOnlyMessageClearsLastMessage() {
        MessageDto only = messageService.send(direct, id(1), null, "only", null, null);

        messageService.delete(only.getId(), id(1));

        assertThat(lastMessage(direct)).isEmpty();
        assertThat(messageRepo.findById(only.getId())).get()
                .satisfies(m -> assertThat(m.getDeletedAt()).isNotNull());
        assertThatThrownBy(() -> messageService.delete(only.getId(), id(1)))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void deletingAnOlderMessageLeavesLastMessageAlone() {
        MessageDto older = messageService.send(direct, id(1), null, "older", null, null);
        MessageDto newest = messageService.send(direct, id(1), null, "newest", null, null);

        messageService.delete(older.getId(), id(1));

        assertThat(lastMessage(direct)).map(LastMessage::getMessageId).contains(newest.getId());
    }

    @Test
    void repliesSurviveSoftDeleteOfTheirTarget() {
        MessageDto original = messageService.send(direct, id(1), null, "original", null, null);
        MessageDto reply = messageService.send(direct, id(2), null, "reply", null, original.getId());

        messageService.delete(original.getId(), id(1));

        assertThat(messageService.get(reply.getId(), id(1)).getReplyToId()).isEqualTo(original.getId());
        assertThatThrownBy(() -> messageService.get(original.getId(), id(1)))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void editByOwnerMarksEditedAndRefreshesMirror() {
        MessageDto m = messageService.send(direct, id(1), null, "typo", null, null);

        MessageDto edited = messageService.edit(m.getId(), id(1), "fixed");

        assertThat(edited.isEdited()).isTrue();
        assertThat(edited.getContent()).isEqualTo("fixed");
        assertThat(lastMessage(direct)).map(LastMessage::getContent).contains("fixed");
    }

    @Test
    void onlySenderMayEditOrDelete() {
        MessageDto m = messageService.send(direct, id(1), null, "mine", null, null);

        assertThatThrownBy(() -> messageService.edit(m.getId(), id(2), "theirs"))
                .isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> messageService.delete(m.getId(), id(2)))
                .isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> messageService.edit(UUID.randomUUID(), id(1), "ghost"))
                .isInstanceOf(NotFoundException.class);
    }

    /* ===================== 읽음 ===================== */

    @Test
    void markReadSetsCounterToMessagesAfterTheMarkedOne() {
        messageService.send(direct, id(2), null, "own message", null, null);
        List<MessageDto> sent = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            sent.add(messageService.send(direct, id(1), null, "m" + i, null, null));
        }
        assertThat(unreadOf(direct, 2)).isEqualTo(4);

        ReadAck ack = readStateService.markRead(direct, id(2), sent.get(1).getId());

        assertThat(ack.unread()).isEqualTo(2);
        assertThat(unreadOf(direct, 2)).isEqualTo(2);
        assertThat(participantRepo.findById(new ParticipantId(direct, id(2))).orElseThrow().getLastSeenMessageId())
                .isEqualTo(sent.get(1).getId());

        ReadAck newest = readStateService.markRead(direct, id(2), sent.get(3).getId());
        assertThat(newest.unread()).isZero();
    }

    @Test
    void markReadRejectsForeignMessagesAndOutsiders() {
        user(3);
        UUID other = conversationService.createDirect(id(1), id(3)).getId();
        MessageDto foreign = messageService.send(other, id(3), null, "elsewhere", null, null);
        MessageDto here = messageService.send(direct, id(1), null, "here", null, null);

        assertThatThrownBy(() -> readStateService.markRead(direct, id(2), foreign.getId()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> readStateService.markRead(direct, id(3), here.getId()))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    void markAllReadClearsTheCounter() {
        messageService.send(direct, id(1), null, "a", null, null);
        MessageDto last = messageService.send(direct, id(1), null, "b", null, null);

        ReadAck ack = readStateService.markAllRead(direct, id(2));

        assertThat(ack.unread()).isZero();
        assertThat(ack.lastSeenMessageId()).isEqualTo(last.getId());
        assertThat(unreadOf(direct, 2)).isZero();
    }

    @Test
    void markAllReadOnEmptyConversationChangesNothing() {
        ReadAck ack = readStateService.markAllRead(direct, id(1));

        assertThat(ack.unread()).isZero();
        assertThat(ack.lastSeenMessageId()).isNull();
    }

    /* ===================== 히스토리 ===================== */

    @Test
    void historyPagesNewestFirstWithCursor() {
        List<UUID> ids = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            ids.add(messageService.send(direct, id(1 + (i % 2)), null, "m" + i, null, null).getId());
        }
        messageService.delete(ids.get(2), id(1));

        MessagePage first = messageService.history(direct, id(1), null, 2);
        assertThat(first.messages()).extracting(MessageDto::getContent).containsExactly("m4", "m3");
        assertThat(first.nextCursor()).isNotNull();
        assertThat(first.nextCursor().id()).isEqualTo(ids.get(3));

        MessagePage second = messageService.history(direct, id(1), first.nextCursor(), 2);
        assertThat(second.messages()).extracting(MessageDto::getContent).containsExactly("m1", "m0");
        assertThat(second.nextCursor()).isNull();
    }

    @Test
    void historyLimitIsClamped() {
        for (int i = 0; i < 3; i++) {
            messageService.send(direct, id(1), null, "m" + i, null, null);
        }

        assertThat(messageService.history(direct, id(2), null, 0).messages()).hasSize(1);
        assertThat(messageService.history(direct, id(2), null, 10_000).messages()).hasSize(3);
        assertThat(messageService.history(direct, id(2), null, null).messages()).hasSize(3);
        assertThat(messageService.clampLimit(10_000)).isEqualTo(200);
    }

    @Test
    void historyIsForParticipantsOnly() {
        user(3);

        assertThatThrownBy(() -> messageService.history(direct, id(3), null, 10))
                .isInstanceOf(AuthorizationException.class);
    }

    private Message storeAt(UUID sender, String content, Instant at) {
        return messageRepo.save(Message.builder()
                .conversation(conversationRepo.getReferenceById(direct))
                .sender(userRepository.getReferenceById(sender))
                .content(content)
                .createdAt(at)
                .updatedAt(at)
                .build());
    }

    private Optional<LastMessage> lastMessage(UUID conversationId) {
        return lastMessageRepo.findByConversation_Id(conversationId);
    }

    private int unreadOf(UUID conversationId, long user) {
        return participantRepo.findById(new ParticipantId(conversationId, id(user)))
                .orElseThrow()
                .getUnreadCount();
    }
}
