package com.realtime.chatstore.chat.service;

import com.realtime.chatstore.chat.dto.MessageCursor;
import com.realtime.chatstore.chat.dto.MessageDto;
import com.realtime.chatstore.chat.dto.MessagePage;
import com.realtime.chatstore.chat.entity.Conversation;
import com.realtime.chatstore.chat.entity.Message;
import com.realtime.chatstore.chat.entity.Participant;
import com.realtime.chatstore.chat.entity.ParticipantId;
import com.realtime.chatstore.chat.repository.ConversationRepository;
import com.realtime.chatstore.chat.repository.MessageRepository;
import com.realtime.chatstore.chat.repository.ParticipantRepository;
import com.realtime.chatstore.common.Timestamps;
import com.realtime.chatstore.common.TransactionRunner;
import com.realtime.chatstore.common.error.AuthorizationException;
import com.realtime.chatstore.common.error.NotFoundException;
import com.realtime.chatstore.common.error.ValidationException;
import com.realtime.chatstore.config.ChatProps;
import com.realtime.chatstore.notify.NotifyEvent;
import com.realtime.chatstore.notify.NotifyPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class MessageService {

    private static final int MAX_CONTENT = 4000;
    private static final int MAX_FILE_URL = 1024;

    private final MessageRepository messageRepo;
    private final ConversationRepository conversationRepo;
    private final ParticipantRepository participantRepo;
    private final ConversationService conversationService;
    private final ReadStateService readStateService;
    private final LastMessageService lastMessageService;
    private final NotifyPublisher notify;
    private final TransactionRunner tx;
    private final ChatProps props;
    private final Clock clock;

    // ─────────────────────────────────────────────────────────────────────────────
    //    전송
    //    한 트랜잭션 안에서: 방 touch(행 잠금) → 메시지 insert → 마지막 메시지 upsert → 미읽음 +1 → 보낸 사람 읽음 위치 이동
    // ─────────────────────────────────────────────────────────────────────────────
    public MessageDto send(UUID conversationId, UUID senderId, @Nullable Message.Type type,
                           @Nullable String content, @Nullable String fileUrl, @Nullable UUID replyToId) {
        Message.Type t = type == null ? Message.Type.TEXT : type;
        validatePayload(t, content, fileUrl);

        return tx.write("sendMessage", () -> {
            Conversation conv = conversationService.requireConversation(conversationId);
            Participant sender = participantRepo.findByIdAndDeletedAtIsNull(new ParticipantId(conversationId, senderId))
                    .orElseThrow(() -> new ValidationException("sender is not a participant of this conversation"));

            Message replyTo = null;
            if (replyToId != null) {
                replyTo = messageRepo.findById(replyToId)
                        .filter(r -> r.getConversation().getId().equals(conversationId))
                        .orElseThrow(() -> new ValidationException("reply target is not in this conversation"));
            }

            Instant now = Timestamps.now(clock);
            conversationRepo.touch(conversationId, now);

            Message m = messageRepo.save(Message.builder()
                    .conversation(conv)
                    .sender(sender.getUser())
                    .replyTo(replyTo)
                    .type(t)
                    .content(content)
                    .fileUrl(fileUrl)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());

            lastMessageService.onCreated(m);
            MessageDto dto = MessageDto.from(m);

            // 벌크 UPDATE 가 영속성 컨텍스트를 비우므로 마지막에 둔다
            readStateService.incrementUnread(conversationId, senderId);
            readStateService.advanceSender(conversationId, senderId, dto.getId(), dto.getCreatedAt());

            notify.toConversation(NotifyEvent.Type.MESSAGE_CREATED, senderId, conversationId, Map.of("messageId", dto.getId()));
            return dto;
        });
    }

    /* ===================== 수정 / 삭제 ===================== */

    public MessageDto edit(UUID messageId, UUID actingUserId, String newContent) {
        if (newContent == null || newContent.isBlank()) throw new ValidationException("content is required");
        if (newContent.length() > MAX_CONTENT) throw new ValidationException("content is too long");

        return tx.write("editMessage", () -> {
            Message m = requireOwnLive(messageId, actingUserId);
            m.setContent(newContent);
            m.setEdited(true);
            m.setUpdatedAt(Timestamps.now(clock));

            lastMessageService.onEdited(m);

            UUID conversationId = m.getConversation().getId();
            notify.toConversation(NotifyEvent.Type.MESSAGE_EDITED, actingUserId, conversationId, Map.of("messageId", messageId));
            return MessageDto.from(m);
        });
    }

    /** soft delete. 답장들은 참조를 그대로 유지한다 */
    public void delete(UUID messageId, UUID actingUserId) {
        tx.run("deleteMessage", () -> {
            Message m = requireOwnLive(messageId, actingUserId);
            Instant now = Timestamps.now(clock);
            m.setDeletedAt(now);
            m.setUpdatedAt(now);

            lastMessageService.onDeleted(m);

            UUID conversationId = m.getConversation().getId();
            notify.toConversation(NotifyEvent.Type.MESSAGE_DELETED, actingUserId, conversationId, Map.of("messageId", messageId));
        });
    }

    /* ===================== 조회 ===================== */

    /**
     * 최신 → 과거 순 페이지. before 가 있으면 그 (createdAt, id) 보다 오래된 것부터.
     * 한 건 더 읽어서 다음 페이지가 있는지 판단한다.
     */
    @Transactional(readOnly = true)
    public MessagePage history(UUID conversationId, UUID viewerId, @Nullable MessageCursor before, @Nullable Integer limit) {
        conversationService.requireConversation(conversationId);
        conversationService.requireLiveParticipant(conversationId, viewerId);

        int capped = clampLimit(limit);
        var page = PageRequest.of(0, capped + 1);

        List<Message> rows = (before == null)
                ? messageRepo.findLatest(conversationId, page)
                : messageRepo.findBefore(conversationId, requireCursor(before).createdAt(), before.id(), page);

        boolean hasMore = rows.size() > capped;
        List<Message> visible = hasMore ? rows.subList(0, capped) : rows;

        MessageCursor next = null;
        if (hasMore) {
            Message tail = visible.get(visible.size() - 1);
            next = new MessageCursor(tail.getCreatedAt(), tail.getId());
        }
        return new MessagePage(visible.stream().map(MessageDto::from).toList(), next);
    }

    @Transactional(readOnly = true)
    public MessageDto get(UUID messageId, UUID viewerId) {
        Message m = messageRepo.findByIdAndDeletedAtIsNull(messageId)
                .orElseThrow(() -> new NotFoundException("message not found"));
        conversationService.requireLiveParticipant(m.getConversation().getId(), viewerId);
        return MessageDto.from(m);
    }

    public int clampLimit(@Nullable Integer limit) {
        int requested = limit == null ? props.getHistoryDefaultLimit() : limit;
        return Math.min(props.getHistoryMaxLimit(), Math.max(1, requested));
    }

    /* ===================== 내부 ===================== */

    private Message requireOwnLive(UUID messageId, UUID actingUserId) {
        Message m = messageRepo.findByIdAndDeletedAtIsNull(messageId)
                .orElseThrow(() -> new NotFoundException("message not found"));
        if (!m.getSender().getId().equals(actingUserId)) {
            throw new AuthorizationException("only the sender can change this message");
        }
        return m;
    }

    private static MessageCursor requireCursor(MessageCursor c) {
        if (c.createdAt() == null || c.id() == null) {
            throw new ValidationException("cursor needs both createdAt and id");
        }
        return c;
    }

    private static void validatePayload(Message.Type type, String content, String fileUrl) {
        if (type.carriesText()) {
            if (content == null || content.isBlank()) {
                throw new ValidationException(type + " message requires content");
            }
        } else if (fileUrl == null || fileUrl.isBlank()) {
            throw new ValidationException(type + " message requires fileUrl");
        }
        if (content != null && content.length() > MAX_CONTENT) throw new ValidationException("content is too long");
        if (fileUrl != null && fileUrl.length() > MAX_FILE_URL) throw new ValidationException("fileUrl is too long");
    }
}
