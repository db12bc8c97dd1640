package com.realtime.chatstore.chat.service;

import com.realtime.chatstore.chat.dto.ReadAck;
import com.realtime.chatstore.chat.entity.Message;
import com.realtime.chatstore.chat.repository.MessageRepository;
import com.realtime.chatstore.chat.repository.ParticipantRepository;
import com.realtime.chatstore.common.TransactionRunner;
import com.realtime.chatstore.common.error.ValidationException;
import com.realtime.chatstore.notify.NotifyEvent;
import com.realtime.chatstore.notify.NotifyPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 참여자별 읽음 위치와 미읽음 카운터.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReadStateService {

    private final ParticipantRepository participantRepo;
    private final MessageRepository messageRepo;
    private final ConversationService conversationService;
    private final NotifyPublisher notify;
    private final TransactionRunner tx;

    /**
     * 읽음 처리. 미읽음은 "기준 메시지 이후 다른 사람이 보낸 메시지 수" 로 덮어쓴다.
     * 동시에 들어온 전송의 +1 과 섞여도 다음 읽음 처리에서 정확한 값으로 돌아온다.
     */
    public ReadAck markRead(UUID conversationId, UUID userId, UUID messageId) {
        if (messageId == null) throw new ValidationException("messageId is required");

        return tx.write("markRead", () -> {
            conversationService.requireLiveParticipant(conversationId, userId);

            Message target = messageRepo.findById(messageId)
                    .filter(m -> m.getConversation().getId().equals(conversationId))
                    .orElseThrow(() -> new ValidationException("message does not belong to this conversation"));

            int unread = Math.toIntExact(messageRepo.countFromOthersAfter(
                    conversationId, userId, target.getCreatedAt(), target.getId()));
            return applySeen(conversationId, userId, target.getId(), unread);
        });
    }

    /** 최신 메시지까지 읽음. 빈 방이면 아무것도 바꾸지 않는다 */
    public ReadAck markAllRead(UUID conversationId, UUID userId) {
        return tx.write("markAllRead", () -> {
            var p = conversationService.requireLiveParticipant(conversationId, userId);

            Message newest = messageRepo
                    .findFirstByConversation_IdAndDeletedAtIsNullOrderByCreatedAtDescIdDesc(conversationId)
                    .orElse(null);
            if (newest == null) {
                return new ReadAck(conversationId, userId, p.getLastSeenMessageId(), p.getUnreadCount());
            }

            int unread = Math.toIntExact(messageRepo.countFromOthersAfter(
                    conversationId, userId, newest.getCreatedAt(), newest.getId()));
            return applySeen(conversationId, userId, newest.getId(), unread);
        });
    }

    /**
     * 보낸 사람을 뺀 살아있는 참여자 전원 +1. 메시지 전송 트랜잭션 안에서만 부른다.
     * 영속성 컨텍스트를 비우므로 호출 뒤에 관리 엔티티를 다시 쓰지 말 것.
     */
    public int incrementUnread(UUID conversationId, UUID excludingUserId) {
        int bumped = participantRepo.bumpUnread(conversationId, excludingUserId);
        log.debug("unread +1 for {} participant(s) in {}", bumped, conversationId);
        return bumped;
    }

    /**
     * 보낸 사람은 자기 메시지까지 읽은 것으로 본다. 전송 트랜잭션 안에서 {@link #incrementUnread} 뒤에 부른다.
     */
    void advanceSender(UUID conversationId, UUID senderId, UUID messageId, Instant createdAt) {
        int unread = Math.toIntExact(messageRepo.countFromOthersAfter(conversationId, senderId, createdAt, messageId));
        participantRepo.markSeen(conversationId, senderId, messageId, unread);
    }

    private ReadAck applySeen(UUID conversationId, UUID userId, UUID messageId, int unread) {
        participantRepo.markSeen(conversationId, userId, messageId, unread);

        Map<String, Object> payload = new HashMap<>();
        payload.put("messageId", messageId);
        payload.put("unread", unread);
        notify.toConversation(NotifyEvent.Type.MESSAGES_READ, userId, conversationId, payload);

        return new ReadAck(conversationId, userId, messageId, unread);
    }
}
