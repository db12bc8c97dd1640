package com.realtime.chatstore.chat.service;

import com.realtime.chatstore.chat.entity.LastMessage;
import com.realtime.chatstore.chat.entity.Message;
import com.realtime.chatstore.chat.repository.LastMessageRepository;
import com.realtime.chatstore.chat.repository.MessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * 대화방별 마지막 메시지 투영 유지. 호출자의 쓰기 트랜잭션 안에서만 동작한다.
 * 결과 행은 항상 "살아있는 메시지 중 (created_at, id) 가 가장 큰 것" 이거나 없어야 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
class LastMessageService {

    private final LastMessageRepository lastMessageRepo;
    private final MessageRepository messageRepo;

    /** 새 메시지: 현재 행보다 최신일 때만 덮어쓴다 (last-writer-wins) */
    void onCreated(Message m) {
        UUID conversationId = m.getConversation().getId();
        LastMessage last = lastMessageRepo.findByConversation_Id(conversationId).orElse(null);
        if (last == null) {
            last = LastMessage.builder().conversation(m.getConversation()).build();
            last.mirror(m);
            lastMessageRepo.save(last);
            log.debug("last message of {} initialised to {}", conversationId, m.getId());
            return;
        }
        if (last.isOlderThan(m)) {
            last.mirror(m);
            log.debug("last message of {} advanced to {}", conversationId, m.getId());
        }
    }

    /** 수정: 지금 비추고 있는 메시지면 내용만 갱신 */
    void onEdited(Message m) {
        lastMessageRepo.findByConversation_Id(m.getConversation().getId())
                .filter(l -> l.getMessageId().equals(m.getId()))
                .ifPresent(l -> l.setContent(m.getContent()));
    }

    /** 삭제: 비추던 메시지면 남은 최신 메시지로 다시 계산, 없으면 행 삭제 */
    void onDeleted(Message m) {
        UUID conversationId = m.getConversation().getId();
        LastMessage last = lastMessageRepo.findByConversation_Id(conversationId).orElse(null);
        if (last == null || !last.getMessageId().equals(m.getId())) return;

        messageRepo.flush();
        messageRepo.findFirstByConversation_IdAndDeletedAtIsNullOrderByCreatedAtDescIdDesc(conversationId)
                .ifPresentOrElse(
                        newest -> {
                            last.mirror(newest);
                            log.debug("last message of {} recomputed to {}", conversationId, newest.getId());
                        },
                        () -> {
                            lastMessageRepo.delete(last);
                            log.debug("last message of {} cleared", conversationId);
                        });
    }
}
