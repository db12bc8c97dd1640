package com.realtime.chatstore.chat.repository;

import com.realtime.chatstore.chat.entity.Message;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface MessageRepository extends JpaRepository<Message, UUID> {

    Optional<Message> findByIdAndDeletedAtIsNull(UUID id);

    // 최신 N개 (created_at DESC, id DESC 로 동률까지 전순서)
    @Query("""
           select m from Message m
           where m.conversation.id = :conversationId
             and m.deletedAt is null
           order by m.createdAt desc, m.id desc
           """)
    List<Message> findLatest(@Param("conversationId") UUID conversationId, Pageable pageable);

    // 커서 (createdAt, id) 보다 오래된 N개
    @Query("""
           select m from Message m
           where m.conversation.id = :conversationId
             and m.deletedAt is null
             and (m.createdAt < :beforeAt or (m.createdAt = :beforeAt and m.id < :beforeId))
           order by m.createdAt desc, m.id desc
           """)
    List<Message> findBefore(@Param("conversationId") UUID conversationId,
                             @Param("beforeAt") Instant beforeAt,
                             @Param("beforeId") UUID beforeId,
                             Pageable pageable);

    /** 마지막 메시지 재계산용: 살아있는 메시지 중 최신 1건 */
    Optional<Message> findFirstByConversation_IdAndDeletedAtIsNullOrderByCreatedAtDescIdDesc(UUID conversationId);

    /** 새 참여자의 읽음 기준: soft delete 여부와 무관하게 최신 1건 */
    Optional<Message> findFirstByConversation_IdOrderByCreatedAtDescIdDesc(UUID conversationId);

    /**
     * 기준 메시지 이후 다른 사람이 보낸 메시지 수.
     * 전송 시 +1 과 같은 집합을 세도록 soft delete 된 것도 포함한다.
     */
    @Query("""
           select count(m) from Message m
           where m.conversation.id = :conversationId
             and m.sender.id <> :userId
             and (m.createdAt > :afterAt or (m.createdAt = :afterAt and m.id > :afterId))
           """)
    long countFromOthersAfter(@Param("conversationId") UUID conversationId,
                              @Param("userId") UUID userId,
                              @Param("afterAt") Instant afterAt,
                              @Param("afterId") UUID afterId);
}
