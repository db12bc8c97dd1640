package com.realtime.chatstore.chat.repository;

import com.realtime.chatstore.chat.entity.Participant;
import com.realtime.chatstore.chat.entity.ParticipantId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ParticipantRepository extends JpaRepository<Participant, ParticipantId> {

    Optional<Participant> findByIdAndDeletedAtIsNull(ParticipantId id);

    /** 방의 살아있는 참여자 + 사용자 정보 */
    @Query("""
           select p from Participant p
             join fetch p.user
           where p.id.conversationId in :conversationIds
             and p.deletedAt is null
           order by p.joinedAt asc
           """)
    List<Participant> findLiveWithUsers(@Param("conversationIds") Collection<UUID> conversationIds);

    /** 미읽음 +1 (보낸 본인, 나간 사람 제외) */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
           update Participant p
           set p.unreadCount = p.unreadCount + 1
           where p.id.conversationId = :conversationId
             and p.id.userId <> :senderId
             and p.deletedAt is null
           """)
    int bumpUnread(@Param("conversationId") UUID conversationId, @Param("senderId") UUID senderId);

    /**
     * 읽음 처리. 카운터는 상대 감소가 아니라 절대값으로 덮어쓴다.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
           update Participant p
           set p.unreadCount = :unread,
               p.lastSeenMessageId = :messageId
           where p.id.conversationId = :conversationId
             and p.id.userId = :userId
             and p.deletedAt is null
           """)
    int markSeen(@Param("conversationId") UUID conversationId,
                 @Param("userId") UUID userId,
                 @Param("messageId") UUID messageId,
                 @Param("unread") int unread);
}
