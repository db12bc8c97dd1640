package com.realtime.chatstore.chat.repository;

import com.realtime.chatstore.chat.entity.Conversation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface ConversationRepository extends JpaRepository<Conversation, UUID> {

    /** 두 사용자가 모두 살아있는 참여자인 해당 타입의 방 */
    @Query("""
           select c from Conversation c
           where c.type = :type
             and exists (select p from Participant p
                         where p.conversation = c and p.user.id = :a and p.deletedAt is null)
             and exists (select p from Participant p
                         where p.conversation = c and p.user.id = :b and p.deletedAt is null)
           """)
    List<Conversation> findLiveBetween(@Param("type") Conversation.Type type,
                                       @Param("a") UUID a, @Param("b") UUID b);

    default List<Conversation> findLiveDirectBetween(UUID a, UUID b) {
        return findLiveBetween(Conversation.Type.DIRECT, a, b);
    }

    /** 내가 살아있는 참여자인 방들 (최근 활동순) */
    @Query("""
           select c from Participant p
             join p.conversation c
           where p.user.id = :me and p.deletedAt is null
           order by c.updatedAt desc
           """)
    List<Conversation> findLiveOf(@Param("me") UUID me);

    /**
     * updated_at 갱신. UPDATE 로 방 행 잠금을 먼저 잡아서 같은 방의 메시지 쓰기를 줄 세운다.
     */
    @Modifying(flushAutomatically = true)
    @Query("update Conversation c set c.updatedAt = :now where c.id = :id")
    int touch(@Param("id") UUID id, @Param("now") Instant now);
}
