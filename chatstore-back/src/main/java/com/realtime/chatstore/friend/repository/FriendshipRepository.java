package com.realtime.chatstore.friend.repository;

import com.realtime.chatstore.friend.entity.Friendship;
import com.realtime.chatstore.friend.entity.FriendshipId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface FriendshipRepository extends JpaRepository<Friendship, FriendshipId> {

    /** id는 반드시 FriendshipId.of(...)로 정규화해서 넘길 것 */
    Optional<Friendship> findByIdAndDeletedAtIsNull(FriendshipId id);

    /** 내가 user_a 이든 user_b 이든 살아있는 간선 전부 */
    @Query("""
           select f from Friendship f
             join fetch f.userA
             join fetch f.userB
           where (f.id.userA = :me or f.id.userB = :me)
             and f.deletedAt is null
           order by f.createdAt desc
           """)
    List<Friendship> findActiveOf(@Param("me") UUID me);
}
