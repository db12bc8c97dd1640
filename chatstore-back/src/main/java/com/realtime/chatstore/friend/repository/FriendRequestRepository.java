package com.realtime.chatstore.friend.repository;

import com.realtime.chatstore.friend.entity.FriendRequest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface FriendRequestRepository extends JpaRepository<FriendRequest, UUID> {

    // 방향 있는 중복 확인 (from → to)
    boolean existsByFromUser_IdAndToUser_Id(UUID fromUserId, UUID toUserId);

    // 받은 요청 목록 (최신순)
    List<FriendRequest> findByToUser_IdOrderByCreatedAtDesc(UUID toUserId);

    // 보낸 요청 목록 (최신순)
    List<FriendRequest> findByFromUser_IdOrderByCreatedAtDesc(UUID fromUserId);

    /** 수락/거절 시 본인 수신자 권한 확인 */
    Optional<FriendRequest> findByIdAndToUser_Id(UUID id, UUID toUserId);

    /** 취소 시 본인 발신자 권한 확인 */
    Optional<FriendRequest> findByIdAndFromUser_Id(UUID id, UUID fromUserId);

    /** 두 사용자 사이의 보류 요청을 방향과 무관하게 모두 삭제 */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
           delete from FriendRequest r
           where (r.fromUser.id = :a and r.toUser.id = :b)
              or (r.fromUser.id = :b and r.toUser.id = :a)
           """)
    int deleteAllBetween(@Param("a") UUID a, @Param("b") UUID b);
}
