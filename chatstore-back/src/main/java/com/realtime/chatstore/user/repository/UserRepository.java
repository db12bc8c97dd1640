package com.realtime.chatstore.user.repository;

import com.realtime.chatstore.user.entity.User;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface UserRepository extends JpaRepository<User, UUID> {

    Optional<User> findByIdAndDeletedAtIsNull(UUID id);

    List<User> findByIdInAndDeletedAtIsNull(Collection<UUID> ids);

    // 유일성 검사는 모두 살아있는 행(deleted_at is null) 기준
    @Query("select u from User u where lower(u.username) = lower(:username) and u.deletedAt is null")
    Optional<User> findLiveByUsernameCi(@Param("username") String username);

    @Query("select u from User u where lower(u.email) = lower(:email) and u.deletedAt is null")
    Optional<User> findLiveByEmailCi(@Param("email") String email);

    Optional<User> findByPhoneAndDeletedAtIsNull(String phone);

    /** 같은 사용자 쌍에 대한 작업을 직렬화할 때 사용 (항상 정규 순서로 잠글 것) */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from User u where u.id = :id and u.deletedAt is null")
    Optional<User> lockLiveById(@Param("id") UUID id);
}
