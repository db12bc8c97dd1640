package com.realtime.chatstore.friend.service;

import com.realtime.chatstore.common.Timestamps;
import com.realtime.chatstore.common.TransactionRunner;
import com.realtime.chatstore.common.error.ConflictException;
import com.realtime.chatstore.common.error.NotFoundException;
import com.realtime.chatstore.common.error.ValidationException;
import com.realtime.chatstore.friend.dto.FriendBriefDto;
import com.realtime.chatstore.friend.dto.FriendRequestDto;
import com.realtime.chatstore.friend.dto.FriendshipDto;
import com.realtime.chatstore.friend.entity.FriendRequest;
import com.realtime.chatstore.friend.entity.Friendship;
import com.realtime.chatstore.friend.entity.FriendshipId;
import com.realtime.chatstore.friend.repository.FriendRequestRepository;
import com.realtime.chatstore.friend.repository.FriendshipRepository;
import com.realtime.chatstore.notify.NotifyEvent;
import com.realtime.chatstore.notify.NotifyPublisher;
import com.realtime.chatstore.user.dto.UserBriefDto;
import com.realtime.chatstore.user.entity.User;
import com.realtime.chatstore.user.repository.UserRepository;
import com.realtime.chatstore.user.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
@Service
@RequiredArgsConstructor
public class FriendService {

    private final FriendRequestRepository requestRepo;
    private final FriendshipRepository friendshipRepo;
    private final UserRepository userRepo;
    private final UserService userService;
    private final NotifyPublisher notify;
    private final TransactionRunner tx;
    private final Clock clock;

    /* ========== 요청 보내기 ========== */

    public FriendRequestDto sendRequest(UUID fromId, UUID toId, String message) {
        if (fromId == null || toId == null) throw new ValidationException("user ids are required");
        if (Objects.equals(fromId, toId)) {
            throw new ValidationException("cannot send friend request to yourself");
        }

        return tx.write("sendFriendRequest", () -> {
            User from = userService.requireLive(fromId);
            User to = userService.requireLive(toId);

            // 이미 친구 (방향 무관: 정규화 키 하나로 확인)
            if (friendshipRepo.findByIdAndDeletedAtIsNull(FriendshipId.of(fromId, toId)).isPresent()) {
                throw new ConflictException("users are already friends");
            }
            // 같은 방향 중복. 반대 방향 요청은 수락/거절 전까지 공존 가능
            if (requestRepo.existsByFromUser_IdAndToUser_Id(fromId, toId)) {
                throw new ConflictException("friend request already exists");
            }

            FriendRequest saved = requestRepo.saveAndFlush(FriendRequest.builder()
                    .fromUser(from)
                    .toUser(to)
                    .message(message)
                    .createdAt(Timestamps.now(clock))
                    .build());

            notify.toUser(NotifyEvent.Type.FRIEND_REQUEST_RECEIVED, fromId, toId, Map.of("requestId", saved.getId()));
            return FriendRequestDto.from(saved);
        });
    }

    /* ========== 수락 ========== */

    /**
     * 요청을 지우고 정규화 간선 (min, max)를 만든다. 같은 쌍의 반대 방향 보류 요청도 함께 지운다.
     * 반대 방향 요청을 동시에 수락한 트랜잭션이 먼저 커밋해 PK 충돌이 나면 "이미 친구"로 보고 기존 간선을 돌려준다.
     */
    public FriendshipDto accept(UUID requestId, UUID me) {
        AtomicReference<FriendshipId> pair = new AtomicReference<>();
        try {
            return tx.write("acceptFriendRequest", () -> {
                FriendRequest fr = requestRepo.findByIdAndToUser_Id(requestId, me)
                        .orElseThrow(() -> new NotFoundException("friend request not found"));
                UUID fromId = fr.getFromUser().getId();
                FriendshipId key = FriendshipId.of(fromId, me);
                pair.set(key);

                int removed = requestRepo.deleteAllBetween(fromId, me);

                Friendship edge = friendshipRepo.findById(key).orElse(null);
                if (edge == null) {
                    edge = friendshipRepo.saveAndFlush(Friendship.builder()
                            .id(key)
                            .userA(userRepo.getReferenceById(key.getUserA()))
                            .userB(userRepo.getReferenceById(key.getUserB()))
                            .createdAt(Timestamps.now(clock))
                            .build());
                } else if (!edge.isActive()) {
                    // 끊었던 관계 복구: 행은 하나뿐
                    edge.setDeletedAt(null);
                }

                log.info("friendship {} created (removed {} pending request(s))", key, removed);
                notify.toUser(NotifyEvent.Type.FRIEND_REQUEST_ACCEPTED, me, fromId, Map.of("requestId", requestId));
                return FriendshipDto.from(edge);
            });
        } catch (ConflictException e) {
            FriendshipId key = pair.get();
            if (key == null) throw e;
            return friendshipRepo.findByIdAndDeletedAtIsNull(key)
                    .map(existing -> {
                        log.info("concurrent accept for {} resolved as already friends", key);
                        return FriendshipDto.from(existing);
                    })
                    .orElseThrow(() -> e);
        }
    }

    /* ========== 거절 / 취소 ========== */

    /** 받은 사람이 거절. 이미 처리된 요청이면 NotFound */
    public void reject(UUID requestId, UUID me) {
        tx.run("rejectFriendRequest", () -> {
            FriendRequest fr = requestRepo.findByIdAndToUser_Id(requestId, me)
                    .orElseThrow(() -> new NotFoundException("friend request not found"));
            UUID fromId = fr.getFromUser().getId();
            requestRepo.delete(fr);
            notify.toUser(NotifyEvent.Type.FRIEND_REQUEST_DECLINED, me, fromId, Map.of("requestId", requestId));
        });
    }

    /** 보낸 사람이 철회 */
    public void cancel(UUID requestId, UUID me) {
        tx.run("cancelFriendRequest", () -> {
            FriendRequest fr = requestRepo.findByIdAndFromUser_Id(requestId, me)
                    .orElseThrow(() -> new NotFoundException("friend request not found"));
            UUID toId = fr.getToUser().getId();
            requestRepo.delete(fr);
            notify.toUser(NotifyEvent.Type.FRIEND_REQUEST_CANCELLED, me, toId, Map.of("requestId", requestId));
        });
    }

    /* ========== 친구 끊기 ========== */

    public void unfriend(UUID me, UUID other) {
        if (Objects.equals(me, other)) throw new ValidationException("cannot unfriend yourself");

        tx.run("unfriend", () -> {
            Friendship edge = friendshipRepo.findByIdAndDeletedAtIsNull(FriendshipId.of(me, other))
                    .orElseThrow(() -> new NotFoundException("friendship not found"));
            edge.setDeletedAt(Timestamps.now(clock));
            notify.toUser(NotifyEvent.Type.FRIEND_REMOVED, me, other, Map.of());
        });
    }

    /* ========== 조회 ========== */

    @Transactional(readOnly = true)
    public boolean areFriends(UUID a, UUID b) {
        if (a == null || b == null || a.equals(b)) return false;
        return friendshipRepo.findByIdAndDeletedAtIsNull(FriendshipId.of(a, b)).isPresent();
    }

    @Transactional(readOnly = true)
    public List<FriendBriefDto> listFriends(UUID me) {
        return friendshipRepo.findActiveOf(me).stream()
                .map(f -> {
                    User other = f.getId().getUserA().equals(me) ? f.getUserB() : f.getUserA();
                    return other.isDeleted() ? null : new FriendBriefDto(UserBriefDto.from(other), f.getCreatedAt());
                })
                .filter(Objects::nonNull)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<FriendRequestDto> incoming(UUID me) {
        return requestRepo.findByToUser_IdOrderByCreatedAtDesc(me).stream()
                .map(FriendRequestDto::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<FriendRequestDto> outgoing(UUID me) {
        return requestRepo.findByFromUser_IdOrderByCreatedAtDesc(me).stream()
                .map(FriendRequestDto::from)
                .toList();
    }
}
