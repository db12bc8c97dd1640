package com.realtime.chatstore.user.service;

import com.realtime.chatstore.common.Normalizer;
import com.realtime.chatstore.common.TransactionRunner;
import com.realtime.chatstore.common.Timestamps;
import com.realtime.chatstore.common.error.ConflictException;
import com.realtime.chatstore.common.error.NotFoundException;
import com.realtime.chatstore.common.error.ValidationException;
import com.realtime.chatstore.user.dto.RegisterRequest;
import com.realtime.chatstore.user.dto.UpdateProfileRequest;
import com.realtime.chatstore.user.dto.UserDto;
import com.realtime.chatstore.user.entity.User;
import com.realtime.chatstore.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final Normalizer normalizer;
    private final TransactionRunner tx;
    private final Clock clock;

    // ============================ 가입 ============================
    public UserDto register(RegisterRequest req) {
        String username = normalizer.normalizeUsername(req.username());
        String email = normalizer.normalizeEmail(req.email());
        String phone = normalizer.normalizePhone(req.phone());

        if (username == null || username.isBlank()) throw new ValidationException("username is required");
        if (email == null || email.isBlank()) throw new ValidationException("email is required");
        if (req.displayName() == null || req.displayName().isBlank()) {
            throw new ValidationException("displayName is required");
        }
        if (req.passwordHash() == null || req.passwordHash().isBlank()) {
            throw new ValidationException("passwordHash is required");
        }

        return tx.write("register", () -> {
            if (userRepository.findLiveByUsernameCi(username).isPresent()) {
                throw new ConflictException("username already in use");
            }
            if (userRepository.findLiveByEmailCi(email).isPresent()) {
                throw new ConflictException("email already in use");
            }
            if (phone != null && userRepository.findByPhoneAndDeletedAtIsNull(phone).isPresent()) {
                throw new ConflictException("phone already in use");
            }

            User saved = userRepository.saveAndFlush(User.builder()
                    .id(UUID.randomUUID())
                    .username(username)
                    .email(email)
                    .phone(phone)
                    .displayName(req.displayName().trim())
                    .passwordHash(req.passwordHash())
                    .build());
            log.info("user registered: {}", saved.getId());
            return UserDto.from(saved);
        });
    }

    // ============================ 조회 ============================
    @Transactional(readOnly = true)
    public UserDto getUser(UUID id) {
        return UserDto.from(requireLive(id));
    }

    /** 다른 서비스에서 쓰는 살아있는 사용자 조회 (호출자 트랜잭션에 참여) */
    public User requireLive(UUID id) {
        if (id == null) throw new ValidationException("user id is required");
        return userRepository.findByIdAndDeletedAtIsNull(id)
                .orElseThrow(() -> new NotFoundException("user not found"));
    }

    /** 이메일 / 휴대폰 / username 순으로 판별해 살아있는 사용자를 찾는다. */
    @Transactional(readOnly = true)
    public Optional<User> findByIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) return Optional.empty();
        String idf = identifier.trim();

        if (normalizer.looksLikeEmail(idf)) {
            return userRepository.findLiveByEmailCi(normalizer.normalizeEmail(idf));
        }
        if (normalizer.looksLikePhone(idf)) {
            return userRepository.findByPhoneAndDeletedAtIsNull(normalizer.normalizePhone(idf));
        }
        return userRepository.findLiveByUsernameCi(idf);
    }

    // ============================ 수정/탈퇴 ============================
    public UserDto updateProfile(UUID id, UpdateProfileRequest req) {
        return tx.write("updateProfile", () -> {
            User user = requireLive(id);

            if (req.displayName() != null) {
                if (req.displayName().isBlank()) throw new ValidationException("displayName must not be blank");
                user.setDisplayName(req.displayName().trim());
            }
            if (req.bio() != null) user.setBio(req.bio());
            if (req.avatarUrl() != null) user.setAvatarUrl(req.avatarUrl());
            if (req.avatarId() != null) user.setAvatarId(req.avatarId());
            if (req.phone() != null) {
                String phone = normalizer.normalizePhone(req.phone());
                if (phone != null) {
                    userRepository.findByPhoneAndDeletedAtIsNull(phone)
                            .filter(other -> !other.getId().equals(id))
                            .ifPresent(other -> { throw new ConflictException("phone already in use"); });
                }
                user.setPhone(phone);
            }
            return UserDto.from(userRepository.saveAndFlush(user));
        });
    }

    /** soft delete. 두 번째 호출은 NotFound */
    public void deleteUser(UUID id) {
        tx.run("deleteUser", () -> {
            User user = requireLive(id);
            user.setDeletedAt(Timestamps.now(clock));
            log.info("user soft-deleted: {}", id);
        });
    }
}
