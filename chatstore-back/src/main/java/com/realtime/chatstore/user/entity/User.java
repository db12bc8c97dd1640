package com.realtime.chatstore.user.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * 사용자. 탈퇴는 soft delete(deletedAt)이며, username/email/phone 유일성은 살아있는 행끼리만 적용된다.
 * <p>
 * 유일성은 DB 가 강제한다. *_key 컬럼은 살아있는 동안 정규화 값, 탈퇴하면 null 이 되고
 * 유니크 제약은 null 을 중복으로 보지 않으므로 {@code WHERE deleted_at IS NULL} 부분 인덱스와 같다.
 */
@Entity
@Table(
        name = "users",
        indexes = {
                @Index(name = "idx_user_created", columnList = "created_at")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_user_username_live", columnNames = "username_key"),
                @UniqueConstraint(name = "uk_user_email_live", columnNames = "email_key"),
                @UniqueConstraint(name = "uk_user_phone_live", columnNames = "phone_key")
        }
)
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class User {

    public enum Role { USER, ADMIN }

    @Id
    private UUID id;

    @Column(nullable = false, length = 255)
    private String username;

    /** 소문자로 저장 */
    @Column(nullable = false, length = 255)
    private String email;

    @Column(length = 20)
    private String phone;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private Role role = Role.USER;

    @Column(name = "display_name", nullable = false, length = 255)
    private String displayName;

    @Column(name = "avatar_url", length = 512)
    private String avatarUrl;

    @Column(name = "avatar_id", length = 255)
    private String avatarId;

    @Column(length = 300)
    private String bio;

    /** 인증 계층이 만든 해시. 이 계층은 해석하지 않는다. */
    @Column(name = "hash_password", nullable = false)
    private String passwordHash;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @Setter(AccessLevel.NONE)
    @Column(name = "username_key", length = 255)
    private String usernameKey;

    @Setter(AccessLevel.NONE)
    @Column(name = "email_key", length = 255)
    private String emailKey;

    @Setter(AccessLevel.NONE)
    @Column(name = "phone_key", length = 20)
    private String phoneKey;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean isDeleted() {
        return deletedAt != null;
    }

    @PrePersist
    @PreUpdate
    void refreshLiveKeys() {
        boolean live = deletedAt == null;
        usernameKey = live && username != null ? username.toLowerCase(Locale.ROOT) : null;
        emailKey = live && email != null ? email.toLowerCase(Locale.ROOT) : null;
        phoneKey = live ? phone : null;
    }
}
