package com.realtime.chatstore.friend.entity;

import com.realtime.chatstore.user.entity.User;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

/**
 * 확정된 친구 관계. (user_a, user_b) 한 행이 양방향 관계 전체를 나타낸다.
 * 친구 끊기는 soft delete.
 */
@Entity
@Table(
    name = "friends",
    indexes = {
        @Index(name = "idx_friends_user_a", columnList = "user_a"),
        @Index(name = "idx_friends_user_b", columnList = "user_b")
    }
)
@Check(constraints = "user_a < user_b")
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class Friendship {

    @EmbeddedId
    private FriendshipId id;

    @MapsId("userA")
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_a", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User userA;

    @MapsId("userB")
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_b", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User userB;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public boolean isActive() {
        return deletedAt == null;
    }
}
