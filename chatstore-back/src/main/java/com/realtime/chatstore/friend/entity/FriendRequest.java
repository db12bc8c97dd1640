package com.realtime.chatstore.friend.entity;

import com.realtime.chatstore.user.entity.User;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.util.UUID;

/**
 * 보류 중인 친구 요청. 방향이 있으며(A→B, B→A 공존 가능) 처리되면 행 자체를 지운다.
 */
@Entity
@Table(
    name = "friend_requests",
    uniqueConstraints = {
        @UniqueConstraint(name = "idx_friend_requests_from_user_to_user", columnNames = {"from_user_id", "to_user_id"})
    },
    indexes = {
        @Index(name = "idx_friend_requests_to_user", columnList = "to_user_id"),
        @Index(name = "idx_friend_requests_from_user", columnList = "from_user_id")
    }
)
@Check(constraints = "from_user_id <> to_user_id")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FriendRequest {

    @Id @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "from_user_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User fromUser;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "to_user_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User toUser;

    @Column(length = 300)
    private String message;

    @Column(name = "created_at", updatable = false, nullable = false)
    private Instant createdAt;
}
