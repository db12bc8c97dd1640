package com.realtime.chatstore.chat.entity;

import com.realtime.chatstore.user.entity.User;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.util.UUID;

/**
 * 대화방 참여자. (conversation_id, user_id) 가 PK 라서 나간 사람(deleted_at)도 같은 행을 쓴다.
 * 다시 들어오면 새 행을 넣지 말고 deleted_at 을 되돌릴 것.
 */
@Entity
@Table(
        name = "participants",
        indexes = {
                @Index(name = "idx_participants_user_conv", columnList = "user_id, conversation_id"),
                @Index(name = "idx_participants_conversation", columnList = "conversation_id")
        }
)
@Check(constraints = "unread_count >= 0")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Participant {

    @EmbeddedId
    private ParticipantId id;

    @MapsId("conversationId")
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "conversation_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Conversation conversation;

    @MapsId("userId")
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User user;

    @Column(name = "unread_count", nullable = false)
    private int unreadCount;

    @Column(name = "joined_at", nullable = false)
    private Instant joinedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    /** 마지막으로 읽은 메시지. 소유 관계 없는 역참조라 id만 둔다 */
    @Column(name = "last_seen_message_id")
    private UUID lastSeenMessageId;

    public boolean isActive() {
        return deletedAt == null;
    }
}
