package com.realtime.chatstore.chat.entity;

import com.realtime.chatstore.common.UuidOrder;
import com.realtime.chatstore.user.entity.User;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.util.UUID;

/**
 * 대화방별 최신 메시지 투영. 대화방당 정확히 한 행이며 메시지 쓰기 트랜잭션 안에서 같이 갱신된다.
 */
@Entity
@Table(
        name = "last_messages",
        uniqueConstraints = @UniqueConstraint(name = "last_messages_conversation_id_unique", columnNames = "conversation_id"),
        indexes = @Index(name = "idx_last_message_conversation", columnList = "conversation_id, created_at")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LastMessage {

    @Id @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "conversation_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Conversation conversation;

    /** 현재 비추고 있는 메시지 */
    @Column(name = "message_id", nullable = false)
    private UUID messageId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "sender_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User sender;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Message.Type type;

    @Column(length = 4000)
    private String content;

    /** 비추는 메시지의 created_at (last-writer-wins 비교 기준) */
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    /** 이 메시지가 현재 행보다 최신인지: created_at, 같으면 id 로 비교 */
    public boolean isOlderThan(Message m) {
        int cmp = createdAt.compareTo(m.getCreatedAt());
        if (cmp != 0) return cmp < 0;
        return UuidOrder.compare(messageId, m.getId()) < 0;
    }

    public void mirror(Message m) {
        this.messageId = m.getId();
        this.sender = m.getSender();
        this.type = m.getType();
        this.content = m.getContent();
        this.createdAt = m.getCreatedAt();
    }
}
