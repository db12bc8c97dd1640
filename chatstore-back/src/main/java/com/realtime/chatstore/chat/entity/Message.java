package com.realtime.chatstore.chat.entity;

import com.realtime.chatstore.user.entity.User;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "messages",
        indexes = {
                @Index(name = "idx_message_conversation", columnList = "conversation_id, created_at"),
                @Index(name = "idx_message_sender", columnList = "sender_id")
        }
)
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Message {

    public enum Type {
        TEXT, IMAGE, VIDEO, FILE, SYSTEM;

        /** content 로 싣는 타입인지 (아니면 fileUrl 필수) */
        public boolean carriesText() {
            return this == TEXT || this == SYSTEM;
        }
    }

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "conversation_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Conversation conversation;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "sender_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User sender;

    // 원본이 물리 삭제되면 참조만 null (답장은 남음). soft delete 에서는 참조 유지
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "reply_to_id")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private Message replyTo;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private Type type = Type.TEXT;

    @Column(length = 4000)
    private String content;

    @Column(name = "file_url", length = 1024)
    private String fileUrl;

    @Column(name = "is_edited", nullable = false)
    private boolean edited;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean isDeleted() {
        return deletedAt != null;
    }
}
