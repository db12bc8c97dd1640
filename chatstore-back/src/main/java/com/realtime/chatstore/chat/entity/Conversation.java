package com.realtime.chatstore.chat.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * 대화방 헤더. type 이 태그이고, GROUP 일 때만 {@link GroupConversation} 확장 행이 붙는다.
 */
@Entity
@Table(name = "conversations")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Conversation {
    public enum Type { DIRECT, GROUP }

    @Id @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING) @Column(nullable = false, length = 10)
    private Type type;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    // 새 메시지마다 갱신 (목록 정렬 기준)
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
