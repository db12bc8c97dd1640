package com.realtime.chatstore.chat.dto;

import com.realtime.chatstore.chat.entity.Message;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MessageDto {
    private UUID id;
    private UUID conversationId;
    private UUID senderId;
    private UUID replyToId;
    private String type;
    private String content;
    private String fileUrl;
    private boolean edited;
    private Instant createdAt;
    private Instant updatedAt;

    public static MessageDto from(Message m) {
        return MessageDto.builder()
                .id(m.getId())
                .conversationId(m.getConversation().getId())
                .senderId(m.getSender().getId())
                // 프록시 초기화 없이 FK 값만 읽는다
                .replyToId(m.getReplyTo() != null ? m.getReplyTo().getId() : null)
                .type(m.getType().name())
                .content(m.getContent())
                .fileUrl(m.getFileUrl())
                .edited(m.isEdited())
                .createdAt(m.getCreatedAt())
                .updatedAt(m.getUpdatedAt())
                .build();
    }
}
