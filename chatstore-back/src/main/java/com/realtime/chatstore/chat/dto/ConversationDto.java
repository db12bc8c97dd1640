package com.realtime.chatstore.chat.dto;

import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationDto {
    private UUID id;
    private String type;
    private GroupInfoDto group;          // DIRECT 면 null
    private LastMessageDto lastMessage;  // 메시지가 없으면 null
    private int unreadCount;             // 조회한 사용자 기준
    private List<ParticipantDto> participants;
    private Instant createdAt;
    private Instant updatedAt;
}
