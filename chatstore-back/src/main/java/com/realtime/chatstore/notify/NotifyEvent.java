package com.realtime.chatstore.notify;

import lombok.*;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * 커밋 이후 외부 fan-out 계층(웹소켓 등)에 넘기는 도메인 알림.
 * 이 계층은 전송하지 않고 발행만 한다.
 */
@Getter
@NoArgsConstructor @AllArgsConstructor
@Builder
@ToString
public class NotifyEvent {

    public enum Type {
        FRIEND_REQUEST_RECEIVED,
        FRIEND_REQUEST_ACCEPTED,
        FRIEND_REQUEST_DECLINED,
        FRIEND_REQUEST_CANCELLED,
        FRIEND_REMOVED,
        CONVERSATION_CREATED,
        PARTICIPANT_ADDED,
        PARTICIPANT_REMOVED,
        MESSAGE_CREATED,
        MESSAGE_EDITED,
        MESSAGE_DELETED,
        MESSAGES_READ
    }

    private Type type;
    private UUID from;
    private UUID to;             // 1:1 알림 대상 (없으면 null)
    private UUID conversationId; // 대화방 브로드캐스트 대상 (없으면 null)
    private Instant at;
    private Map<String, Object> payload;
}
