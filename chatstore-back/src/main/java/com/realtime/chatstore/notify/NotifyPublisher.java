package com.realtime.chatstore.notify;

import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class NotifyPublisher {

    private final ApplicationEventPublisher events;
    private final Clock clock;

    public void toUser(NotifyEvent.Type type, UUID from, UUID to, Map<String, Object> payload) {
        events.publishEvent(NotifyEvent.builder()
                .type(type).from(from).to(to)
                .at(Instant.now(clock))
                .payload(payload)
                .build());
    }

    public void toConversation(NotifyEvent.Type type, UUID from, UUID conversationId, Map<String, Object> payload) {
        events.publishEvent(NotifyEvent.builder()
                .type(type).from(from).conversationId(conversationId)
                .at(Instant.now(clock))
                .payload(payload)
                .build());
    }
}
