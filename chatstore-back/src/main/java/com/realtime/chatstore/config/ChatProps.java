package com.realtime.chatstore.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "app.chat")
@Data
public class ChatProps {
    private int historyDefaultLimit = 50;
    private int historyMaxLimit = 200;
    private int txMaxAttempts = 3;   // 직렬화 실패 시 트랜잭션 전체 재시도 횟수
}
