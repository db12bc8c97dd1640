package com.realtime.chatstore.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "app.uploads")
@Data
public class UploadProps {
    private String urlPrefix = "/uploads";   // 외부 blob 저장소가 내려주는 공개 경로 prefix
    private int maxFileMb = 10;
    private List<String> allowedMimeTypes = new ArrayList<>(List.of(
            "image/jpeg", "image/png", "image/gif", "image/webp",
            "application/pdf", "text/plain"));

    public long maxFileBytes() {
        return maxFileMb * 1024L * 1024L;
    }
}
