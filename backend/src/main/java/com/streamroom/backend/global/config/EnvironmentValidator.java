package com.streamroom.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.streamroom.backend.modules.recording.infrastructure.RecordingStorageProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 시작 시 외부 연동 설정을 점검한다.
 * 누락돼도 종료하지 않는다. 토큰 발급이나 녹화만 503으로 응답하게 된다.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    // HS256 키 최소 길이
    private static final int MIN_SECRET_BYTES = 32;

    private final LiveKitProperties liveKitProperties;
    private final RecordingStorageProperties storageProperties;

    public EnvironmentValidator(LiveKitProperties liveKitProperties, RecordingStorageProperties storageProperties) {
        this.liveKitProperties = liveKitProperties;
        this.storageProperties = storageProperties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = inspect();
        if (problems.isEmpty()) {
            log.info("Environment OK: LiveKit and S3 recording configured (bucket={}, region={})",
                    storageProperties.bucket(), storageProperties.region());
            return;
        }
        log.warn("Environment incomplete, affected features will answer 503:");
        problems.forEach(problem -> log.warn("  - {}", problem));
    }

    List<String> inspect() {
        List<String> problems = new ArrayList<>();
        if (!StringUtils.hasText(liveKitProperties.apiKey())) {
            problems.add("LIVEKIT_API_KEY is missing (join tokens disabled)");
        }
        if (!StringUtils.hasText(liveKitProperties.apiSecret())) {
            problems.add("LIVEKIT_API_SECRET is missing (join tokens disabled)");
        } else if (liveKitProperties.apiSecret().getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            problems.add("LIVEKIT_API_SECRET is shorter than " + MIN_SECRET_BYTES + " bytes (token signing will fail)");
        }
        if (!StringUtils.hasText(liveKitProperties.serverUrl())) {
            problems.add("LIVEKIT_SERVER_URL is missing (recording disabled)");
        }
        if (!storageProperties.isConfigured()) {
            problems.add("AWS_ACCESS_KEY_ID, AWS_SECRET_ACCESS_KEY and S3_BUCKET_NAME are required for recording");
        }
        return problems;
    }
}
