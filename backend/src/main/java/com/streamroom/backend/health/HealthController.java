package com.streamroom.backend.health;

import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 헬스체크 엔드포인트.
 * /readyz는 녹화 가능 여부를 함께 알려 준다.
 */
@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    /**
     * 프로세스 생존 여부만 확인
     */
    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse("UP", now(), null);
    }

    @GetMapping("/readyz")
    public HealthResponse readyz() {
        try {
            HealthComponent healthComponent = healthEndpoint.health();
            String status = healthComponent.getStatus().getCode();
            Boolean recordingAvailable = null;

            if (healthComponent instanceof CompositeHealth composite) {
                HealthComponent recording = composite.getComponents().get("recording");
                if (recording instanceof Health recordingHealth) {
                    Object available = recordingHealth.getDetails().get(RecordingHealthIndicator.AVAILABLE);
                    recordingAvailable = Boolean.TRUE.equals(available);
                }
            }

            return new HealthResponse(status, now(), recordingAvailable);
        } catch (RuntimeException e) {
            log.warn("Readiness check failed", e);
            return new HealthResponse("DOWN", now(), null);
        }
    }

    /**
     * 구버전 클라이언트용 /health
     */
    @GetMapping("/health")
    public HealthResponse health() {
        return readyz();
    }

    private String now() {
        return Instant.now(clock).toString();
    }

    public record HealthResponse(
        String status,               // "UP" | "DOWN"
        String timestamp,            // ISO-8601 timestamp
        Boolean recordingAvailable   // null on liveness checks
    ) {}
}
