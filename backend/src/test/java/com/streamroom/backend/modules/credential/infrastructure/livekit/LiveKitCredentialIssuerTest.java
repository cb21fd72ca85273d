package com.streamroom.backend.modules.credential.infrastructure.livekit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.Map;

import javax.crypto.spec.SecretKeySpec;

import com.streamroom.backend.global.config.LiveKitProperties;
import com.streamroom.backend.global.error.ErrorCode;
import com.streamroom.backend.global.error.ProblemException;
import com.streamroom.backend.modules.credential.domain.ParticipantGrants;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LiveKitCredentialIssuerTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
    private static final String API_KEY = "APIkey123";
    private static final String API_SECRET = "livekit-secret-with-at-least-32-bytes!!";

    private LiveKitCredentialIssuer issuer;

    @BeforeEach
    void setUp() {
        issuer = issuerFor(new LiveKitProperties(API_KEY, API_SECRET, "wss://demo.livekit.cloud", null, null, null));
    }

    @Test
    @DisplayName("호스트 토큰은 발행/구독/데이터 권한을 모두 가진다")
    void ownerTokenCarriesFullGrants() {
        Claims claims = parse(issuer.issue("room_1", "Alice", ParticipantGrants.owner()));

        assertThat(claims.getIssuer()).isEqualTo(API_KEY);
        assertThat(claims.getSubject()).isEqualTo("Alice");
        assertThat(claims.getId()).isEqualTo("Alice");
        assertThat(claims.get("name", String.class)).isEqualTo("Alice");
        assertThat(claims.getNotBefore().toInstant()).isEqualTo(NOW);
        assertThat(claims.getExpiration().toInstant()).isEqualTo(NOW.plus(Duration.ofHours(6)));

        Map<?, ?> video = claims.get(LiveKitTokenSigner.VIDEO_CLAIM, Map.class);
        assertThat(video.get("room")).isEqualTo("room_1");
        assertThat(video.get("roomJoin")).isEqualTo(true);
        assertThat(video.get("canPublish")).isEqualTo(true);
        assertThat(video.get("canSubscribe")).isEqualTo(true);
        assertThat(video.get("canPublishData")).isEqualTo(true);
    }

    @Test
    @DisplayName("시청자 토큰은 절대 발행 권한을 갖지 않는다")
    void viewerTokenCannotPublish() {
        Claims claims = parse(issuer.issue("room_1", "Bob", ParticipantGrants.viewer()));

        Map<?, ?> video = claims.get(LiveKitTokenSigner.VIDEO_CLAIM, Map.class);
        assertThat(video.get("canPublish")).isEqualTo(false);
        assertThat(video.get("canSubscribe")).isEqualTo(true);
        assertThat(video.get("canPublishData")).isEqualTo(true);
    }

    @Test
    void missingKeysMeanUnavailable() {
        LiveKitCredentialIssuer unconfigured = issuerFor(new LiveKitProperties(null, null, null, null, null, null));

        assertThat(unconfigured.isAvailable()).isFalse();
        assertThatThrownBy(() -> unconfigured.issue("room_1", "Alice", ParticipantGrants.owner()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.CREDENTIALS_UNAVAILABLE));
    }

    @Test
    void weakSecretIsReportedAsUnavailable() {
        LiveKitCredentialIssuer weak = issuerFor(new LiveKitProperties(API_KEY, "short", null, null, null, null));

        assertThatThrownBy(() -> weak.issue("room_1", "Alice", ParticipantGrants.owner()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.CREDENTIALS_UNAVAILABLE));
    }

    @Test
    void serviceTokenGrantsRoomRecordWithoutSubject() {
        LiveKitTokenSigner signer = new LiveKitTokenSigner(
                new LiveKitProperties(API_KEY, API_SECRET, null, null, null, null),
                Clock.fixed(NOW, ZoneOffset.UTC));

        Claims claims = parse(signer.signServiceToken(Map.<String, Object>of("roomRecord", true)));

        assertThat(claims.getSubject()).isNull();
        assertThat(claims.getExpiration().toInstant()).isEqualTo(NOW.plus(Duration.ofMinutes(10)));
        assertThat(claims.get(LiveKitTokenSigner.VIDEO_CLAIM, Map.class).get("roomRecord")).isEqualTo(true);
    }

    private static LiveKitCredentialIssuer issuerFor(LiveKitProperties properties) {
        LiveKitTokenSigner signer = new LiveKitTokenSigner(properties, Clock.fixed(NOW, ZoneOffset.UTC));
        return new LiveKitCredentialIssuer(signer, properties);
    }

    private static Claims parse(String token) {
        return Jwts.parser()
                .verifyWith(new SecretKeySpec(API_SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256"))
                .clock(() -> Date.from(NOW))
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
