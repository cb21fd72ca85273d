package com.streamroom.backend.modules.credential.infrastructure.livekit;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Map;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.streamroom.backend.global.config.LiveKitProperties;
import com.streamroom.backend.global.error.ErrorCode;
import com.streamroom.backend.global.error.ProblemException;

import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.stereotype.Component;

/**
 * LiveKit access-token signer.
 * <p>
 * LiveKit expects HS256 over the raw API secret, {@code iss} set to the API key and the
 * permissions under a {@code video} claim.
 */
@Component
public class LiveKitTokenSigner {

    private static final String HMAC_SHA_256 = "HmacSHA256";
    static final String VIDEO_CLAIM = "video";
    private static final Duration SERVICE_TOKEN_TTL = Duration.ofMinutes(10);

    private final LiveKitProperties properties;
    private final Clock clock;

    public LiveKitTokenSigner(LiveKitProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public boolean isAvailable() {
        return properties.hasSigningKeys();
    }

    /**
     * Signs a participant token; identity doubles as subject, display name and token id.
     */
    public String signParticipantToken(String identity, Map<String, Object> videoGrant) {
        return sign(identity, properties.tokenTtl(), videoGrant, identity);
    }

    /**
     * Signs a short-lived server-to-server token, e.g. {@code roomRecord} for egress calls.
     */
    public String signServiceToken(Map<String, Object> videoGrant) {
        return sign(null, SERVICE_TOKEN_TTL, videoGrant, null);
    }

    private String sign(String subject, Duration ttl, Map<String, Object> videoGrant, String displayName) {
        if (!properties.hasSigningKeys()) {
            throw new ProblemException(ErrorCode.CREDENTIALS_UNAVAILABLE);
        }
        Instant now = clock.instant();
        try {
            JwtBuilder builder = Jwts.builder()
                    .issuer(properties.apiKey())
                    .notBefore(Date.from(now))
                    .issuedAt(Date.from(now))
                    .expiration(Date.from(now.plus(ttl)))
                    .claim(VIDEO_CLAIM, videoGrant);
            if (subject != null) {
                builder.subject(subject).id(subject);
            }
            if (displayName != null) {
                builder.claim("name", displayName);
            }
            return builder.signWith(secretKey(), SIG.HS256).compact();
        } catch (JwtException ex) {
            throw new ProblemException(ErrorCode.CREDENTIALS_UNAVAILABLE,
                    "LiveKit API secret rejected for signing: " + ex.getMessage(), ex);
        }
    }

    private SecretKey secretKey() {
        return new SecretKeySpec(properties.apiSecret().getBytes(StandardCharsets.UTF_8), HMAC_SHA_256);
    }
}
