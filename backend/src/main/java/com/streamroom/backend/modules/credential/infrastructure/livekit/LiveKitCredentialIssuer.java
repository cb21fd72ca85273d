package com.streamroom.backend.modules.credential.infrastructure.livekit;

import java.util.LinkedHashMap;
import java.util.Map;

import com.streamroom.backend.global.config.LiveKitProperties;
import com.streamroom.backend.modules.credential.application.CredentialIssuer;
import com.streamroom.backend.modules.credential.domain.ParticipantGrants;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LiveKitCredentialIssuer implements CredentialIssuer {

    private static final Logger log = LoggerFactory.getLogger(LiveKitCredentialIssuer.class);

    private final LiveKitTokenSigner tokenSigner;
    private final LiveKitProperties properties;

    public LiveKitCredentialIssuer(LiveKitTokenSigner tokenSigner, LiveKitProperties properties) {
        this.tokenSigner = tokenSigner;
        this.properties = properties;
    }

    @Override
    public String issue(String roomId, String identity, ParticipantGrants grants) {
        Map<String, Object> video = new LinkedHashMap<>();
        video.put("room", roomId);
        video.put("roomJoin", true);
        video.put("canPublish", grants.canPublish());
        video.put("canSubscribe", grants.canSubscribe());
        video.put("canPublishData", grants.canPublishData());

        String token = tokenSigner.signParticipantToken(identity, video);
        log.debug("Issued token roomId={} identity={} canPublish={}", roomId, identity, grants.canPublish());
        return token;
    }

    @Override
    public boolean isAvailable() {
        return tokenSigner.isAvailable();
    }

    @Override
    public String serverUrl() {
        return properties.serverUrl();
    }
}
