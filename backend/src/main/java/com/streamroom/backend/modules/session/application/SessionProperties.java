package com.streamroom.backend.modules.session.application;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "app.session")
public record SessionProperties(String publicBaseUrl, ViewerJoinPolicy viewerJoinPolicy) {

    private static final String DEFAULT_PUBLIC_BASE_URL = "http://localhost:5173";

    public SessionProperties {
        publicBaseUrl = StringUtils.hasText(publicBaseUrl) ? stripTrailingSlash(publicBaseUrl) : DEFAULT_PUBLIC_BASE_URL;
        viewerJoinPolicy = viewerJoinPolicy != null ? viewerJoinPolicy : ViewerJoinPolicy.PERMISSIVE;
    }

    public String shareUrl(String roomId) {
        return publicBaseUrl + "/stream/" + roomId;
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
