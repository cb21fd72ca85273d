package com.streamroom.backend.modules.recording.infrastructure.livekit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.streamroom.backend.global.config.LiveKitProperties;
import com.streamroom.backend.modules.credential.infrastructure.livekit.LiveKitTokenSigner;
import com.streamroom.backend.modules.recording.application.EgressProvider;
import com.streamroom.backend.modules.recording.domain.EgressDestination;
import com.streamroom.backend.modules.recording.domain.EgressFilter;
import com.streamroom.backend.modules.recording.domain.EgressJobInfo;
import com.streamroom.backend.modules.recording.domain.EgressJobStatus;
import com.streamroom.backend.modules.recording.domain.EgressProviderException;
import com.streamroom.backend.modules.recording.domain.EgressResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * LiveKit Egress service over Twirp/JSON.
 * <p>
 * Requests use protobuf field names; responses are read in either snake_case or camelCase
 * since the server may emit both depending on its Twirp settings.
 */
@Component
public class LiveKitEgressClient implements EgressProvider {

    private static final Logger log = LoggerFactory.getLogger(LiveKitEgressClient.class);

    private static final String SERVICE_PATH = "/twirp/livekit.Egress/";
    private static final String DEFAULT_LAYOUT = "grid";
    private static final int MAX_ERROR_BODY_LENGTH = 200;

    private final RestTemplate restTemplate;
    private final LiveKitProperties properties;
    private final LiveKitTokenSigner tokenSigner;

    @Autowired
    public LiveKitEgressClient(
            RestTemplateBuilder restTemplateBuilder,
            LiveKitProperties properties,
            LiveKitTokenSigner tokenSigner
    ) {
        this(
                restTemplateBuilder
                        .setConnectTimeout(properties.connectTimeout())
                        .setReadTimeout(properties.readTimeout())
                        .build(),
                properties,
                tokenSigner
        );
    }

    LiveKitEgressClient(RestTemplate restTemplate, LiveKitProperties properties, LiveKitTokenSigner tokenSigner) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.tokenSigner = tokenSigner;
    }

    @Override
    public boolean isAvailable() {
        return properties.isConfigured();
    }

    @Override
    public String start(String roomId, EgressDestination destination) {
        Map<String, Object> s3 = new LinkedHashMap<>();
        s3.put("access_key", destination.accessKey());
        s3.put("secret", destination.secret());
        s3.put("region", destination.region());
        s3.put("bucket", destination.bucket());

        Map<String, Object> fileOutput = new LinkedHashMap<>();
        fileOutput.put("file_type", "MP4");
        fileOutput.put("filepath", destination.filePath());
        fileOutput.put("s3", s3);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("room_name", roomId);
        body.put("layout", DEFAULT_LAYOUT);
        body.put("audio_only", false);
        body.put("video_only", false);
        body.put("file_outputs", List.of(fileOutput));

        JsonNode info = call("StartRoomCompositeEgress", body);
        String egressId = text(info, "egress_id", "egressId");
        if (!StringUtils.hasText(egressId)) {
            throw new EgressProviderException("Egress start response did not contain an egress id");
        }
        log.debug("LiveKit egress started roomId={} egressId={} {}", roomId, egressId, destination);
        return egressId;
    }

    @Override
    public EgressResult stop(String jobId) {
        JsonNode info = call("StopEgress", Map.<String, Object>of("egress_id", jobId));
        return new EgressResult(
                jobId,
                EgressJobStatus.fromProvider(text(info, "status")),
                fileNames(info),
                text(info, "error")
        );
    }

    @Override
    public List<EgressJobInfo> list(EgressFilter filter) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (StringUtils.hasText(filter.roomName())) {
            body.put("room_name", filter.roomName());
        }
        if (StringUtils.hasText(filter.jobId())) {
            body.put("egress_id", filter.jobId());
        }
        if (filter.activeOnly()) {
            body.put("active", true);
        }

        JsonNode response = call("ListEgress", body);
        List<EgressJobInfo> jobs = new ArrayList<>();
        JsonNode items = response.path("items");
        if (items.isArray()) {
            for (JsonNode item : items) {
                jobs.add(new EgressJobInfo(
                        text(item, "egress_id", "egressId"),
                        text(item, "room_name", "roomName"),
                        EgressJobStatus.fromProvider(text(item, "status")),
                        nanosToInstant(text(item, "started_at", "startedAt")),
                        nanosToInstant(text(item, "ended_at", "endedAt")),
                        fileNames(item),
                        text(item, "error")
                ));
            }
        }
        return jobs;
    }

    private JsonNode call(String method, Map<String, Object> body) {
        if (!properties.isConfigured()) {
            throw new EgressProviderException("LiveKit server is not configured");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setBearerAuth(tokenSigner.signServiceToken(Map.<String, Object>of("roomRecord", true)));

        String url = httpBaseUrl(properties.serverUrl()) + SERVICE_PATH + method;
        try {
            JsonNode response = restTemplate.postForObject(url, new HttpEntity<>(body, headers), JsonNode.class);
            if (response == null) {
                throw new EgressProviderException("Empty response from LiveKit " + method);
            }
            return response;
        } catch (HttpStatusCodeException ex) {
            String responseBody = ex.getResponseBodyAsString();
            if (responseBody.length() > MAX_ERROR_BODY_LENGTH) {
                responseBody = responseBody.substring(0, MAX_ERROR_BODY_LENGTH);
            }
            throw new EgressProviderException(
                    "LiveKit " + method + " failed with HTTP " + ex.getStatusCode().value() + ": " + responseBody, ex);
        } catch (RestClientException ex) {
            throw new EgressProviderException("LiveKit " + method + " unreachable: " + ex.getMessage(), ex);
        }
    }

    /**
     * LiveKit URLs are usually configured as {@code wss://}; the Twirp API lives on the HTTP side.
     */
    static String httpBaseUrl(String serverUrl) {
        String url = serverUrl.trim();
        if (url.startsWith("wss://")) {
            url = "https://" + url.substring("wss://".length());
        } else if (url.startsWith("ws://")) {
            url = "http://" + url.substring("ws://".length());
        }
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    private static List<String> fileNames(JsonNode info) {
        List<String> names = new ArrayList<>();
        JsonNode results = info.has("file_results") ? info.path("file_results") : info.path("fileResults");
        if (results.isArray()) {
            for (JsonNode result : results) {
                String filename = text(result, "filename");
                if (filename != null) {
                    names.add(filename);
                }
            }
        }
        // 구버전 서버는 단일 file 필드만 채운다.
        if (names.isEmpty() && info.path("file").hasNonNull("filename")) {
            names.add(info.path("file").path("filename").asText());
        }
        return names;
    }

    private static String text(JsonNode node, String... fieldNames) {
        for (String fieldName : fieldNames) {
            JsonNode value = node.get(fieldName);
            if (value != null && !value.isNull()) {
                return value.asText();
            }
        }
        return null;
    }

    private static Instant nanosToInstant(String nanos) {
        if (!StringUtils.hasText(nanos)) {
            return null;
        }
        try {
            long value = Long.parseLong(nanos);
            if (value <= 0) {
                return null;
            }
            return Instant.ofEpochSecond(0, value);
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
