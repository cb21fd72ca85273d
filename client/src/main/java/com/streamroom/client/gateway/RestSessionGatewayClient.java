package com.streamroom.client.gateway;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * {@link SessionGatewayClient} over the backend HTTP API.
 * Problem responses are mapped back to a {@link GatewayErrorKind}; a read or connect timeout
 * surfaces as {@link GatewayErrorKind#TIMEOUT}.
 */
public class RestSessionGatewayClient implements SessionGatewayClient {

    private static final Logger log = LoggerFactory.getLogger(RestSessionGatewayClient.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public RestSessionGatewayClient(RestTemplate restTemplate, ObjectMapper objectMapper, String baseUrl) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static RestSessionGatewayClient create(String baseUrl) {
        return create(baseUrl, DEFAULT_TIMEOUT);
    }

    public static RestSessionGatewayClient create(String baseUrl, Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());

        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        RestTemplate restTemplate = new RestTemplate(requestFactory);
        restTemplate.setMessageConverters(List.of(new MappingJackson2HttpMessageConverter(objectMapper)));
        return new RestSessionGatewayClient(restTemplate, objectMapper, baseUrl);
    }

    @Override
    public RecordingStartResult startRecording(String roomId) {
        return execute("start recording", () -> restTemplate.postForObject(
                baseUrl + "/api/recordings/start", Map.of("roomName", roomId), RecordingStartResult.class));
    }

    @Override
    public RecordingStopResult stopRecording(String jobId) {
        return execute("stop recording", () -> restTemplate.postForObject(
                baseUrl + "/api/recordings/stop", Map.of("egressId", jobId), RecordingStopResult.class));
    }

    @Override
    public RecordingStatusResult recordingStatus(String roomId) {
        return execute("load recording status", () -> restTemplate.getForObject(
                baseUrl + "/api/recordings/{roomId}", RecordingStatusResult.class, roomId));
    }

    private <T> T execute(String action, RestCall<T> call) {
        T result;
        try {
            result = call.run();
        } catch (RestClientResponseException ex) {
            throw fromResponse(action, ex);
        } catch (ResourceAccessException ex) {
            if (ex.getCause() instanceof SocketTimeoutException) {
                throw GatewayException.transport(GatewayErrorKind.TIMEOUT,
                        "Request timed out while trying to " + action, ex);
            }
            throw GatewayException.transport(GatewayErrorKind.NETWORK,
                    "Network error while trying to " + action + ": " + ex.getMessage(), ex);
        } catch (RestClientException ex) {
            throw GatewayException.transport(GatewayErrorKind.INTERNAL,
                    "Failed to " + action + ": " + ex.getMessage(), ex);
        }
        if (result == null) {
            throw GatewayException.transport(GatewayErrorKind.INTERNAL, "Empty response while trying to " + action, null);
        }
        return result;
    }

    private GatewayException fromResponse(String action, RestClientResponseException ex) {
        int status = ex.getStatusCode().value();
        String code = null;
        String category = null;
        String detail = null;
        String body = ex.getResponseBodyAsString();
        if (!body.isBlank()) {
            try {
                JsonNode problem = objectMapper.readTree(body);
                code = textOrNull(problem, "code");
                category = textOrNull(problem, "category");
                detail = textOrNull(problem, "detail");
            } catch (JsonProcessingException parseFailure) {
                log.debug("Non-JSON error body for {} (HTTP {})", action, status);
            }
        }
        GatewayErrorKind kind = GatewayErrorKind.fromProblem(category, status);
        String message = detail != null ? detail : "Failed to " + action + " (HTTP " + status + ")";
        return new GatewayException(kind, code, status, message, retryAfter(ex.getResponseHeaders()), ex);
    }

    private static Duration retryAfter(HttpHeaders headers) {
        if (headers == null) {
            return null;
        }
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null) {
            return null;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(value.trim()));
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    @FunctionalInterface
    private interface RestCall<T> {
        T run();
    }
}
