package com.streamroom.client.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.net.SocketTimeoutException;
import java.time.Duration;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class RestSessionGatewayClientTest {

    private static final String BASE = "http://localhost:3001";

    private MockRestServiceServer server;
    private RestSessionGatewayClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new RestSessionGatewayClient(restTemplate, new ObjectMapper(), BASE + "/");
    }

    @Test
    void startRecordingPostsRoomName() {
        server.expect(requestTo(BASE + "/api/recordings/start"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.roomName").value("room_a"))
                .andRespond(withSuccess("""
                        {"egressId":"EG_1","roomName":"room_a","filePath":"live-recordings/room_a/1.mp4",
                         "status":"starting","message":"Recording started successfully"}
                        """, MediaType.APPLICATION_JSON));

        RecordingStartResult result = client.startRecording("room_a");

        assertThat(result.egressId()).isEqualTo("EG_1");
        assertThat(result.status()).isEqualTo("starting");
        server.verify();
    }

    @Test
    void stopRecordingParsesFailedOutcome() {
        server.expect(requestTo(BASE + "/api/recordings/stop"))
                .andExpect(jsonPath("$.egressId").value("EG_1"))
                .andRespond(withSuccess("""
                        {"egressId":"EG_1","status":"failed","error":"Recording failed with status: EGRESS_ABORTED"}
                        """, MediaType.APPLICATION_JSON));

        RecordingStopResult result = client.stopRecording("EG_1");

        assertThat(result.isCompleted()).isFalse();
        assertThat(result.error()).contains("EGRESS_ABORTED");
    }

    @Test
    void statusParsesBooleanFlags() {
        server.expect(requestTo(BASE + "/api/recordings/room_a"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        {"roomId":"room_a","isActive":true,"isRecording":true,"egressId":"EG_1","status":"active"}
                        """, MediaType.APPLICATION_JSON));

        RecordingStatusResult status = client.recordingStatus("room_a");

        assertThat(status.isRecording()).isTrue();
        assertThat(status.isActive()).isTrue();
        assertThat(status.egressId()).isEqualTo("EG_1");
    }

    @Test
    void conflictProblemMapsToConflictKind() {
        server.expect(requestTo(BASE + "/api/recordings/start"))
                .andRespond(withStatus(HttpStatus.CONFLICT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("""
                                {"status":409,"code":"RECORDING_ALREADY_ACTIVE","category":"CONFLICT",
                                 "detail":"Recording already in progress for this room"}
                                """));

        assertThatThrownBy(() -> client.startRecording("room_a"))
                .isInstanceOfSatisfying(GatewayException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(GatewayErrorKind.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("RECORDING_ALREADY_ACTIVE");
                    assertThat(ex.getStatus()).isEqualTo(409);
                    assertThat(ex.getMessage()).isEqualTo("Recording already in progress for this room");
                    assertThat(ex.isRetryable()).isFalse();
                });
    }

    @Test
    void badGatewayCarriesRetryAfter() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, "2");
        server.expect(requestTo(BASE + "/api/recordings/start"))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY)
                        .headers(headers)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"code\":\"EGRESS_START_FAILED\",\"category\":\"DEPENDENCY_FAILURE\"}"));

        assertThatThrownBy(() -> client.startRecording("room_a"))
                .isInstanceOfSatisfying(GatewayException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(GatewayErrorKind.DEPENDENCY_FAILURE);
                    assertThat(ex.getRetryAfter()).isEqualTo(Duration.ofSeconds(2));
                    assertThat(ex.isRetryable()).isTrue();
                });
    }

    @Test
    void nonJsonErrorFallsBackToStatus() {
        server.expect(requestTo(BASE + "/api/recordings/start"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE).body("<html>maintenance</html>"));

        assertThatThrownBy(() -> client.startRecording("room_a"))
                .isInstanceOfSatisfying(GatewayException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(GatewayErrorKind.DEPENDENCY_UNAVAILABLE));
    }

    @Test
    void readTimeoutIsDistinctKind() {
        server.expect(requestTo(BASE + "/api/recordings/stop"))
                .andRespond(request -> {
                    throw new SocketTimeoutException("Read timed out");
                });

        assertThatThrownBy(() -> client.stopRecording("EG_1"))
                .isInstanceOfSatisfying(GatewayException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(GatewayErrorKind.TIMEOUT);
                    assertThat(ex.getStatus()).isZero();
                });
    }

    @Test
    void unreachableServerIsTransportFailure() {
        RestSessionGatewayClient unreachable = RestSessionGatewayClient.create("http://127.0.0.1:1", Duration.ofSeconds(1));

        assertThatThrownBy(() -> unreachable.recordingStatus("room_a"))
                .isInstanceOfSatisfying(GatewayException.class, ex -> {
                    assertThat(ex.getKind()).isIn(GatewayErrorKind.NETWORK, GatewayErrorKind.TIMEOUT);
                    assertThat(ex.isRetryable()).isTrue();
                });
    }
}
