package com.streamroom.backend.modules.session.presentation;

import java.util.List;

import com.streamroom.backend.modules.session.application.SessionGateway;
import com.streamroom.backend.modules.session.presentation.dto.RecordingJobResponse;
import com.streamroom.backend.modules.session.presentation.dto.RecordingStatusResponse;
import com.streamroom.backend.modules.session.presentation.dto.StartRecordingRequest;
import com.streamroom.backend.modules.session.presentation.dto.StartRecordingResponse;
import com.streamroom.backend.modules.session.presentation.dto.StopRecordingRequest;
import com.streamroom.backend.modules.session.presentation.dto.StopRecordingResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/recordings")
public class RecordingController {

    private final SessionGateway sessionGateway;

    public RecordingController(SessionGateway sessionGateway) {
        this.sessionGateway = sessionGateway;
    }

    @Operation(summary = "녹화 시작", description = "방마다 진행 중인 녹화는 하나뿐이다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "녹화 시작 요청 수락"),
            @ApiResponse(responseCode = "404", description = "없는 방 – `ROOM_NOT_FOUND`"),
            @ApiResponse(responseCode = "409", description = "이미 녹화 중 – `RECORDING_ALREADY_ACTIVE`"),
            @ApiResponse(responseCode = "410", description = "종료된 방 – `ROOM_ENDED`"),
            @ApiResponse(responseCode = "502", description = "Egress 실패 – `EGRESS_START_FAILED`, Retry-After 포함"),
            @ApiResponse(responseCode = "503", description = "녹화 설정 없음 – `RECORDING_UNAVAILABLE`")
    })
    @PostMapping("/start")
    public ResponseEntity<StartRecordingResponse> startRecording(@Valid @RequestBody StartRecordingRequest request) {
        StartRecordingResponse response = StartRecordingResponse.from(sessionGateway.startRecording(request.roomName()));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(
            summary = "녹화 중지",
            description = """
                    중지 후 방은 항상 녹화 중이 아닌 상태가 된다. \
                    Egress가 파일을 만들지 못하면 200 응답에 `status=failed`와 `error`가 담긴다.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "완료 또는 실패 결과"),
            @ApiResponse(responseCode = "404", description = "모르는 egressId – `RECORDING_NOT_FOUND`"),
            @ApiResponse(responseCode = "409", description = "진행 중이 아님 – `RECORDING_NOT_ACTIVE`")
    })
    @PostMapping("/stop")
    public ResponseEntity<StopRecordingResponse> stopRecording(@Valid @RequestBody StopRecordingRequest request) {
        return ResponseEntity.ok(StopRecordingResponse.from(sessionGateway.stopRecording(request.egressId())));
    }

    @Operation(
            summary = "Egress 작업 목록",
            description = "LiveKit에 직접 조회하는 진단용 엔드포인트. roomId, egressId, active로 좁힐 수 있다."
    )
    @GetMapping("/jobs")
    public ResponseEntity<List<RecordingJobResponse>> listJobs(
            @RequestParam(name = "roomId", required = false) String roomId,
            @RequestParam(name = "egressId", required = false) String egressId,
            @RequestParam(name = "active", defaultValue = "false") boolean active
    ) {
        List<RecordingJobResponse> jobs = sessionGateway.listRecordingJobs(roomId, egressId, active).stream()
                .map(RecordingJobResponse::from)
                .toList();
        return ResponseEntity.ok(jobs);
    }

    @GetMapping("/{roomId}")
    public ResponseEntity<RecordingStatusResponse> getStatus(@PathVariable("roomId") String roomId) {
        return ResponseEntity.ok(RecordingStatusResponse.from(sessionGateway.recordingStatus(roomId)));
    }
}
