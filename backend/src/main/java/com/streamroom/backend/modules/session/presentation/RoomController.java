package com.streamroom.backend.modules.session.presentation;

import com.streamroom.backend.modules.session.application.SessionGateway;
import com.streamroom.backend.modules.session.presentation.dto.CreateRoomRequest;
import com.streamroom.backend.modules.session.presentation.dto.CreateRoomResponse;
import com.streamroom.backend.modules.session.presentation.dto.EndRoomResponse;
import com.streamroom.backend.modules.session.presentation.dto.RoomResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/rooms")
public class RoomController {

    private final SessionGateway sessionGateway;

    public RoomController(SessionGateway sessionGateway) {
        this.sessionGateway = sessionGateway;
    }

    @Operation(
            summary = "방송 방 생성",
            description = """
                    새 방을 만들고 호스트용 참가 토큰과 공유 링크를 돌려준다. \
                    LiveKit 키가 없으면 503 `CREDENTIALS_UNAVAILABLE`이며 방은 남지 않는다.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "방 생성 성공"),
            @ApiResponse(responseCode = "400", description = "hostName 형식 오류 – `INVALID_IDENTITY`"),
            @ApiResponse(responseCode = "503", description = "토큰 발급 불가 – `CREDENTIALS_UNAVAILABLE`")
    })
    @PostMapping
    public ResponseEntity<CreateRoomResponse> createRoom(@Valid @RequestBody CreateRoomRequest request) {
        CreateRoomResponse response = CreateRoomResponse.from(sessionGateway.createRoom(request.hostName()));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{roomId}")
    public ResponseEntity<RoomResponse> getRoom(@PathVariable("roomId") String roomId) {
        return ResponseEntity.ok(RoomResponse.from(sessionGateway.getRoom(roomId)));
    }

    @Operation(summary = "방송 종료", description = "이미 종료된 방을 다시 종료해도 성공으로 응답한다.")
    @DeleteMapping("/{roomId}")
    public ResponseEntity<EndRoomResponse> endRoom(@PathVariable("roomId") String roomId) {
        return ResponseEntity.ok(EndRoomResponse.from(sessionGateway.endRoom(roomId)));
    }
}
