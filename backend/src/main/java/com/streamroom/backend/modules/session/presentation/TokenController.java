package com.streamroom.backend.modules.session.presentation;

import com.streamroom.backend.modules.session.application.SessionGateway;
import com.streamroom.backend.modules.session.presentation.dto.TokenRequest;
import com.streamroom.backend.modules.session.presentation.dto.TokenResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/token")
public class TokenController {

    private final SessionGateway sessionGateway;

    public TokenController(SessionGateway sessionGateway) {
        this.sessionGateway = sessionGateway;
    }

    @Operation(
            summary = "참가 토큰 발급",
            description = """
                    시청자 토큰은 구독과 데이터 채널만 허용한다. \
                    종료된 방은 410 `ROOM_ENDED`, `isHost`는 JSON boolean만 받는다.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "토큰 발급 성공"),
            @ApiResponse(responseCode = "400", description = "입력 형식 오류"),
            @ApiResponse(responseCode = "404", description = "STRICT 정책에서 없는 방 – `ROOM_NOT_FOUND`"),
            @ApiResponse(responseCode = "410", description = "종료된 방 – `ROOM_ENDED`")
    })
    @PostMapping
    public ResponseEntity<TokenResponse> issueToken(@Valid @RequestBody TokenRequest request) {
        return ResponseEntity.ok(TokenResponse.from(
                sessionGateway.issueJoinCredential(request.roomName(), request.participantName(), request.asOwner())
        ));
    }
}
