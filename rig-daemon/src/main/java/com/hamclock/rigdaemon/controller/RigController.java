package com.hamclock.rigdaemon.controller;

import com.hamclock.rigdaemon.dto.ConfigResponse;
import com.hamclock.rigdaemon.dto.FrequencyRequest;
import com.hamclock.rigdaemon.dto.ModeRequest;
import com.hamclock.rigdaemon.dto.PttRequest;
import com.hamclock.rigdaemon.dto.RadioStatusResponse;
import com.hamclock.rigdaemon.dto.SuccessResponse;
import com.hamclock.rigdaemon.helper.SseSubscriber;
import com.hamclock.rigdaemon.service.ChangeBroadcaster;
import com.hamclock.rigdaemon.service.RadioControlService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Radio control API - status snapshot, live event stream and the three write operations
 */
@Slf4j
@RestController
@Tag(name = "Rig", description = "Radio status, event stream and control")
@RequiredArgsConstructor
public class RigController {

    private final ChangeBroadcaster broadcaster;
    private final RadioControlService controlService;

    @GetMapping("/status")
    @Operation(summary = "Current radio state", description = "Snapshot of frequency, mode, passband, PTT and link state")
    public ResponseEntity<RadioStatusResponse> status() {
        return ResponseEntity.ok(RadioStatusResponse.from(broadcaster.snapshot()));
    }

    /**
     * Server-sent events: one {@code init} event with the full state, then {@code update} events
     * for every change until the client goes away.
     */
    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Live state stream", description = "SSE stream: init snapshot followed by per-property updates")
    public SseEmitter stream() throws IOException {
        SseEmitter emitter = new SseEmitter(0L);
        String subscriberId = UUID.randomUUID().toString();

        emitter.onCompletion(() -> broadcaster.unsubscribe(subscriberId));
        emitter.onTimeout(() -> broadcaster.unsubscribe(subscriberId));
        emitter.onError(error -> broadcaster.unsubscribe(subscriberId));

        broadcaster.subscribe(new SseSubscriber(subscriberId, emitter));
        log.debug("📡 Stream client {} connected", subscriberId);
        return emitter;
    }

    @PostMapping("/freq")
    @Operation(summary = "Set frequency", description = "Set the VFO frequency in Hz, optionally followed by a tune cycle")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Frequency accepted by the radio"),
            @ApiResponse(responseCode = "400", description = "Missing freq"),
            @ApiResponse(responseCode = "500", description = "Radio rejected the command or is not connected")
    })
    public CompletableFuture<ResponseEntity<SuccessResponse>> setFrequency(@Valid @RequestBody FrequencyRequest request) {
        return controlService.setFrequency(request.getFreq(), request.tuneRequested())
                .thenApply(ignored -> ResponseEntity.ok(SuccessResponse.ok()));
    }

    @PostMapping("/mode")
    @Operation(summary = "Set mode", description = "Set the operating mode and, for rigctld, the passband in Hz")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Mode accepted by the radio"),
            @ApiResponse(responseCode = "400", description = "Missing mode"),
            @ApiResponse(responseCode = "500", description = "Radio rejected the command or is not connected")
    })
    public CompletableFuture<ResponseEntity<SuccessResponse>> setMode(@Valid @RequestBody ModeRequest request) {
        return controlService.setMode(request.getMode(), request.passbandOrDefault())
                .thenApply(ignored -> ResponseEntity.ok(SuccessResponse.ok()));
    }

    @PostMapping("/ptt")
    @Operation(summary = "Key or unkey transmitter", description = "Keying requires rig.radio.ptt-enabled=true")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "PTT state applied"),
            @ApiResponse(responseCode = "403", description = "PTT disabled in configuration"),
            @ApiResponse(responseCode = "500", description = "Radio rejected the command or is not connected")
    })
    public CompletableFuture<ResponseEntity<SuccessResponse>> setPtt(@RequestBody PttRequest request) {
        return controlService.setPtt(request.transmit())
                .thenApply(ignored -> ResponseEntity.ok(SuccessResponse.ok()));
    }

    @GetMapping("/config")
    @Operation(summary = "Effective radio configuration")
    public ResponseEntity<ConfigResponse> config() {
        return ResponseEntity.ok(controlService.currentConfig());
    }
}
