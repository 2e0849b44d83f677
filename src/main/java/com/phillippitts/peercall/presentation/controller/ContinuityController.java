package com.phillippitts.peercall.presentation.controller;

import com.phillippitts.peercall.exception.CallControlException;
import com.phillippitts.peercall.exception.ErrorKind;
import com.phillippitts.peercall.service.continuity.ActiveCallRegistry;
import com.phillippitts.peercall.service.continuity.CallControls;
import com.phillippitts.peercall.service.continuity.ContinuityBridge;
import com.phillippitts.peercall.service.continuity.PartnerMeta;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Picture-in-picture endpoints for hosts whose call screen lives outside this process.
 */
@RestController
@RequestMapping("/api/pip")
class ContinuityController {

    private final ContinuityBridge bridge;
    private final ActiveCallRegistry registry;

    ContinuityController(ContinuityBridge bridge, ActiveCallRegistry registry) {
        this.bridge = bridge;
        this.registry = registry;
    }

    /** All fields optional; the current call is used when {@code callKey} is absent. */
    record EnterRequest(String callKey, String peerId, String nick) { }

    @PostMapping("/enter")
    Map<String, Object> enter(@RequestBody(required = false) EnterRequest request) {
        String key = Optional.ofNullable(request).map(EnterRequest::callKey)
                .or(() -> registry.current().map(CallControls::key))
                .orElseThrow(() -> new CallControlException(ErrorKind.INVALID_STATE, "No active call", null));
        PartnerMeta meta = request == null || request.peerId() == null ? null
                : new PartnerMeta(request.peerId(), request.nick());
        if (!bridge.enter(meta, key)) {
            throw new CallControlException(ErrorKind.INVALID_STATE, "Call " + key + " is not active", null);
        }
        return Map.of("inPiP", true, "callKey", key);
    }

    @PostMapping("/return")
    Map<String, Boolean> returnToCall() {
        return Map.of("returned", bridge.returnToCall());
    }

    @PostMapping("/exit")
    ResponseEntity<Void> exit() {
        bridge.exit();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/mic")
    CompletableFuture<ResponseEntity<Map<String, Boolean>>> toggleMic() {
        return bridge.toggleMic().thenApply(ContinuityController::toggled);
    }

    @PostMapping("/remote-audio")
    CompletableFuture<ResponseEntity<Map<String, Boolean>>> toggleRemoteAudio() {
        return bridge.toggleRemoteAudio().thenApply(ContinuityController::toggled);
    }

    @PostMapping("/end")
    CompletableFuture<ResponseEntity<Void>> end() {
        return bridge.endCall().thenApply(v -> ResponseEntity.noContent().build());
    }

    private static ResponseEntity<Map<String, Boolean>> toggled(Optional<Boolean> state) {
        return state.map(enabled -> ResponseEntity.ok(Map.of("enabled", enabled)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
