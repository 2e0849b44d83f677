package com.phillippitts.peercall.presentation.controller;

import com.phillippitts.peercall.service.call.CallSessionManager;
import com.phillippitts.peercall.service.ledger.MissedCallLedger;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Call control endpoints. Every intent is handed to the call event loop; responses complete
 * when the loop has processed it.
 */
@RestController
@RequestMapping("/api/calls")
class CallController {

    private static final Logger LOG = LogManager.getLogger(CallController.class);

    private final CallSessionManager calls;
    private final MissedCallLedger ledger;

    CallController(CallSessionManager calls, MissedCallLedger ledger) {
        this.calls = calls;
        this.ledger = ledger;
    }

    record InitiateCallRequest(@NotBlank String peerId) { }

    @PostMapping
    CompletableFuture<CallView> initiate(@Valid @RequestBody InitiateCallRequest request) {
        LOG.info("Initiate call to {}", request.peerId());
        return calls.initiateCall(request.peerId())
                .thenApply(record -> CallView.of(record, calls.peerSession()));
    }

    @GetMapping("/current")
    ResponseEntity<CallView> current() {
        return calls.currentRecord()
                .map(record -> ResponseEntity.ok(CallView.of(record, calls.peerSession())))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/current/accept")
    CompletableFuture<CallView> accept() {
        return calls.acceptCall().thenApply(record -> CallView.of(record, calls.peerSession()));
    }

    @PostMapping("/current/decline")
    CompletableFuture<ResponseEntity<Void>> decline() {
        return calls.declineCall().thenApply(v -> ResponseEntity.noContent().build());
    }

    @PostMapping("/current/cancel")
    CompletableFuture<ResponseEntity<Void>> cancel() {
        return calls.cancelCall().thenApply(v -> ResponseEntity.noContent().build());
    }

    @PostMapping("/current/hangup")
    CompletableFuture<ResponseEntity<Void>> hangup() {
        return calls.hangup().thenApply(v -> ResponseEntity.noContent().build());
    }

    @PostMapping("/current/mic")
    CompletableFuture<Map<String, Boolean>> toggleMic() {
        return calls.toggleMic().thenApply(CallController::enabled);
    }

    @PostMapping("/current/camera")
    CompletableFuture<Map<String, Boolean>> toggleCamera() {
        return calls.toggleCamera().thenApply(CallController::enabled);
    }

    @PostMapping("/current/remote-audio")
    CompletableFuture<Map<String, Boolean>> toggleRemoteAudio() {
        return calls.toggleRemoteAudio().thenApply(CallController::enabled);
    }

    @GetMapping("/missed")
    Map<String, Integer> missed() {
        return ledger.snapshot();
    }

    @GetMapping("/missed/{peerId}")
    Map<String, Object> missedFor(@PathVariable String peerId) {
        return Map.of("peerId", peerId, "count", ledger.count(peerId));
    }

    @DeleteMapping("/missed/{peerId}")
    ResponseEntity<Void> resetMissed(@PathVariable String peerId) {
        ledger.reset(peerId);
        return ResponseEntity.noContent().build();
    }

    private static Map<String, Boolean> enabled(boolean value) {
        return Map.of("enabled", value);
    }
}
