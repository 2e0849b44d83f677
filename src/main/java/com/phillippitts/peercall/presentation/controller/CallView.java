package com.phillippitts.peercall.presentation.controller;

import com.phillippitts.peercall.service.call.CallDirection;
import com.phillippitts.peercall.service.call.CallRecord;
import com.phillippitts.peercall.service.call.CallState;
import com.phillippitts.peercall.service.session.PeerSession;

import java.time.Instant;
import java.util.Optional;

/**
 * REST view of the current call. Toggle states are {@code null} while there is no media session.
 */
record CallView(String callId,
                String peerId,
                String peerNick,
                CallDirection direction,
                CallState state,
                String roomId,
                Instant createdAt,
                Boolean micEnabled,
                Boolean cameraEnabled,
                Boolean remoteAudioEnabled) {

    static CallView of(CallRecord record, Optional<PeerSession> session) {
        PeerSession s = session.filter(p -> !p.isClosed()).orElse(null);
        return new CallView(record.callId(), record.peerId(), record.peerNick(), record.direction(),
                record.state(), record.roomId(), record.createdAt(),
                s == null ? null : s.isMicEnabled(),
                s == null ? null : s.isCameraEnabled(),
                s == null ? null : s.isRemoteAudioEnabled());
    }
}
