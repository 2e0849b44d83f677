package com.phillippitts.peercall.presentation.controller;

import com.phillippitts.peercall.service.identity.AttachResult;
import com.phillippitts.peercall.service.identity.IdentityReattachment;
import com.phillippitts.peercall.service.identity.ProfileDelta;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/identity")
class IdentityController {

    private final IdentityReattachment identity;

    IdentityController(IdentityReattachment identity) {
        this.identity = identity;
    }

    /** {@code installId} defaults to this installation's id. */
    record AttachRequest(String installId, String nick, String avatarUrl) { }

    @PostMapping("/attach")
    CompletableFuture<AttachResult> attach(@RequestBody(required = false) AttachRequest request) {
        String installId = request == null || request.installId() == null || request.installId().isBlank()
                ? identity.installId()
                : request.installId();
        ProfileDelta profile = request == null ? ProfileDelta.empty() : new ProfileDelta(request.nick(), request.avatarUrl());
        return identity.attach(installId, profile);
    }

    @GetMapping
    Map<String, Object> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("userId", identity.knownUserId().orElse(null));
        body.put("trust", identity.trustState().name());
        return body;
    }
}
