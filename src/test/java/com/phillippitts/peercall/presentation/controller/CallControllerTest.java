package com.phillippitts.peercall.presentation.controller;

import com.phillippitts.peercall.exception.CallControlException;
import com.phillippitts.peercall.exception.ErrorKind;
import com.phillippitts.peercall.service.call.CallRecord;
import com.phillippitts.peercall.service.call.CallSessionManager;
import com.phillippitts.peercall.service.ledger.MissedCallLedger;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CallController.class)
class CallControllerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Autowired
    private MockMvc mvc;

    @MockBean
    private CallSessionManager calls;

    @MockBean
    private MissedCallLedger ledger;

    @Test
    void initiateReturnsTheDialingCall() throws Exception {
        when(calls.initiateCall("bob")).thenReturn(CompletableFuture.completedFuture(
                CallRecord.outgoing("bob", NOW).withCallId("c-1")));

        MvcResult pending = mvc.perform(post("/api/calls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"peerId\":\"bob\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.callId").value("c-1"))
                .andExpect(jsonPath("$.peerId").value("bob"))
                .andExpect(jsonPath("$.direction").value("OUTGOING"));
    }

    @Test
    void blankPeerIdIsRejected() throws Exception {
        mvc.perform(post("/api/calls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"peerId\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("ValidationError"));

        verify(calls, never()).initiateCall(anyString());
    }

    @Test
    void refusedIntentMapsToConflict() throws Exception {
        when(calls.initiateCall("bob")).thenReturn(CompletableFuture.failedFuture(
                new CallControlException(ErrorKind.INVALID_STATE, "Already in a call (ACTIVE)", "bob")));

        MvcResult pending = mvc.perform(post("/api/calls")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"peerId\":\"bob\"}"))
                .andReturn();

        mvc.perform(asyncDispatch(pending))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("INVALID_STATE"));
    }

    @Test
    void currentIsEmptyWhenIdle() throws Exception {
        when(calls.currentRecord()).thenReturn(Optional.empty());

        mvc.perform(get("/api/calls/current"))
                .andExpect(status().isNoContent())
                .andExpect(header().exists("X-Request-ID"));
    }

    @Test
    void currentShowsRingingCall() throws Exception {
        when(calls.currentRecord()).thenReturn(Optional.of(CallRecord.incoming("c-2", "carol", "Carol", NOW)));

        mvc.perform(get("/api/calls/current"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("RINGING_IN"))
                .andExpect(jsonPath("$.peerNick").value("Carol"));
    }

    @Test
    void hangupRespondsNoContent() throws Exception {
        when(calls.hangup()).thenReturn(CompletableFuture.completedFuture(null));

        MvcResult pending = mvc.perform(post("/api/calls/current/hangup")).andReturn();

        mvc.perform(asyncDispatch(pending)).andExpect(status().isNoContent());
    }

    @Test
    void micToggleReportsNewState() throws Exception {
        when(calls.toggleMic()).thenReturn(CompletableFuture.completedFuture(false));

        MvcResult pending = mvc.perform(post("/api/calls/current/mic")).andReturn();

        mvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(false));
    }

    @Test
    void missedCountersAreReadableAndResettable() throws Exception {
        when(ledger.snapshot()).thenReturn(Map.of("bob", 2));
        when(ledger.count("bob")).thenReturn(2);

        mvc.perform(get("/api/calls/missed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bob").value(2));
        mvc.perform(get("/api/calls/missed/bob"))
                .andExpect(jsonPath("$.count").value(2));
        mvc.perform(delete("/api/calls/missed/bob"))
                .andExpect(status().isNoContent());

        verify(ledger).reset("bob");
    }
}
