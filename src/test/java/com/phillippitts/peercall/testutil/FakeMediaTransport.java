package com.phillippitts.peercall.testutil;

import com.phillippitts.peercall.service.media.IceCandidate;
import com.phillippitts.peercall.service.media.MediaStream;
import com.phillippitts.peercall.service.media.MediaTrack;
import com.phillippitts.peercall.service.media.MediaTransport;
import com.phillippitts.peercall.service.media.SessionDescription;
import com.phillippitts.peercall.service.media.TransportState;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Media transport double. Negotiation steps complete immediately; tests drive connectivity
 * through {@link #fireState(TransportState)} and friends.
 */
public class FakeMediaTransport implements MediaTransport {

    private final String partnerId;
    private final List<IceCandidate> addedCandidates = new ArrayList<>();
    private final List<MediaTrack> addedTracks = new ArrayList<>();
    private final Map<MediaTrack.Kind, MediaTrack> senders = new HashMap<>();
    private int replaceCalls;
    private int offersCreated;
    private Listener listener;
    private SessionDescription localDescription;
    private SessionDescription remoteDescription;
    private TransportState state = TransportState.NEW;
    private boolean closed;

    public FakeMediaTransport(String partnerId) {
        this.partnerId = partnerId;
    }

    @Override
    public CompletableFuture<SessionDescription> createOffer() {
        offersCreated++;
        return CompletableFuture.completedFuture(SessionDescription.offer("v=0 offer-" + partnerId + "-" + offersCreated));
    }

    @Override
    public CompletableFuture<SessionDescription> createAnswer() {
        return CompletableFuture.completedFuture(SessionDescription.answer("v=0 answer-" + partnerId));
    }

    @Override
    public CompletableFuture<Void> setLocalDescription(SessionDescription description) {
        localDescription = description;
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> setRemoteDescription(SessionDescription description) {
        remoteDescription = description;
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public boolean hasRemoteDescription() {
        return remoteDescription != null;
    }

    @Override
    public CompletableFuture<Void> addIceCandidate(IceCandidate candidate) {
        addedCandidates.add(candidate);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void addTrack(MediaTrack track, MediaStream stream) {
        addedTracks.add(track);
        senders.put(track.kind(), track);
    }

    @Override
    public void replaceTrack(MediaTrack.Kind kind, MediaTrack track) {
        replaceCalls++;
        senders.put(kind, track);
    }

    @Override
    public void setListener(Listener listener) {
        this.listener = listener;
    }

    @Override
    public TransportState state() {
        return state;
    }

    @Override
    public void close() {
        closed = true;
        state = TransportState.CLOSED;
    }

    public void fireState(TransportState newState) {
        state = newState;
        listener.onStateChange(newState);
    }

    public void fireIceCandidate(IceCandidate candidate) {
        listener.onIceCandidate(candidate);
    }

    public void fireRemoteTrack(MediaTrack track, MediaStream stream) {
        listener.onTrack(track, stream);
    }

    public String partnerId() {
        return partnerId;
    }

    public List<IceCandidate> addedCandidates() {
        return addedCandidates;
    }

    public List<MediaTrack> addedTracks() {
        return addedTracks;
    }

    public MediaTrack sender(MediaTrack.Kind kind) {
        return senders.get(kind);
    }

    public int replaceCalls() {
        return replaceCalls;
    }

    public int offersCreated() {
        return offersCreated;
    }

    public SessionDescription localDescription() {
        return localDescription;
    }

    public SessionDescription remoteDescription() {
        return remoteDescription;
    }

    public boolean isClosed() {
        return closed;
    }
}
