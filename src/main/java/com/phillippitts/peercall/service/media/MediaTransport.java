package com.phillippitts.peercall.service.media;

import java.util.concurrent.CompletableFuture;

/**
 * Black-box media transport: one negotiated connection to one remote party.
 *
 * <p>Implementations may invoke the listener from any thread; callers are responsible for
 * hopping back onto their own loop.
 */
public interface MediaTransport {

    CompletableFuture<SessionDescription> createOffer();

    CompletableFuture<SessionDescription> createAnswer();

    CompletableFuture<Void> setLocalDescription(SessionDescription description);

    CompletableFuture<Void> setRemoteDescription(SessionDescription description);

    boolean hasRemoteDescription();

    CompletableFuture<Void> addIceCandidate(IceCandidate candidate);

    void addTrack(MediaTrack track, MediaStream stream);

    /**
     * Swaps the outgoing track of the given kind in place. No renegotiation takes place.
     *
     * @param kind kind of sender to update
     * @param track new track, or {@code null} to send nothing
     */
    void replaceTrack(MediaTrack.Kind kind, MediaTrack track);

    void setListener(Listener listener);

    TransportState state();

    void close();

    /**
     * Callbacks from the transport.
     */
    interface Listener {

        void onIceCandidate(IceCandidate candidate);

        void onTrack(MediaTrack track, MediaStream stream);

        void onStateChange(TransportState state);
    }
}
