package com.phillippitts.peercall.service.media;

import java.util.concurrent.CompletableFuture;

/**
 * Host-provided media device capture.
 */
public interface MediaCapture {

    /**
     * Opens a local stream with audio and, when requested, video.
     */
    CompletableFuture<MediaStream> openLocalStream(boolean withVideo);

    /**
     * Opens a fresh camera track, used when the previous one was stopped while the camera was off.
     */
    CompletableFuture<MediaTrack> openVideoTrack();
}
