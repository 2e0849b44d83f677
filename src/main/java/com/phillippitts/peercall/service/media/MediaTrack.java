package com.phillippitts.peercall.service.media;

/**
 * A single audio or video track owned by the media layer.
 */
public interface MediaTrack {

    enum Kind { AUDIO, VIDEO }

    String id();

    Kind kind();

    boolean isEnabled();

    void setEnabled(boolean enabled);

    /** Releases the underlying device. A stopped track cannot be re-enabled. */
    void stop();

    boolean isLive();
}
