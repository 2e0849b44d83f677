package com.phillippitts.peercall.service.media;

import java.util.List;
import java.util.Optional;

/**
 * A set of tracks. Local streams come from {@link MediaCapture}; remote streams arrive through
 * {@link MediaTransport.Listener#onTrack(MediaTrack, MediaStream)}.
 */
public interface MediaStream {

    String id();

    List<MediaTrack> tracks();

    void addTrack(MediaTrack track);

    void removeTrack(MediaTrack track);

    default List<MediaTrack> audioTracks() {
        return tracks().stream().filter(t -> t.kind() == MediaTrack.Kind.AUDIO).toList();
    }

    default Optional<MediaTrack> videoTrack() {
        return tracks().stream().filter(t -> t.kind() == MediaTrack.Kind.VIDEO).findFirst();
    }
}
