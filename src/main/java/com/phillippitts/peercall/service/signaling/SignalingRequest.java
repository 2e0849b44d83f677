package com.phillippitts.peercall.service.signaling;

import org.json.JSONObject;

import java.util.Objects;
import java.util.function.Function;

/**
 * An acknowledged exchange: the outbound event plus the decoder for its acknowledgement.
 *
 * @param <Q> request payload type
 * @param <A> acknowledgement type
 */
public final class SignalingRequest<Q, A> {

    private final SignalingEvent<Q> event;
    private final Function<JSONObject, A> ackDecoder;

    SignalingRequest(SignalingEvent<Q> event, Function<JSONObject, A> ackDecoder) {
        this.event = Objects.requireNonNull(event, "event");
        this.ackDecoder = Objects.requireNonNull(ackDecoder, "ackDecoder");
    }

    public SignalingEvent<Q> event() {
        return event;
    }

    public String name() {
        return event.name();
    }

    public A decodeAck(JSONObject json) {
        return ackDecoder.apply(json == null ? new JSONObject() : json);
    }

    @Override
    public String toString() {
        return event.name();
    }
}
