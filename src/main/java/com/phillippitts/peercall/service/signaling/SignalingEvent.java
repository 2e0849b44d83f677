package com.phillippitts.peercall.service.signaling;

import org.json.JSONObject;

import java.util.Objects;
import java.util.function.Function;

/**
 * Typed channel key: a wire event name bound to its payload type and JSON codec.
 *
 * <p>Handlers register against a {@code SignalingEvent<T>} and receive decoded {@code T}
 * values, so a handler for the wrong payload shape does not compile. The fixed set of events
 * lives in {@link SignalingEvents}.
 *
 * @param <T> payload type
 */
public final class SignalingEvent<T> {

    private final String name;
    private final Function<T, JSONObject> encoder;
    private final Function<JSONObject, T> decoder;

    private SignalingEvent(String name, Function<T, JSONObject> encoder, Function<JSONObject, T> decoder) {
        this.name = Objects.requireNonNull(name, "name");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    static <T> SignalingEvent<T> of(String name, Function<T, JSONObject> encoder, Function<JSONObject, T> decoder) {
        return new SignalingEvent<>(name, encoder, decoder);
    }

    public String name() {
        return name;
    }

    public JSONObject encode(T payload) {
        return encoder.apply(payload);
    }

    public T decode(JSONObject json) {
        return decoder.apply(json == null ? new JSONObject() : json);
    }

    @Override
    public String toString() {
        return name;
    }
}
