package com.phillippitts.peercall.service.signaling.message;

/** Payload for events that carry no data ({@code start}, {@code next}, {@code peer:left}...). */
public enum Empty {
    INSTANCE
}
