package com.phillippitts.peercall.service.call.event;

import com.phillippitts.peercall.exception.ErrorKind;

import java.time.Instant;

/**
 * Published when a call intent or a call fails in a way the UI must show.
 *
 * @param message relay error verbatim where there is one
 */
public record CallErrorEvent(ErrorKind kind, String message, String peerId, Instant at) { }
