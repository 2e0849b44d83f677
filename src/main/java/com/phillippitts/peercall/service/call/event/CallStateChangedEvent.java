package com.phillippitts.peercall.service.call.event;

import com.phillippitts.peercall.service.call.CallRecord;
import com.phillippitts.peercall.service.call.CallState;

import java.time.Instant;

/**
 * Published on every call state transition.
 *
 * @param record the record after the transition (in state {@code current})
 * @param reason short machine-readable cause, e.g. {@code declined}, {@code timeout}, {@code hangup}
 */
public record CallStateChangedEvent(CallState previous,
                                    CallState current,
                                    CallRecord record,
                                    String reason,
                                    Instant at) { }
