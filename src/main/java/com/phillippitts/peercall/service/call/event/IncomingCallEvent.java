package com.phillippitts.peercall.service.call.event;

import com.phillippitts.peercall.service.call.CallRecord;

/**
 * Published when an incoming call starts ringing.
 */
public record IncomingCallEvent(CallRecord record) { }
