package com.phillippitts.peercall.service.call;

public enum CallDirection {
    OUTGOING,
    INCOMING
}
