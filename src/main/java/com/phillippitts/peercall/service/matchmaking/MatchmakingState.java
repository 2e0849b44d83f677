package com.phillippitts.peercall.service.matchmaking;

public enum MatchmakingState {
    IDLE,
    SEARCHING,
    MATCHED
}
