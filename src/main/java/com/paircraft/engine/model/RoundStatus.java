package com.paircraft.engine.model;

public enum RoundStatus {
    PENDING_RESULTS,
    COMPLETE
}
