package com.paircraft.engine.acceleration;

/**
 * Why acceleration did or did not change a section's pairing scores.
 */
public enum AccelerationStatus {
    APPLIED,
    /** The tournament is not configured for accelerated pairing. */
    DISABLED,
    /** Accelerated pairing is configured but this round is past the acceleration window. */
    OUTSIDE_WINDOW,
    /** Accelerated pairing is configured but the section is too small to trigger it. */
    BELOW_THRESHOLD
}
