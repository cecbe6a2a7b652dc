package com.paircraft.engine.pairing;

/**
 * Rules a best-effort pairing may have had to break. Every instance is reported.
 */
public enum DeviationKind {
    REPEAT_PAIRING,
    COLOR_EQUALIZATION_VIOLATED,
    COLOR_ALTERNATION_VIOLATED,
    SEARCH_BUDGET_EXHAUSTED,
    REPEAT_BYE,
    DRAW_ADVANCED_BY_SEED,
    UNDERSIZED_GROUP
}
