package com.paircraft.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One result to record against a generated pairing.
 */
public record ResultEntry(
    @JsonProperty("pairingId") String pairingId,
    @JsonProperty("result") GameResult result
) {}
