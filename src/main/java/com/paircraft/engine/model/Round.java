package com.paircraft.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable round record. Results are applied by building a new instance.
 *
 * @param addedScores added-score accelerator values awarded for this round, by player id
 */
public record Round(
    @JsonProperty("number") int number,
    @JsonProperty("pairings") List<Pairing> pairings,
    @JsonProperty("addedScores") Map<String, Double> addedScores
) {

    public Round {
        pairings = pairings == null ? ImmutableList.of() : ImmutableList.copyOf(pairings);
        addedScores = addedScores == null ? ImmutableMap.of() : ImmutableMap.copyOf(addedScores);
    }

    public Round(int number, List<Pairing> pairings) {
        this(number, pairings, null);
    }

    public RoundStatus status() {
        return pairings.stream().anyMatch(Pairing::isPending)
            ? RoundStatus.PENDING_RESULTS
            : RoundStatus.COMPLETE;
    }

    @JsonIgnore
    public boolean isComplete() {
        return status() == RoundStatus.COMPLETE;
    }

    /**
     * True when at least one game of the round has a result entered.
     */
    @JsonIgnore
    public boolean hasRecordedResults() {
        return pairings.stream().anyMatch(p -> !p.isBye() && !p.isPending());
    }

    public Optional<Pairing> pairing(String pairingId) {
        return pairings.stream().filter(p -> p.id().equals(pairingId)).findFirst();
    }

    public List<Pairing> pairingsInSection(String section) {
        return pairings.stream().filter(p -> p.section().equals(section)).toList();
    }

    public Round withPairing(Pairing replacement) {
        ImmutableList.Builder<Pairing> updated = ImmutableList.builder();
        for (Pairing pairing : pairings) {
            updated.add(pairing.id().equals(replacement.id()) ? replacement : pairing);
        }
        return new Round(number, updated.build(), addedScores);
    }
}
