package com.paircraft.engine.pairing;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.paircraft.engine.acceleration.AccelerationPlan;
import com.paircraft.engine.model.Pairing;
import com.paircraft.engine.model.Points;
import com.paircraft.engine.model.Round;
import com.paircraft.engine.team.TeamMatch;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A generated round across all sections, with every deviation and acceleration decision.
 */
public record PairingOutcome(
    @JsonProperty("tournamentId") String tournamentId,
    @JsonProperty("round") int round,
    @JsonProperty("status") PairingStatus status,
    @JsonProperty("pairings") List<Pairing> pairings,
    @JsonProperty("deviations") List<Deviation> deviations,
    @JsonProperty("accelerations") List<AccelerationPlan> accelerations,
    @JsonProperty("teamMatches") List<TeamMatch> teamMatches
) {

    public PairingOutcome {
        pairings = pairings == null ? ImmutableList.of() : ImmutableList.copyOf(pairings);
        deviations = deviations == null ? ImmutableList.of() : ImmutableList.copyOf(deviations);
        accelerations = accelerations == null ? ImmutableList.of() : ImmutableList.copyOf(accelerations);
        teamMatches = teamMatches == null ? ImmutableList.of() : ImmutableList.copyOf(teamMatches);
    }

    /**
     * Merges per-section results. The round is FINISHED only if every section is,
     * BEST_EFFORT if any section is.
     */
    public static PairingOutcome combine(String tournamentId, int round, List<SectionPairing> sections) {
        ImmutableList.Builder<Pairing> pairings = ImmutableList.builder();
        ImmutableList.Builder<Deviation> deviations = ImmutableList.builder();
        ImmutableList.Builder<AccelerationPlan> accelerations = ImmutableList.builder();
        ImmutableList.Builder<TeamMatch> teamMatches = ImmutableList.builder();
        boolean allFinished = !sections.isEmpty();
        boolean anyBestEffort = false;
        for (SectionPairing section : sections) {
            pairings.addAll(section.pairings());
            deviations.addAll(section.deviations());
            if (section.acceleration() != null) {
                accelerations.add(section.acceleration());
            }
            teamMatches.addAll(section.teamMatches());
            allFinished &= section.status() == PairingStatus.FINISHED;
            anyBestEffort |= section.status() == PairingStatus.BEST_EFFORT;
        }
        PairingStatus status = anyBestEffort ? PairingStatus.BEST_EFFORT
            : allFinished ? PairingStatus.FINISHED : PairingStatus.COMPLETE;
        return new PairingOutcome(tournamentId, round, status, pairings.build(), deviations.build(),
            accelerations.build(), teamMatches.build());
    }

    /**
     * The round record to store, with added-score accelerators attached.
     */
    public Round toRound() {
        Map<String, Double> addedScores = new LinkedHashMap<>();
        for (AccelerationPlan plan : accelerations) {
            plan.addedScoreHalves().forEach((id, halves) -> addedScores.put(id, Points.toPoints(halves)));
        }
        return new Round(round, pairings, addedScores);
    }
}
