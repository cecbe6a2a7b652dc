package com.paircraft.engine.pairing;

import com.google.common.collect.ImmutableList;
import com.paircraft.engine.acceleration.AccelerationPlan;
import com.paircraft.engine.model.Pairing;
import com.paircraft.engine.team.TeamMatch;

import java.util.List;

/**
 * One section's share of a generated round.
 */
public record SectionPairing(
    String section,
    List<Pairing> pairings,
    List<Deviation> deviations,
    AccelerationPlan acceleration,
    List<TeamMatch> teamMatches,
    PairingStatus status
) {
    public SectionPairing {
        pairings = ImmutableList.copyOf(pairings);
        deviations = ImmutableList.copyOf(deviations);
        teamMatches = teamMatches == null ? ImmutableList.of() : ImmutableList.copyOf(teamMatches);
    }

    static PairingStatus statusOf(List<Deviation> deviations) {
        return deviations.isEmpty() ? PairingStatus.COMPLETE : PairingStatus.BEST_EFFORT;
    }
}
