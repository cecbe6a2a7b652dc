package com.paircraft.engine.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.paircraft.engine.error.InvalidConfigurationException;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered tiebreak criteria plus the knobs that change how individual criteria are computed.
 *
 * @param buchholzCut        how many extreme opponent scores the modified and median variants discard
 * @param includeAddedScores whether added-score accelerators count towards opponents' scores
 * @param teamTiebreaks      ordering used for team standings
 */
public record TiebreakConfig(
    @JsonProperty("criteria") List<TiebreakCriterion> criteria,
    @JsonProperty("buchholzCut") int buchholzCut,
    @JsonProperty("unplayedRoundPolicy") UnplayedRoundPolicy unplayedRoundPolicy,
    @JsonProperty("includeAddedScores") boolean includeAddedScores,
    @JsonProperty("teamTiebreaks") List<TeamTiebreak> teamTiebreaks
) {

    public TiebreakConfig {
        criteria = criteria == null ? ImmutableList.of() : ImmutableList.copyOf(criteria);
        unplayedRoundPolicy = unplayedRoundPolicy == null ? UnplayedRoundPolicy.VIRTUAL_OPPONENT : unplayedRoundPolicy;
        teamTiebreaks = teamTiebreaks == null || teamTiebreaks.isEmpty()
            ? ImmutableList.of(TeamTiebreak.MATCH_POINTS, TeamTiebreak.GAME_POINTS, TeamTiebreak.BUCHHOLZ)
            : ImmutableList.copyOf(teamTiebreaks);
        if (buchholzCut < 0) {
            throw new InvalidConfigurationException("buchholzCut must not be negative, got " + buchholzCut);
        }
        Set<TiebreakCriterion> seen = new HashSet<>();
        for (TiebreakCriterion criterion : criteria) {
            if (!seen.add(criterion)) {
                throw new InvalidConfigurationException("Tiebreak criterion listed twice: " + criterion.key());
            }
        }
    }

    /**
     * The product's default order.
     */
    public static TiebreakConfig defaults() {
        return of(TiebreakCriterion.BUCHHOLZ,
            TiebreakCriterion.SONNEBORN_BERGER,
            TiebreakCriterion.PERFORMANCE_RATING,
            TiebreakCriterion.MODIFIED_BUCHHOLZ,
            TiebreakCriterion.CUMULATIVE);
    }

    public static TiebreakConfig of(TiebreakCriterion... criteria) {
        return new TiebreakConfig(Arrays.asList(criteria), 1, UnplayedRoundPolicy.VIRTUAL_OPPONENT, false, null);
    }

    /**
     * Builds a configuration from criterion keys such as "buchholz" or "sonnebornBerger".
     *
     * @throws InvalidConfigurationException for an unknown or blank key
     */
    public static TiebreakConfig fromKeys(List<String> keys) {
        ImmutableList.Builder<TiebreakCriterion> criteria = ImmutableList.builder();
        for (String key : keys) {
            if (key == null || key.isBlank()) {
                throw new InvalidConfigurationException("Blank tiebreak criterion in list " + keys);
            }
            criteria.add(TiebreakCriterion.fromKey(key.trim()));
        }
        return new TiebreakConfig(criteria.build(), 1, UnplayedRoundPolicy.VIRTUAL_OPPONENT, false, null);
    }

    public TiebreakConfig withUnplayedRoundPolicy(UnplayedRoundPolicy policy) {
        return new TiebreakConfig(criteria, buchholzCut, policy, includeAddedScores, teamTiebreaks);
    }

    public TiebreakConfig withBuchholzCut(int cut) {
        return new TiebreakConfig(criteria, cut, unplayedRoundPolicy, includeAddedScores, teamTiebreaks);
    }

    public TiebreakConfig withIncludeAddedScores(boolean include) {
        return new TiebreakConfig(criteria, buchholzCut, unplayedRoundPolicy, include, teamTiebreaks);
    }

    public TiebreakConfig withTeamTiebreaks(List<TeamTiebreak> tiebreaks) {
        return new TiebreakConfig(criteria, buchholzCut, unplayedRoundPolicy, includeAddedScores, tiebreaks);
    }
}
