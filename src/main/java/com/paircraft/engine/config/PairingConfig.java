package com.paircraft.engine.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Every recognized pairing option, resolved once before generation. Use {@link #builder()}
 * for defaults; the builder validates the result.
 *
 * @param rounds                 planned number of rounds
 * @param accelerationThreshold  minimum section size that triggers acceleration, {@code null} for 2^(rounds+1)+1
 * @param accelerationBreakPoint size of the accelerated top group, {@code null} for half the field rounded up to even
 * @param equalizationLimit      largest allowed |whites - blacks| for a player
 * @param alternationLimit       largest allowed run of the same color
 * @param bestEffortFallback     when false an exhausted search is thrown instead of returned
 */
public record PairingConfig(
    @JsonProperty("method") PairingMethod method,
    @JsonProperty("pairingType") PairingType pairingType,
    @JsonProperty("accelerationType") AccelerationType accelerationType,
    @JsonProperty("accelerationRounds") int accelerationRounds,
    @JsonProperty("accelerationThreshold") Integer accelerationThreshold,
    @JsonProperty("accelerationBreakPoint") Integer accelerationBreakPoint,
    @JsonProperty("addedScore") double addedScore,
    @JsonProperty("rounds") int rounds,
    @JsonProperty("equalizationLimit") int equalizationLimit,
    @JsonProperty("alternationLimit") int alternationLimit,
    @JsonProperty("doubleRoundRobin") boolean doubleRoundRobin,
    @JsonProperty("teamBoardCount") int teamBoardCount,
    @JsonProperty("teamScoring") TeamScoring teamScoring,
    @JsonProperty("bestEffortFallback") boolean bestEffortFallback,
    @JsonProperty("tiebreaks") TiebreakConfig tiebreaks
) {

    public static Builder builder() {
        return new Builder();
    }

    public static PairingConfig defaults(int rounds) {
        return builder().rounds(rounds).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .method(method)
            .pairingType(pairingType)
            .accelerationType(accelerationType)
            .accelerationRounds(accelerationRounds)
            .accelerationThreshold(accelerationThreshold)
            .accelerationBreakPoint(accelerationBreakPoint)
            .addedScore(addedScore)
            .rounds(rounds)
            .equalizationLimit(equalizationLimit)
            .alternationLimit(alternationLimit)
            .doubleRoundRobin(doubleRoundRobin)
            .teamBoardCount(teamBoardCount)
            .teamScoring(teamScoring)
            .bestEffortFallback(bestEffortFallback)
            .tiebreaks(tiebreaks);
    }

    @JsonIgnore
    public boolean isAccelerated() {
        return pairingType == PairingType.ACCELERATED;
    }

    public static final class Builder {
        private PairingMethod method = PairingMethod.FIDE_DUTCH;
        private PairingType pairingType = PairingType.STANDARD;
        private AccelerationType accelerationType = AccelerationType.STANDARD;
        private int accelerationRounds = 2;
        private Integer accelerationThreshold;
        private Integer accelerationBreakPoint;
        private double addedScore = 1.0;
        private int rounds = 5;
        private int equalizationLimit = 2;
        private int alternationLimit = 2;
        private boolean doubleRoundRobin;
        private int teamBoardCount = 4;
        private TeamScoring teamScoring = TeamScoring.MATCH_POINTS;
        private boolean bestEffortFallback = true;
        private TiebreakConfig tiebreaks = TiebreakConfig.defaults();

        private Builder() {
        }

        public Builder method(PairingMethod method) {
            this.method = method;
            return this;
        }

        public Builder pairingType(PairingType pairingType) {
            this.pairingType = pairingType;
            return this;
        }

        public Builder accelerationType(AccelerationType accelerationType) {
            this.accelerationType = accelerationType;
            return this;
        }

        public Builder accelerationRounds(int accelerationRounds) {
            this.accelerationRounds = accelerationRounds;
            return this;
        }

        public Builder accelerationThreshold(Integer accelerationThreshold) {
            this.accelerationThreshold = accelerationThreshold;
            return this;
        }

        public Builder accelerationBreakPoint(Integer accelerationBreakPoint) {
            this.accelerationBreakPoint = accelerationBreakPoint;
            return this;
        }

        public Builder addedScore(double addedScore) {
            this.addedScore = addedScore;
            return this;
        }

        public Builder rounds(int rounds) {
            this.rounds = rounds;
            return this;
        }

        public Builder equalizationLimit(int equalizationLimit) {
            this.equalizationLimit = equalizationLimit;
            return this;
        }

        public Builder alternationLimit(int alternationLimit) {
            this.alternationLimit = alternationLimit;
            return this;
        }

        public Builder doubleRoundRobin(boolean doubleRoundRobin) {
            this.doubleRoundRobin = doubleRoundRobin;
            return this;
        }

        public Builder teamBoardCount(int teamBoardCount) {
            this.teamBoardCount = teamBoardCount;
            return this;
        }

        public Builder teamScoring(TeamScoring teamScoring) {
            this.teamScoring = teamScoring;
            return this;
        }

        public Builder bestEffortFallback(boolean bestEffortFallback) {
            this.bestEffortFallback = bestEffortFallback;
            return this;
        }

        public Builder tiebreaks(TiebreakConfig tiebreaks) {
            this.tiebreaks = tiebreaks;
            return this;
        }

        /**
         * @throws com.paircraft.engine.error.InvalidConfigurationException if the options are inconsistent
         */
        public PairingConfig build() {
            PairingConfig config = new PairingConfig(method, pairingType, accelerationType, accelerationRounds,
                accelerationThreshold, accelerationBreakPoint, addedScore, rounds, equalizationLimit,
                alternationLimit, doubleRoundRobin, teamBoardCount, teamScoring, bestEffortFallback, tiebreaks);
            PairingConfigValidator.validate(config);
            return config;
        }
    }
}
