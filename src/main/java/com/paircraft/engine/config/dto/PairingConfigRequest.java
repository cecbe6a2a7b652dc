package com.paircraft.engine.config.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.paircraft.engine.config.AccelerationType;
import com.paircraft.engine.config.PairingConfig;
import com.paircraft.engine.config.PairingMethod;
import com.paircraft.engine.config.PairingType;
import com.paircraft.engine.config.TeamScoring;
import com.paircraft.engine.error.InvalidConfigurationException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * DTO for pairing settings as stored with a tournament. Absent fields take the defaults
 * of {@link PairingConfig#builder()}.
 */
public record PairingConfigRequest(
    @JsonProperty("pairingMethod") String pairingMethod,
    @JsonProperty("pairingType") String pairingType,
    @JsonProperty("accelerationType") String accelerationType,
    @JsonProperty("accelerationRounds") @Min(1) Integer accelerationRounds,
    @JsonProperty("accelerationThreshold") @Min(2) Integer accelerationThreshold,
    @JsonProperty("accelerationBreakPoint") @Min(2) Integer accelerationBreakPoint,
    @JsonProperty("addedScore") @DecimalMin("0.0") Double addedScore,
    @JsonProperty("rounds") @NotNull @Min(1) Integer rounds,
    @JsonProperty("equalizationLimit") @Min(1) Integer equalizationLimit,
    @JsonProperty("alternationLimit") @Min(1) Integer alternationLimit,
    @JsonProperty("doubleRoundRobin") Boolean doubleRoundRobin,
    @JsonProperty("teamBoardCount") @Min(1) Integer teamBoardCount,
    @JsonProperty("teamScoring") String teamScoring,
    @JsonProperty("bestEffortFallback") Boolean bestEffortFallback,
    @JsonProperty("tiebreaks") @Valid TiebreakConfigRequest tiebreaks
) {

    /**
     * Converts to the immutable configuration.
     *
     * @throws com.paircraft.engine.error.InvalidConfigurationException for unknown keys or inconsistent options
     */
    public PairingConfig toConfig() {
        if (rounds == null) {
            throw new InvalidConfigurationException("rounds is required");
        }
        PairingConfig.Builder builder = PairingConfig.builder().rounds(rounds);
        if (pairingMethod != null) {
            builder.method(PairingMethod.fromKey(pairingMethod));
        }
        if (pairingType != null) {
            builder.pairingType(PairingType.fromKey(pairingType));
        }
        if (accelerationType != null) {
            builder.accelerationType(AccelerationType.fromKey(accelerationType));
        }
        if (accelerationRounds != null) {
            builder.accelerationRounds(accelerationRounds);
        }
        builder.accelerationThreshold(accelerationThreshold);
        builder.accelerationBreakPoint(accelerationBreakPoint);
        if (addedScore != null) {
            builder.addedScore(addedScore);
        }
        if (equalizationLimit != null) {
            builder.equalizationLimit(equalizationLimit);
        }
        if (alternationLimit != null) {
            builder.alternationLimit(alternationLimit);
        }
        if (doubleRoundRobin != null) {
            builder.doubleRoundRobin(doubleRoundRobin);
        }
        if (teamBoardCount != null) {
            builder.teamBoardCount(teamBoardCount);
        }
        if (teamScoring != null) {
            builder.teamScoring(TeamScoring.fromKey(teamScoring));
        }
        if (bestEffortFallback != null) {
            builder.bestEffortFallback(bestEffortFallback);
        }
        if (tiebreaks != null) {
            builder.tiebreaks(tiebreaks.toConfig());
        }
        return builder.build();
    }
}
