package com.paircraft.engine.config.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.paircraft.engine.config.TeamTiebreak;
import com.paircraft.engine.config.TiebreakConfig;
import com.paircraft.engine.config.UnplayedRoundPolicy;
import com.paircraft.engine.error.InvalidConfigurationException;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * DTO for the tiebreak section of a settings file. Criterion names use the product's keys.
 */
public record TiebreakConfigRequest(
    @JsonProperty("criteria") @NotEmpty List<@NotBlank String> criteria,
    @JsonProperty("buchholzCut") @Min(0) Integer buchholzCut,
    @JsonProperty("unplayedRoundPolicy") String unplayedRoundPolicy,
    @JsonProperty("includeAddedScores") Boolean includeAddedScores,
    @JsonProperty("teamTiebreaks") List<@NotBlank String> teamTiebreaks
) {

    public TiebreakConfig toConfig() {
        if (criteria == null || criteria.isEmpty()) {
            throw new InvalidConfigurationException("At least one tiebreak criterion is required");
        }
        TiebreakConfig config = TiebreakConfig.fromKeys(criteria);
        if (buchholzCut != null) {
            config = config.withBuchholzCut(buchholzCut);
        }
        if (unplayedRoundPolicy != null) {
            config = config.withUnplayedRoundPolicy(UnplayedRoundPolicy.fromKey(unplayedRoundPolicy));
        }
        if (includeAddedScores != null) {
            config = config.withIncludeAddedScores(includeAddedScores);
        }
        if (teamTiebreaks != null) {
            config = config.withTeamTiebreaks(teamTiebreaks.stream().map(TeamTiebreak::fromKey).toList());
        }
        return config;
    }
}
