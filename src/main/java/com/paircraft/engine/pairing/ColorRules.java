package com.paircraft.engine.pairing;

import com.paircraft.engine.config.PairingConfig;
import com.paircraft.engine.history.ColorProfile;
import com.paircraft.engine.model.Color;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Hard and soft color constraints derived from the equalization and alternation limits.
 */
final class ColorRules {

    private final int equalizationLimit;
    private final int alternationLimit;

    ColorRules(int equalizationLimit, int alternationLimit) {
        this.equalizationLimit = equalizationLimit;
        this.alternationLimit = alternationLimit;
    }

    static ColorRules from(PairingConfig config) {
        return new ColorRules(config.equalizationLimit(), config.alternationLimit());
    }

    /**
     * The color a player must get because the other one would break a limit.
     */
    Optional<Color> required(ColorProfile profile) {
        int difference = profile.difference();
        if (difference >= equalizationLimit) {
            return Optional.of(Color.BLACK);
        }
        if (-difference >= equalizationLimit) {
            return Optional.of(Color.WHITE);
        }
        if (profile.trailingStreak() >= alternationLimit) {
            return profile.last().map(Color::opposite);
        }
        return Optional.empty();
    }

    /**
     * Required color, else the color that evens the balance, else the alternating one.
     */
    Optional<Color> preferred(ColorProfile profile) {
        Optional<Color> required = required(profile);
        if (required.isPresent()) {
            return required;
        }
        if (profile.difference() > 0) {
            return Optional.of(Color.BLACK);
        }
        if (profile.difference() < 0) {
            return Optional.of(Color.WHITE);
        }
        return profile.last().map(Color::opposite);
    }

    /**
     * False when both entrants must have the same color.
     */
    boolean compatible(Entrant a, Entrant b) {
        Optional<Color> ra = required(a.colors());
        Optional<Color> rb = required(b.colors());
        return ra.isEmpty() || rb.isEmpty() || ra.get() != rb.get();
    }

    /**
     * Limits broken by giving {@code assigned} to a player with this profile.
     */
    List<DeviationKind> violations(ColorProfile profile, Color assigned) {
        List<DeviationKind> broken = new ArrayList<>();
        ColorProfile after = profile.plus(assigned);
        if (Math.abs(after.difference()) > equalizationLimit) {
            broken.add(DeviationKind.COLOR_EQUALIZATION_VIOLATED);
        }
        if (after.trailingStreak() > alternationLimit) {
            broken.add(DeviationKind.COLOR_ALTERNATION_VIOLATED);
        }
        return broken;
    }
}
