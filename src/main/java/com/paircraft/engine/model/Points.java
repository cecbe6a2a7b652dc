package com.paircraft.engine.model;

import com.paircraft.engine.error.InvalidConfigurationException;

/**
 * Scores are carried as integer half-points so that score groups compare exactly.
 */
public final class Points {

    private Points() {
        // Utility class
    }

    /**
     * Converts a point value to half-points.
     *
     * @throws InvalidConfigurationException if the value is not a multiple of 0.5
     */
    public static int toHalves(double points) {
        double doubled = points * 2.0;
        long rounded = Math.round(doubled);
        if (Math.abs(doubled - rounded) > 1e-9) {
            throw new InvalidConfigurationException("Point values must be multiples of 0.5, got " + points);
        }
        return (int) rounded;
    }

    public static double toPoints(int halves) {
        return halves / 2.0;
    }

    /**
     * Formats half-points the way a crosstable shows them: "3", "2.5".
     */
    public static String format(int halves) {
        return halves % 2 == 0 ? Integer.toString(halves / 2) : (halves / 2) + ".5";
    }
}
