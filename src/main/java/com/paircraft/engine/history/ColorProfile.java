package com.paircraft.engine.history;

import com.google.common.collect.ImmutableList;
import com.paircraft.engine.model.Color;

import java.util.List;
import java.util.Optional;

/**
 * Colors a player held in played games, oldest first.
 */
public record ColorProfile(List<Color> colors) {

    public static final ColorProfile EMPTY = new ColorProfile(ImmutableList.of());

    public ColorProfile {
        colors = ImmutableList.copyOf(colors);
    }

    public int whites() {
        return (int) colors.stream().filter(c -> c == Color.WHITE).count();
    }

    public int blacks() {
        return colors.size() - whites();
    }

    /**
     * Whites minus blacks.
     */
    public int difference() {
        return whites() - blacks();
    }

    public Optional<Color> last() {
        return colors.isEmpty() ? Optional.empty() : Optional.of(colors.get(colors.size() - 1));
    }

    /**
     * Length of the run of identical colors ending with the most recent game.
     */
    public int trailingStreak() {
        if (colors.isEmpty()) {
            return 0;
        }
        Color last = colors.get(colors.size() - 1);
        int streak = 0;
        for (int i = colors.size() - 1; i >= 0 && colors.get(i) == last; i--) {
            streak++;
        }
        return streak;
    }

    public ColorProfile plus(Color color) {
        return new ColorProfile(ImmutableList.<Color>builder().addAll(colors).add(color).build());
    }
}
