package com.paircraft.engine.pairing;

import com.paircraft.engine.history.ColorProfile;
import com.paircraft.engine.model.Color;

import java.util.List;
import java.util.Optional;

/**
 * Assigns colors to a finalized pair. Never changes who plays whom.
 *
 * <p>Priority:
 * <ol>
 *   <li>a color a player must have</li>
 *   <li>the player with more blacks gets white</li>
 *   <li>going back through both histories, alternate from the latest round where they differ</li>
 *   <li>the higher-ranked player's alternation preference</li>
 *   <li>with no history at all, the higher-ranked player gets white on odd boards</li>
 * </ol>
 */
final class ColorAllocator {

    private final ColorRules rules;

    ColorAllocator(ColorRules rules) {
        this.rules = rules;
    }

    /**
     * @param ranked     pair with the higher-ranked entrant first
     * @param boardIndex zero-based board position, used only for the initial color
     * @return the pair with white first
     */
    EntrantPair allocate(EntrantPair ranked, int boardIndex) {
        Entrant higher = ranked.first();
        Entrant lower = ranked.second();
        return colorForHigher(higher.colors(), lower.colors(), boardIndex) == Color.WHITE
            ? ranked
            : ranked.swapped();
    }

    private Color colorForHigher(ColorProfile higher, ColorProfile lower, int boardIndex) {
        Optional<Color> higherRequired = rules.required(higher);
        if (higherRequired.isPresent()) {
            return higherRequired.get();
        }
        Optional<Color> lowerRequired = rules.required(lower);
        if (lowerRequired.isPresent()) {
            return lowerRequired.get().opposite();
        }

        if (higher.difference() != lower.difference()) {
            return higher.difference() < lower.difference() ? Color.WHITE : Color.BLACK;
        }

        List<Color> h = higher.colors();
        List<Color> l = lower.colors();
        for (int i = h.size() - 1, j = l.size() - 1; i >= 0 && j >= 0; i--, j--) {
            if (h.get(i) != l.get(j)) {
                return h.get(i).opposite();
            }
        }

        Optional<Color> higherPreference = rules.preferred(higher);
        if (higherPreference.isPresent()) {
            return higherPreference.get();
        }
        Optional<Color> lowerPreference = rules.preferred(lower);
        if (lowerPreference.isPresent()) {
            return lowerPreference.get().opposite();
        }
        return boardIndex % 2 == 0 ? Color.WHITE : Color.BLACK;
    }
}
