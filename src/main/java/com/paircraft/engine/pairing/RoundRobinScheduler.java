package com.paircraft.engine.pairing;

import java.util.ArrayList;
import java.util.List;

/**
 * Berger-table round-robin schedule, computed in full up front.
 *
 * <p>With an even field of n, the last seed stays fixed and the others rotate; a round's pairs
 * are those whose seeds sum to the round's offset modulo n-1. Consecutive rounds advance the
 * offset by n/2, which makes most players alternate colors. An odd field gets a dummy seed and
 * whoever meets it has the bye.
 */
public final class RoundRobinScheduler {

    /**
     * One scheduled board; {@code black} is {@code null} for a bye.
     */
    public record Slot(String white, String black) {
        public boolean isBye() {
            return black == null || white == null;
        }
    }

    private RoundRobinScheduler() {
        // Utility class
    }

    /**
     * @param seeds participants in seed order
     * @param doubleRound whether to repeat the cycle with colors reversed
     * @return the rounds in order, each a list of slots with the fixed seed's board first
     */
    public static List<List<Slot>> schedule(List<String> seeds, boolean doubleRound) {
        List<String> players = new ArrayList<>(seeds);
        if (players.size() < 2) {
            List<List<Slot>> single = new ArrayList<>();
            if (players.size() == 1) {
                single.add(List.of(new Slot(players.get(0), null)));
            }
            return single;
        }
        if (players.size() % 2 == 1) {
            players.add(null);
        }
        int n = players.size();
        int cycle = n - 1;
        String fixed = players.get(cycle);
        List<List<Slot>> rounds = new ArrayList<>();
        for (int r = 0; r < cycle; r++) {
            int offset = (int) ((long) r * (n / 2) % cycle);
            List<Slot> slots = new ArrayList<>();
            String againstFixed = players.get(offset);
            slots.add(r % 2 == 0 ? slot(againstFixed, fixed) : slot(fixed, againstFixed));
            for (int i = 1; i < n / 2; i++) {
                String home = players.get((offset + i) % cycle);
                String away = players.get((offset - i + cycle) % cycle);
                slots.add(slot(home, away));
            }
            rounds.add(slots);
        }
        if (doubleRound) {
            List<List<Slot>> second = new ArrayList<>();
            for (List<Slot> round : rounds) {
                second.add(round.stream().map(s -> slot(s.black(), s.white())).toList());
            }
            rounds.addAll(second);
        }
        return rounds;
    }

    /**
     * Keeps the real player in the white slot when the other side is the dummy.
     */
    private static Slot slot(String white, String black) {
        if (white == null) {
            return new Slot(black, null);
        }
        return new Slot(white, black);
    }
}
