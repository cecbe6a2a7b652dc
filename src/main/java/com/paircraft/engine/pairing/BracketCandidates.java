package com.paircraft.engine.pairing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.function.BiPredicate;

/**
 * Lazily enumerates the ways one score bracket can be paired, in Dutch preference order:
 * <ol>
 *   <li>as many pairs as possible before fewer (each missing pair floats two players down)</li>
 *   <li>the natural S1/S2 split before exchanges between S1 and S2, smallest exchanges first</li>
 *   <li>for a given split, S1[i] against S2[i] first, then transpositions of S2 in lexicographic order</li>
 * </ol>
 * The transposition walk is an iterative depth-first search that skips incompatible opponents,
 * so rejected pairs prune whole families of permutations.
 */
final class BracketCandidates {

    /** Exchange levels with more combinations than this are skipped. */
    static final int MAX_EXCHANGES_PER_LEVEL = 50_000;

    record Candidate(List<EntrantPair> pairs, List<Entrant> floaters) {}

    private final List<Entrant> members;
    private final BiPredicate<Entrant, Entrant> compatible;
    private final SearchBudget budget;
    private final int minPairs;

    private int pairsTarget;
    private ExchangeSequence selections;
    private boolean selectionActive;

    private int[] s1;
    private int[] s2;
    private int[] choice;
    private boolean[] used;
    private int depth;
    private boolean emptySelectionDone;

    BracketCandidates(List<Entrant> members, boolean allowFloaters,
                      BiPredicate<Entrant, Entrant> compatible, SearchBudget budget) {
        this.members = members;
        this.compatible = compatible;
        this.budget = budget;
        int n = members.size();
        int maxPairs = n / 2;
        if (allowFloaters) {
            this.minPairs = 0;
        } else {
            // the bottom bracket has nowhere to float to
            this.minPairs = n % 2 == 0 ? maxPairs : maxPairs + 1;
        }
        this.pairsTarget = maxPairs + 1;
    }

    /**
     * @return the next candidate, or {@code null} when exhausted or out of budget
     */
    Candidate next() {
        while (true) {
            if (!selectionActive && !advanceSelection()) {
                return null;
            }
            Candidate candidate = nextMatching();
            if (candidate != null) {
                return candidate;
            }
            selectionActive = false;
            if (budget.isExhausted()) {
                return null;
            }
        }
    }

    private boolean advanceSelection() {
        while (true) {
            if (selections != null && selections.hasNext()) {
                startSelection(selections.next());
                if (hasOpponentForEveryS1()) {
                    return true;
                }
                selectionActive = false;
                if (!budget.tick()) {
                    return false;
                }
                continue;
            }
            pairsTarget--;
            if (pairsTarget < minPairs) {
                return false;
            }
            selections = new ExchangeSequence(members.size(), pairsTarget, budget);
        }
    }

    private void startSelection(int[] selection) {
        s1 = selection;
        boolean[] inS1 = new boolean[members.size()];
        for (int index : s1) {
            inS1[index] = true;
        }
        s2 = new int[members.size() - s1.length];
        for (int i = 0, k = 0; i < members.size(); i++) {
            if (!inS1[i]) {
                s2[k++] = i;
            }
        }
        choice = new int[s1.length];
        Arrays.fill(choice, -1);
        used = new boolean[s2.length];
        depth = 0;
        emptySelectionDone = false;
        selectionActive = true;
    }

    private boolean hasOpponentForEveryS1() {
        for (int a : s1) {
            boolean found = false;
            for (int b : s2) {
                if (compatible.test(members.get(a), members.get(b))) {
                    found = true;
                    break;
                }
            }
            if (!found) {
                return false;
            }
        }
        return true;
    }

    private Candidate nextMatching() {
        if (s1.length == 0) {
            if (emptySelectionDone) {
                return null;
            }
            emptySelectionDone = true;
            return buildCandidate();
        }
        while (true) {
            if (!budget.tick() || depth < 0) {
                return null;
            }
            int previous = choice[depth];
            if (previous >= 0) {
                used[previous] = false;
            }
            Entrant player = members.get(s1[depth]);
            int j = previous + 1;
            while (j < s2.length && (used[j] || !compatible.test(player, members.get(s2[j])))) {
                j++;
            }
            if (j >= s2.length) {
                choice[depth] = -1;
                depth--;
                continue;
            }
            choice[depth] = j;
            used[j] = true;
            if (depth == s1.length - 1) {
                return buildCandidate();
            }
            depth++;
            choice[depth] = -1;
        }
    }

    private Candidate buildCandidate() {
        List<EntrantPair> pairs = new ArrayList<>(s1.length);
        for (int i = 0; i < s1.length; i++) {
            Entrant a = members.get(s1[i]);
            Entrant b = members.get(s2[choice[i]]);
            pairs.add(DutchPairingEngine.ORDER.compare(a, b) <= 0 ? new EntrantPair(a, b) : new EntrantPair(b, a));
        }
        List<Entrant> floaters = new ArrayList<>();
        for (int j = 0; j < s2.length; j++) {
            if (!used[j]) {
                floaters.add(members.get(s2[j]));
            }
        }
        return new Candidate(pairs, floaters);
    }

    /**
     * S1 index sets for a fixed number of pairs: the natural top half first, then exchanges of
     * k players between S1 and S2 for k = 1, 2, ... Within a level, exchanges that move the
     * smallest rank distance come first, preferring to give up the lowest S1 players and take
     * the highest S2 players.
     */
    static final class ExchangeSequence {
        private final int n;
        private final int pairs;
        private final SearchBudget budget;
        private int level = -1;
        private List<int[]> current = List.of();
        private int position;

        ExchangeSequence(int n, int pairs, SearchBudget budget) {
            this.n = n;
            this.pairs = pairs;
            this.budget = budget;
        }

        boolean hasNext() {
            while (position >= current.size()) {
                level++;
                if (level > Math.min(pairs, n - pairs) || budget.isExhausted()) {
                    return false;
                }
                current = level == 0 ? List.of(natural()) : exchanges(level);
                position = 0;
            }
            return true;
        }

        int[] next() {
            return current.get(position++);
        }

        private int[] natural() {
            int[] selection = new int[pairs];
            for (int i = 0; i < pairs; i++) {
                selection[i] = i;
            }
            return selection;
        }

        private List<int[]> exchanges(int k) {
            int s2Size = n - pairs;
            if ((double) binomial(pairs, k) * binomial(s2Size, k) > MAX_EXCHANGES_PER_LEVEL) {
                return List.of();
            }
            List<int[]> outSets = combinations(0, pairs, k);
            List<int[]> inSets = combinations(pairs, n, k);
            List<int[][]> swaps = new ArrayList<>(outSets.size() * inSets.size());
            for (int[] out : outSets) {
                for (int[] in : inSets) {
                    if (!budget.tick()) {
                        return List.of();
                    }
                    swaps.add(new int[][] {out, in});
                }
            }
            swaps.sort(Comparator
                .<int[][]>comparingInt(s -> sum(s[1]) - sum(s[0]))
                .thenComparing((x, y) -> compareDescending(y[0], x[0]))
                .thenComparing((x, y) -> Arrays.compare(x[1], y[1])));

            List<int[]> selections = new ArrayList<>(swaps.size());
            for (int[][] swap : swaps) {
                selections.add(apply(swap[0], swap[1]));
            }
            return selections;
        }

        private int[] apply(int[] out, int[] in) {
            int[] selection = new int[pairs];
            int k = 0;
            for (int i = 0; i < pairs; i++) {
                if (Arrays.binarySearch(out, i) < 0) {
                    selection[k++] = i;
                }
            }
            for (int index : in) {
                selection[k++] = index;
            }
            Arrays.sort(selection);
            return selection;
        }

        private static int compareDescending(int[] a, int[] b) {
            for (int i = a.length - 1; i >= 0; i--) {
                if (a[i] != b[i]) {
                    return Integer.compare(a[i], b[i]);
                }
            }
            return 0;
        }

        private static int sum(int[] values) {
            int total = 0;
            for (int value : values) {
                total += value;
            }
            return total;
        }

        static double binomial(int n, int k) {
            double result = 1;
            for (int i = 1; i <= k; i++) {
                result = result * (n - k + i) / i;
            }
            return result;
        }

        /**
         * All k-subsets of [from, to) in lexicographic order.
         */
        static List<int[]> combinations(int from, int to, int k) {
            List<int[]> result = new ArrayList<>();
            int size = to - from;
            if (k > size) {
                return result;
            }
            int[] indices = new int[k];
            for (int i = 0; i < k; i++) {
                indices[i] = i;
            }
            while (true) {
                int[] combination = new int[k];
                for (int i = 0; i < k; i++) {
                    combination[i] = from + indices[i];
                }
                result.add(combination);
                int i = k - 1;
                while (i >= 0 && indices[i] == size - k + i) {
                    i--;
                }
                if (i < 0) {
                    return result;
                }
                indices[i]++;
                for (int j = i + 1; j < k; j++) {
                    indices[j] = indices[j - 1] + 1;
                }
            }
        }
    }
}
