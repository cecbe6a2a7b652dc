package com.paircraft.engine.pairing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.stream.Collectors;

/**
 * Finds a complete pairing of score brackets, top bracket first, floating unpaired players
 * down into the next bracket.
 *
 * <p>The search is an explicit work-stack of bracket frames. Each frame enumerates its
 * bracket's candidates lazily in Dutch order (see {@link BracketCandidates}); when a lower
 * bracket cannot be completed, the frame above moves on to its next candidate. Floater sets
 * that already led to a dead end are remembered so the same sub-problem is not searched twice.
 * Every step is charged to the {@link SearchBudget}.
 */
final class BracketSearch {

    private static final Logger log = LoggerFactory.getLogger(BracketSearch.class);

    private final BiPredicate<Entrant, Entrant> compatible;
    private final SearchBudget budget;

    BracketSearch(BiPredicate<Entrant, Entrant> compatible, SearchBudget budget) {
        this.compatible = compatible;
        this.budget = budget;
    }

    /**
     * Groups sorted entrants into brackets of equal pairing score.
     */
    static List<List<Entrant>> brackets(List<Entrant> sorted) {
        List<List<Entrant>> brackets = new ArrayList<>();
        List<Entrant> current = new ArrayList<>();
        for (Entrant entrant : sorted) {
            if (!current.isEmpty() && current.get(0).pairingScoreHalves() != entrant.pairingScoreHalves()) {
                brackets.add(current);
                current = new ArrayList<>();
            }
            current.add(entrant);
        }
        if (!current.isEmpty()) {
            brackets.add(current);
        }
        return brackets;
    }

    /**
     * @param sorted an even number of entrants in {@link DutchPairingEngine#ORDER}
     * @return pairs with the higher-ranked entrant first, or empty when no complete pairing
     *         exists or the budget ran out
     */
    Optional<List<EntrantPair>> search(List<Entrant> sorted) {
        if (sorted.isEmpty()) {
            return Optional.of(List.of());
        }
        List<List<Entrant>> brackets = brackets(sorted);
        int last = brackets.size() - 1;
        Set<String> deadEnds = new HashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(0, "0:", new BracketCandidates(brackets.get(0), last > 0, compatible, budget)));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            BracketCandidates.Candidate candidate = frame.candidates.next();
            if (candidate == null) {
                if (budget.isExhausted()) {
                    log.debug("Bracket search stopped after {} steps: budget exhausted", budget.used());
                    return Optional.empty();
                }
                deadEnds.add(frame.key);
                stack.pop();
                continue;
            }
            frame.chosen = candidate;
            if (frame.index == last) {
                List<EntrantPair> pairs = new ArrayList<>();
                Iterator<Frame> bottomUp = stack.descendingIterator();
                while (bottomUp.hasNext()) {
                    pairs.addAll(bottomUp.next().chosen.pairs());
                }
                log.debug("Bracket search found a pairing after {} steps", budget.used());
                return Optional.of(pairs);
            }

            int nextIndex = frame.index + 1;
            String key = nextIndex + ":" + candidate.floaters().stream()
                .map(Entrant::id).sorted().collect(Collectors.joining(","));
            if (deadEnds.contains(key)) {
                continue;
            }
            List<Entrant> members = new ArrayList<>(candidate.floaters());
            members.addAll(brackets.get(nextIndex));
            members.sort(DutchPairingEngine.ORDER);
            stack.push(new Frame(nextIndex, key,
                new BracketCandidates(members, nextIndex < last, compatible, budget)));
        }
        log.debug("Bracket search exhausted every candidate in {} steps", budget.used());
        return Optional.empty();
    }

    private static final class Frame {
        private final int index;
        private final String key;
        private final BracketCandidates candidates;
        private BracketCandidates.Candidate chosen;

        private Frame(int index, String key, BracketCandidates candidates) {
            this.index = index;
            this.key = key;
            this.candidates = candidates;
        }
    }
}
