package com.paircraft.engine.pairing;

import com.paircraft.engine.model.Color;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.BiPredicate;

/**
 * Dutch-system pairing of one section's entrants for one round.
 *
 * <p>Key design principles:
 * <ul>
 *   <li>Entrants are grouped by pairing score (real score plus any acceleration) and ranked inside a group.</li>
 *   <li>An odd pool first sets aside the lowest eligible entrant for the pairing-allocated bye; if the rest
 *       cannot be paired legally the next candidate is tried.</li>
 *   <li>The strict search forbids repeat opponents and clashing absolute colors. If it fails, colors are
 *       relaxed, then repeats; every relaxation surfaces as a {@link Deviation}.</li>
 *   <li>Colors are allocated only after the pairs are final, board by board.</li>
 * </ul>
 * Round 1 needs no special case: with a single score group of unplayed entrants the first
 * candidate is the straight top-half against bottom-half pairing.
 */
final class DutchPairingEngine {

    private static final Logger log = LoggerFactory.getLogger(DutchPairingEngine.class);

    /** Pairing score descending, then initial rank. */
    static final Comparator<Entrant> ORDER = Comparator
        .comparingInt(Entrant::pairingScoreHalves).reversed()
        .thenComparingInt(Entrant::rank);

    /** Board order: higher score of the pair, then the pair's total, then the better rank. */
    private static final Comparator<EntrantPair> BOARD_ORDER = Comparator
        .comparingInt((EntrantPair p) -> Math.max(p.first().scoreHalves(), p.second().scoreHalves())).reversed()
        .thenComparing(Comparator.comparingInt((EntrantPair p) -> p.first().scoreHalves() + p.second().scoreHalves()).reversed())
        .thenComparingInt(p -> Math.min(p.first().rank(), p.second().rank()));

    /**
     * @param section          section label used in deviations
     * @param finalRound       whether this is the last planned round
     * @param topScoreHalves   entrants scoring above this may break color limits in the final round
     */
    record Context(String section, int round, boolean finalRound, int topScoreHalves) {}

    /**
     * @param pairs      pairs in board order, white first
     * @param bye        entrant receiving the pairing-allocated bye, or {@code null}
     */
    record Result(List<EntrantPair> pairs, Entrant bye, List<Deviation> deviations, boolean bestEffort) {}

    private final ColorRules rules;
    private final ColorAllocator colorAllocator;

    DutchPairingEngine(ColorRules rules) {
        this.rules = rules;
        this.colorAllocator = new ColorAllocator(rules);
    }

    Result pair(List<Entrant> pool, Context context, SearchBudget budget) {
        List<Entrant> sorted = new ArrayList<>(pool);
        sorted.sort(ORDER);
        List<Deviation> deviations = new ArrayList<>();
        BiPredicate<Entrant, Entrant> strict = strictCompatibility(context);

        Entrant bye = null;
        List<EntrantPair> ranked = null;
        List<Entrant> toPair = sorted;
        boolean bestEffort = false;

        if (sorted.size() % 2 == 1) {
            List<Entrant> candidates = byeCandidates(sorted);
            if (candidates.stream().noneMatch(Entrant::byeEligible)) {
                deviations.add(new Deviation(DeviationKind.REPEAT_BYE, context.section(), context.round(),
                    List.of(candidates.get(0).id()),
                    "Every entrant already had an unplayed win; " + candidates.get(0).id() + " receives another bye"));
            }
            for (Entrant candidate : candidates) {
                List<Entrant> rest = without(sorted, candidate);
                Optional<List<EntrantPair>> found = new BracketSearch(strict, budget).search(rest);
                if (found.isPresent()) {
                    bye = candidate;
                    toPair = rest;
                    ranked = found.get();
                    break;
                }
                if (budget.isExhausted()) {
                    break;
                }
            }
            if (bye == null) {
                bye = candidates.get(0);
                toPair = without(sorted, bye);
            }
        } else {
            ranked = new BracketSearch(strict, budget).search(sorted).orElse(null);
        }

        if (ranked == null) {
            bestEffort = true;
            ranked = bestEffort(toPair, context, strict, budget, deviations);
        }

        int seated = ranked.size() * 2 + (bye == null ? 0 : 1);
        if (seated != sorted.size()) {
            throw new IllegalStateException("Paired " + seated + " of " + sorted.size()
                + " entrants in section " + context.section() + ". Algorithm bug.");
        }

        List<EntrantPair> boards = new ArrayList<>(ranked);
        boards.sort(BOARD_ORDER);
        List<EntrantPair> colored = new ArrayList<>(boards.size());
        for (int board = 0; board < boards.size(); board++) {
            EntrantPair pair = colorAllocator.allocate(boards.get(board), board);
            colored.add(pair);
            reportColorViolations(pair, context, deviations);
        }
        if (!deviations.isEmpty()) {
            bestEffort = true;
        }
        log.debug("Section {} round {}: {} pairs, bye {}, {} search steps", context.section(), context.round(),
            colored.size(), bye == null ? "none" : bye.id(), budget.used());
        return new Result(colored, bye, deviations, bestEffort);
    }

    private BiPredicate<Entrant, Entrant> strictCompatibility(Context context) {
        return (a, b) -> !a.hasPlayed(b)
            && (rules.compatible(a, b) || (context.finalRound()
                && (a.scoreHalves() > context.topScoreHalves() || b.scoreHalves() > context.topScoreHalves())));
    }

    /**
     * Eligible entrants from the bottom up; everyone from the bottom up if nobody is eligible.
     */
    private static List<Entrant> byeCandidates(List<Entrant> sorted) {
        List<Entrant> eligible = new ArrayList<>();
        for (int i = sorted.size() - 1; i >= 0; i--) {
            if (sorted.get(i).byeEligible()) {
                eligible.add(sorted.get(i));
            }
        }
        if (!eligible.isEmpty()) {
            return eligible;
        }
        List<Entrant> everyone = new ArrayList<>(sorted);
        Collections.reverse(everyone);
        return everyone;
    }

    private List<EntrantPair> bestEffort(List<Entrant> toPair, Context context,
                                         BiPredicate<Entrant, Entrant> strict, SearchBudget budget,
                                         List<Deviation> deviations) {
        if (budget.isExhausted()) {
            log.warn("Section {} round {}: pairing search budget exhausted after {} steps, using best effort",
                context.section(), context.round(), budget.used());
            deviations.add(new Deviation(DeviationKind.SEARCH_BUDGET_EXHAUSTED, context.section(), context.round(),
                List.of(), "Search budget exhausted after " + budget.used() + " steps"));
        } else {
            log.warn("Section {} round {}: no pairing satisfies every rule, relaxing color constraints",
                context.section(), context.round());
        }

        BiPredicate<Entrant, Entrant> noRepeat = (a, b) -> !a.hasPlayed(b);
        Optional<List<EntrantPair>> relaxed = new BracketSearch(noRepeat, budget.renewed()).search(toPair);
        if (relaxed.isPresent()) {
            return relaxed.get();
        }

        List<Entrant> remaining = new ArrayList<>(toPair);
        List<EntrantPair> pairs = new ArrayList<>();
        while (!remaining.isEmpty()) {
            Entrant a = remaining.remove(0);
            int index = firstMatch(a, remaining, strict);
            if (index < 0) {
                index = firstMatch(a, remaining, noRepeat);
            }
            if (index < 0) {
                index = 0;
                Entrant b = remaining.get(0);
                deviations.add(new Deviation(DeviationKind.REPEAT_PAIRING, context.section(), context.round(),
                    List.of(a.id(), b.id()), a.id() + " and " + b.id() + " meet again: no unplayed opponent left"));
            }
            pairs.add(new EntrantPair(a, remaining.remove(index)));
        }
        return pairs;
    }

    private static int firstMatch(Entrant a, List<Entrant> candidates, BiPredicate<Entrant, Entrant> compatible) {
        for (int i = 0; i < candidates.size(); i++) {
            if (compatible.test(a, candidates.get(i))) {
                return i;
            }
        }
        return -1;
    }

    private void reportColorViolations(EntrantPair pair, Context context, List<Deviation> deviations) {
        for (DeviationKind kind : rules.violations(pair.first().colors(), Color.WHITE)) {
            deviations.add(colorDeviation(kind, pair.first(), "white", context));
        }
        for (DeviationKind kind : rules.violations(pair.second().colors(), Color.BLACK)) {
            deviations.add(colorDeviation(kind, pair.second(), "black", context));
        }
    }

    private static Deviation colorDeviation(DeviationKind kind, Entrant entrant, String color, Context context) {
        return new Deviation(kind, context.section(), context.round(), List.of(entrant.id()),
            entrant.id() + " receives " + color + " beyond the configured color limit");
    }

    private static List<Entrant> without(List<Entrant> entrants, Entrant excluded) {
        List<Entrant> rest = new ArrayList<>(entrants);
        rest.remove(excluded);
        return rest;
    }
}
