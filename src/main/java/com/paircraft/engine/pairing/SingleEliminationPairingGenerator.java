package com.paircraft.engine.pairing;

import com.paircraft.engine.acceleration.AccelerationPlan;
import com.paircraft.engine.error.ValidationException;
import com.paircraft.engine.model.ByeType;
import com.paircraft.engine.model.Pairing;
import com.paircraft.engine.model.Player;
import com.paircraft.engine.model.Round;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Knockout bracket. Round 1 places seeds in the standard order (1 v N, then the halves
 * mirrored) so the top seeds can only meet late; empty bracket slots become byes in place.
 * Later rounds pair the winners of adjacent bracket slots; a slot emptied by a double
 * forfeit stays in place, so its neighbour advances with a bye.
 *
 * <p>A drawn game advances the higher seed and is reported; a double forfeit eliminates both
 * players. The section is finished once at most one player remains.
 */
public final class SingleEliminationPairingGenerator implements PairingGenerator {

    private static final Logger log = LoggerFactory.getLogger(SingleEliminationPairingGenerator.class);

    /**
     * Seed numbers (1-based) in bracket position order for a bracket of {@code size} slots.
     */
    public static List<Integer> bracketOrder(int size) {
        List<Integer> order = List.of(1);
        while (order.size() < size) {
            int mirror = order.size() * 2 + 1;
            order = order.stream().flatMap(seed -> Stream.of(seed, mirror - seed)).toList();
        }
        return order;
    }

    @Override
    public SectionPairing generate(SectionInput input) {
        Map<String, Integer> seeds = new HashMap<>();
        for (int i = 0; i < input.players().size(); i++) {
            seeds.put(input.players().get(i).id(), i);
        }
        Map<String, Player> players = new HashMap<>();
        input.players().forEach(p -> players.put(p.id(), p));

        List<Deviation> deviations = new ArrayList<>();
        List<String> slots = input.round() == 1
            ? initialSlots(input.players())
            : survivors(input, seeds, deviations);

        List<String> present = slots.stream().filter(id -> id != null && players.get(id).isActive()).toList();
        AccelerationPlan plan = AccelerationPlan.disabled(input.section(), input.round(), input.players().size());
        if (present.size() <= 1) {
            log.info("Section {} finished before round {}: champion {}", input.section(), input.round(),
                present.isEmpty() ? "none" : present.get(0));
            return new SectionPairing(input.section(), List.of(), deviations, plan, List.of(), PairingStatus.FINISHED);
        }

        List<Pairing> pairings = new ArrayList<>();
        int board = 1;
        for (int i = 0; i + 1 < slots.size(); i += 2) {
            String a = activeOrNull(slots.get(i), players);
            String b = activeOrNull(slots.get(i + 1), players);
            if (a == null && b == null) {
                continue;
            }
            if (a == null || b == null) {
                String advancing = a != null ? a : b;
                pairings.add(Pairing.bye(input.round(), input.section(), board++, advancing, ByeType.PAIRING_ALLOCATED));
                continue;
            }
            boolean aHigher = seeds.get(a) < seeds.get(b);
            pairings.add(Pairing.game(input.round(), input.section(), board++, aHigher ? a : b, aHigher ? b : a));
        }
        log.info("Section {} round {}: {} players left, {} boards", input.section(), input.round(),
            present.size(), pairings.size());
        PairingStatus status = deviations.isEmpty() ? PairingStatus.COMPLETE : PairingStatus.BEST_EFFORT;
        return new SectionPairing(input.section(), pairings, deviations, plan, List.of(), status);
    }

    private static List<String> initialSlots(List<Player> ranked) {
        List<Player> active = ranked.stream().filter(Player::isActive).toList();
        int size = 1;
        while (size < active.size()) {
            size *= 2;
        }
        List<String> slots = new ArrayList<>(size);
        for (int seed : bracketOrder(size)) {
            slots.add(seed <= active.size() ? active.get(seed - 1).id() : null);
        }
        return slots;
    }

    /**
     * Bracket slots for the round being paired. Round 1 boards fix the bracket order; every
     * later round halves it, so a pair of slots that both emptied stays an empty slot.
     */
    private static List<String> survivors(SectionInput input, Map<String, Integer> seeds, List<Deviation> deviations) {
        List<String> slots = null;
        for (int number = 1; number < input.round(); number++) {
            int roundNumber = number;
            Round round = input.state().round(number)
                .orElseThrow(() -> new ValidationException("Round " + roundNumber
                    + " must exist before round " + input.round() + " of a knockout can be paired"));
            List<Deviation> reported = number == input.round() - 1 ? deviations : new ArrayList<>();
            slots = slots == null
                ? firstRoundWinners(round, seeds, input, reported)
                : advance(slots, round, seeds, input, reported);
        }
        return slots;
    }

    private static List<String> firstRoundWinners(Round round, Map<String, Integer> seeds, SectionInput input,
                                                  List<Deviation> deviations) {
        List<Pairing> boards = new ArrayList<>(round.pairingsInSection(input.section()));
        boards.sort(Comparator.comparingInt(Pairing::board));
        List<String> winners = new ArrayList<>(boards.size());
        for (Pairing pairing : boards) {
            winners.add(winner(pairing, seeds, input, deviations));
        }
        return winners;
    }

    private static List<String> advance(List<String> slots, Round round, Map<String, Integer> seeds,
                                        SectionInput input, List<Deviation> deviations) {
        Map<String, Pairing> byPlayer = new HashMap<>();
        for (Pairing pairing : round.pairingsInSection(input.section())) {
            byPlayer.put(pairing.whiteId(), pairing);
            if (pairing.blackId() != null) {
                byPlayer.put(pairing.blackId(), pairing);
            }
        }
        List<String> next = new ArrayList<>(slots.size() / 2);
        for (int i = 0; i + 1 < slots.size(); i += 2) {
            Pairing pairing = slots.get(i) != null ? byPlayer.get(slots.get(i)) : null;
            if (pairing == null && slots.get(i + 1) != null) {
                pairing = byPlayer.get(slots.get(i + 1));
            }
            next.add(pairing == null ? null : winner(pairing, seeds, input, deviations));
        }
        return next;
    }

    private static String winner(Pairing pairing, Map<String, Integer> seeds, SectionInput input,
                                 List<Deviation> deviations) {
        return switch (pairing.result()) {
            case WHITE_WIN, WHITE_FORFEIT_WIN -> pairing.whiteId();
            case BLACK_WIN, BLACK_FORFEIT_WIN -> pairing.blackId();
            case BYE -> pairing.byePlayerId();
            case DOUBLE_FORFEIT -> null;
            case DRAW -> {
                String higher = seeds.get(pairing.whiteId()) < seeds.get(pairing.blackId())
                    ? pairing.whiteId() : pairing.blackId();
                deviations.add(new Deviation(DeviationKind.DRAW_ADVANCED_BY_SEED, input.section(), input.round(),
                    List.of(pairing.whiteId(), pairing.blackId()),
                    "Drawn game " + pairing.id() + " decided by seed: " + higher + " advances"));
                yield higher;
            }
            case PENDING -> throw new ValidationException("Pairing " + pairing.id()
                + " has no result; a knockout round can only be paired once the previous one is complete");
        };
    }

    private static String activeOrNull(String id, Map<String, Player> players) {
        return id != null && players.get(id).isActive() ? id : null;
    }
}
