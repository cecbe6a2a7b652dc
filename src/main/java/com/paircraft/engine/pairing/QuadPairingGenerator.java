package com.paircraft.engine.pairing;

import com.paircraft.engine.acceleration.AccelerationPlan;
import com.paircraft.engine.model.Pairing;
import com.paircraft.engine.model.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Quads: the section is cut into groups of four by rating, each playing its own three-round
 * round robin. A leftover group of three plays with a rotating bye; a group of two meets
 * every round and a lone player gets a bye every round, both reported as undersized groups.
 */
public final class QuadPairingGenerator implements PairingGenerator {

    public static final int QUAD_SIZE = 4;

    private static final Logger log = LoggerFactory.getLogger(QuadPairingGenerator.class);

    /**
     * Groups of player ids in rating order.
     */
    public static List<List<String>> quads(List<Player> rankedPlayers) {
        List<List<String>> quads = new ArrayList<>();
        for (int start = 0; start < rankedPlayers.size(); start += QUAD_SIZE) {
            quads.add(rankedPlayers.subList(start, Math.min(start + QUAD_SIZE, rankedPlayers.size()))
                .stream().map(Player::id).toList());
        }
        return quads;
    }

    @Override
    public SectionPairing generate(SectionInput input) {
        Map<String, Player> players = input.players().stream()
            .collect(Collectors.toMap(Player::id, Function.identity()));
        List<Pairing> pairings = new ArrayList<>();
        List<Deviation> deviations = new ArrayList<>();
        List<List<String>> quads = quads(input.players());
        for (int q = 0; q < quads.size(); q++) {
            List<String> quad = quads.get(q);
            String group = "Quad " + (q + 1);
            List<List<RoundRobinScheduler.Slot>> schedule = RoundRobinScheduler.schedule(quad, false);
            if (schedule.isEmpty()) {
                continue;
            }
            List<RoundRobinScheduler.Slot> slots = schedule.get((input.round() - 1) % schedule.size());
            if (quad.size() < QUAD_SIZE - 1) {
                deviations.add(new Deviation(DeviationKind.UNDERSIZED_GROUP, input.section(), input.round(), quad,
                    group + " has only " + quad.size() + " player(s)"));
            }
            if (input.round() > schedule.size()) {
                for (RoundRobinScheduler.Slot slot : slots) {
                    if (!slot.isBye()) {
                        deviations.add(new Deviation(DeviationKind.REPEAT_PAIRING, input.section(), input.round(),
                            List.of(slot.white(), slot.black()), slot.white() + " and " + slot.black()
                            + " meet again in " + group));
                    }
                }
            }
            pairings.addAll(ScheduledBoards.toPairings(slots, input.round(), input.section(),
                pairings.size() + 1, group, players));
        }
        log.info("Section {} round {}: {} quads, {} boards", input.section(), input.round(), quads.size(),
            pairings.size());
        return new SectionPairing(input.section(), pairings, deviations,
            AccelerationPlan.disabled(input.section(), input.round(), input.players().size()), List.of(),
            SectionPairing.statusOf(deviations));
    }
}
