package com.paircraft.engine.pairing;

import com.paircraft.engine.acceleration.AccelerationPlan;
import com.paircraft.engine.error.InvalidConfigurationException;
import com.paircraft.engine.model.Pairing;
import com.paircraft.engine.model.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * All-play-all pairing. The schedule is fixed by seed order at registration, so it does not
 * depend on results and withdrawn players keep their slots (their games become forfeits).
 */
public final class RoundRobinPairingGenerator implements PairingGenerator {

    private static final Logger log = LoggerFactory.getLogger(RoundRobinPairingGenerator.class);

    @Override
    public SectionPairing generate(SectionInput input) {
        List<String> seeds = input.players().stream().map(Player::id).toList();
        List<List<RoundRobinScheduler.Slot>> schedule =
            RoundRobinScheduler.schedule(seeds, input.config().doubleRoundRobin());
        if (input.round() > schedule.size()) {
            throw new InvalidConfigurationException("Round robin for " + seeds.size() + " players in section "
                + input.section() + " has " + schedule.size() + " rounds; round " + input.round() + " does not exist");
        }
        Map<String, Player> players = input.players().stream()
            .collect(Collectors.toMap(Player::id, Function.identity()));
        List<Pairing> pairings = ScheduledBoards.toPairings(schedule.get(input.round() - 1), input.round(),
            input.section(), 1, null, players);
        log.info("Section {} round {} of {}: {} round-robin boards", input.section(), input.round(),
            schedule.size(), pairings.size());
        return new SectionPairing(input.section(), pairings, List.of(),
            AccelerationPlan.disabled(input.section(), input.round(), seeds.size()), List.of(), PairingStatus.COMPLETE);
    }
}
