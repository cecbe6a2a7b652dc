package com.paircraft.engine.pairing;

import com.paircraft.engine.acceleration.AccelerationModule;
import com.paircraft.engine.acceleration.AccelerationPlan;
import com.paircraft.engine.history.PlayerHistory;
import com.paircraft.engine.model.ByeType;
import com.paircraft.engine.model.Pairing;
import com.paircraft.engine.model.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Individual Swiss pairing with the Dutch system.
 *
 * <p>Withdrawn players are skipped and requested byes are set aside before the pool is paired.
 * Games come first in board order, then the pairing-allocated bye, then requested byes.
 */
public final class SwissPairingGenerator implements PairingGenerator {

    private static final Logger log = LoggerFactory.getLogger(SwissPairingGenerator.class);

    @Override
    public SectionPairing generate(SectionInput input) {
        String section = input.section();
        int round = input.round();
        int winHalves = input.state().scoring().winHalves();

        List<Player> pool = new ArrayList<>();
        List<Player> requestedByes = new ArrayList<>();
        for (Player player : input.players()) {
            if (!player.isActive()) {
                continue;
            }
            if (player.requestedByeFor(round).isPresent()) {
                requestedByes.add(player);
            } else {
                pool.add(player);
            }
        }

        AccelerationPlan plan = AccelerationModule.plan(section, pool, round, input.config());
        List<Entrant> entrants = new ArrayList<>(pool.size());
        for (int rank = 0; rank < pool.size(); rank++) {
            Player player = pool.get(rank);
            PlayerHistory history = input.history().of(player.id());
            boolean byeEligible = history.byeCount(ByeType.PAIRING_ALLOCATED) == 0 && !history.hasUnplayedWin(winHalves);
            entrants.add(new Entrant(player.id(), history.scoreHalves(),
                history.scoreHalves() + plan.virtualHalvesFor(player.id()), rank,
                history.playedOpponents(), history.colorProfile(), byeEligible));
        }

        DutchPairingEngine.Context context = new DutchPairingEngine.Context(section, round, input.isFinalRound(),
            input.history().roundsPlayed() * winHalves / 2);
        DutchPairingEngine.Result result = new DutchPairingEngine(ColorRules.from(input.config()))
            .pair(entrants, context, input.budget());

        List<Pairing> pairings = new ArrayList<>();
        int board = 1;
        for (EntrantPair pair : result.pairs()) {
            pairings.add(Pairing.game(round, section, board++, pair.first().id(), pair.second().id()));
        }
        if (result.bye() != null) {
            pairings.add(Pairing.bye(round, section, board++, result.bye().id(), ByeType.PAIRING_ALLOCATED));
        }
        for (Player player : requestedByes) {
            Optional<ByeType> byeType = player.requestedByeFor(round);
            pairings.add(Pairing.bye(round, section, board++, player.id(), byeType.orElseThrow()));
        }

        log.info("Section {} round {}: {} games, {} byes, {} deviations", section, round, result.pairs().size(),
            pairings.size() - result.pairs().size(), result.deviations().size());
        return new SectionPairing(section, pairings, result.deviations(), plan, List.of(),
            SectionPairing.statusOf(result.deviations()));
    }
}
