package com.paircraft.engine.pairing;

import com.paircraft.engine.model.ByeType;
import com.paircraft.engine.model.GameResult;
import com.paircraft.engine.model.Pairing;
import com.paircraft.engine.model.Player;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns fixed-schedule slots into pairings. Games come first, byes last. A withdrawn player's
 * scheduled game is emitted already decided as a forfeit.
 */
final class ScheduledBoards {

    private ScheduledBoards() {
        // Utility class
    }

    static List<Pairing> toPairings(List<RoundRobinScheduler.Slot> slots, int round, String section,
                                    int firstBoard, String group, Map<String, Player> players) {
        List<Pairing> games = new ArrayList<>();
        List<RoundRobinScheduler.Slot> byes = new ArrayList<>();
        int board = firstBoard;
        for (RoundRobinScheduler.Slot slot : slots) {
            if (slot.isBye()) {
                byes.add(slot);
                continue;
            }
            Pairing game = Pairing.game(round, section, board++, slot.white(), slot.black(), group);
            boolean whiteGone = !players.get(slot.white()).isActive();
            boolean blackGone = !players.get(slot.black()).isActive();
            if (whiteGone && blackGone) {
                game = game.withResult(GameResult.DOUBLE_FORFEIT);
            } else if (whiteGone) {
                game = game.withResult(GameResult.BLACK_FORFEIT_WIN);
            } else if (blackGone) {
                game = game.withResult(GameResult.WHITE_FORFEIT_WIN);
            }
            games.add(game);
        }
        for (RoundRobinScheduler.Slot slot : byes) {
            if (players.get(slot.white()).isActive()) {
                games.add(Pairing.bye(round, section, board++, slot.white(), ByeType.PAIRING_ALLOCATED, group));
            }
        }
        return games;
    }
}
