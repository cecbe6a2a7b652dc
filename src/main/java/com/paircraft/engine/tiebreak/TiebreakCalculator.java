package com.paircraft.engine.tiebreak;

import com.paircraft.engine.config.TiebreakConfig;
import com.paircraft.engine.config.TiebreakCriterion;
import com.paircraft.engine.error.ValidationException;
import com.paircraft.engine.history.PlayerHistory;
import com.paircraft.engine.history.RoundEntry;
import com.paircraft.engine.history.TournamentHistory;
import com.paircraft.engine.model.Pairing;
import com.paircraft.engine.model.Player;
import com.paircraft.engine.model.Points;
import com.paircraft.engine.model.Round;
import com.paircraft.engine.model.TournamentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes section standings: score first, then the configured criteria in order.
 *
 * <p>Opponent-based criteria use every paired opponent, forfeits included. Rating-based
 * criteria only count games played over the board against rated opponents. Rounds without
 * an opponent are valued by the configured {@link com.paircraft.engine.config.UnplayedRoundPolicy}
 * in the Buchholz family and ignored everywhere else. A round counts once every game of the
 * section in it has a result; a game still pending in the current round contributes nothing.
 */
public final class TiebreakCalculator {

    private static final Logger log = LoggerFactory.getLogger(TiebreakCalculator.class);

    static final int MAX_PERFORMANCE_DELTA = 800;

    private final TournamentState state;
    private final TournamentHistory history;
    private final TiebreakConfig config;
    private final int rounds;
    private final int pairedRounds;
    private final int winHalves;
    private final Map<String, Integer> addedHalves;

    private TiebreakCalculator(TournamentState state, TournamentHistory history, String section,
                               TiebreakConfig config) {
        this.state = state;
        this.history = history;
        this.config = config;
        this.rounds = completedRounds(state, section);
        this.pairedRounds = history.roundsPlayed();
        this.winHalves = state.scoring().winHalves();
        this.addedHalves = addedScores(state);
    }

    /**
     * Ranked standings for one section, withdrawn players included.
     *
     * @throws ValidationException if the section has no players
     */
    public static List<RankedStanding> compute(TournamentState state, TournamentHistory history, String section,
                                               TiebreakConfig config) {
        List<Player> players = history.registry().section(section);
        if (players.isEmpty()) {
            throw new ValidationException("Unknown section " + section + " in tournament " + state.id());
        }
        TiebreakCalculator calculator = new TiebreakCalculator(state, history, section, config);
        List<TieResolver.Row> rows = new ArrayList<>(players.size());
        for (Player player : players) {
            rows.add(new TieResolver.Row(player, history.of(player.id()), calculator.values(player)));
        }
        List<RankedStanding> standings = new TieResolver(config.criteria()).rank(rows);
        log.debug("Computed {} standings for section {} after {} rounds", standings.size(), section, calculator.rounds);
        return standings;
    }

    private Map<TiebreakCriterion, Double> values(Player player) {
        PlayerHistory own = history.of(player.id());
        Map<TiebreakCriterion, Double> values = new EnumMap<>(TiebreakCriterion.class);
        for (TiebreakCriterion criterion : config.criteria()) {
            switch (criterion) {
                case BUCHHOLZ -> values.put(criterion, sum(buchholzValues(own)));
                case MODIFIED_BUCHHOLZ -> values.put(criterion, cut(buchholzValues(own), config.buchholzCut(), 0));
                case MEDIAN_BUCHHOLZ -> values.put(criterion,
                    cut(buchholzValues(own), config.buchholzCut(), config.buchholzCut()));
                case SONNEBORN_BERGER -> values.put(criterion, sonnebornBerger(own));
                case CUMULATIVE -> values.put(criterion, cumulative(own));
                case KOYA -> values.put(criterion, koya(own));
                case AVERAGE_OPPONENT_RATING -> values.put(criterion, (double) Math.round(averageOpponentRating(own)));
                case PERFORMANCE_RATING -> values.put(criterion, (double) performanceRating(own));
                case DIRECT_ENCOUNTER -> {
                    // depends on who else is tied; resolved by TieResolver
                }
            }
        }
        return values;
    }

    /**
     * One value per round: the opponent's score, or the unplayed-round substitute.
     */
    private List<Double> buchholzValues(PlayerHistory own) {
        List<Double> values = new ArrayList<>(pairedRounds);
        for (int round = 1; round <= pairedRounds; round++) {
            RoundEntry entry = own.entry(round).orElse(null);
            if (entry != null && entry.hasOpponent()) {
                values.add(opponentScore(entry.opponentId()));
            } else if (entry != null || round <= rounds) {
                values.add(unplayedValue(own, round, entry == null ? 0 : entry.pointsHalves()));
            }
        }
        return values;
    }

    private double unplayedValue(PlayerHistory own, int round, int gotHalves) {
        return switch (config.unplayedRoundPolicy()) {
            case ZERO -> 0.0;
            case OWN_SCORE -> own.score();
            case VIRTUAL_OPPONENT -> Points.toPoints(own.scoreHalvesAfter(round - 1) + (winHalves - gotHalves))
                + 0.5 * Math.max(0, rounds - round);
        };
    }

    private double opponentScore(String opponentId) {
        int halves = history.of(opponentId).scoreHalves();
        if (config.includeAddedScores()) {
            halves += addedHalves.getOrDefault(opponentId, 0);
        }
        return Points.toPoints(halves);
    }

    private double sonnebornBerger(PlayerHistory own) {
        double total = 0;
        for (RoundEntry entry : own.entries()) {
            if (!entry.hasOpponent()) {
                continue;
            }
            switch (entry.outcome()) {
                case WIN, FORFEIT_WIN -> total += opponentScore(entry.opponentId());
                case DRAW -> total += opponentScore(entry.opponentId()) / 2;
                default -> {
                    // losses add nothing
                }
            }
        }
        return total;
    }

    private double cumulative(PlayerHistory own) {
        int total = 0;
        for (int round = 1; round <= rounds; round++) {
            total += own.scoreHalvesAfter(round);
        }
        return Points.toPoints(total);
    }

    private double koya(PlayerHistory own) {
        int total = 0;
        for (RoundEntry entry : own.entries()) {
            if (entry.hasOpponent() && history.of(entry.opponentId()).scoreHalves() * 2 >= rounds * winHalves) {
                total += entry.pointsHalves();
            }
        }
        return Points.toPoints(total);
    }

    private double averageOpponentRating(PlayerHistory own) {
        return ratedGames(own).stream()
            .mapToInt(entry -> history.registry().get(entry.opponentId()).rating())
            .average()
            .orElse(0);
    }

    /**
     * Average opponent rating plus the logistic rating difference for the scoring percentage,
     * capped at +/-800 for perfect or zero scores.
     */
    private long performanceRating(PlayerHistory own) {
        List<RoundEntry> games = ratedGames(own);
        if (games.isEmpty()) {
            return 0;
        }
        double average = averageOpponentRating(own);
        double percentage = games.stream().mapToInt(RoundEntry::pointsHalves).sum() / (double) (games.size() * winHalves);
        double delta;
        if (percentage >= 1.0) {
            delta = MAX_PERFORMANCE_DELTA;
        } else if (percentage <= 0.0) {
            delta = -MAX_PERFORMANCE_DELTA;
        } else {
            delta = -400 * Math.log10(1 / percentage - 1);
            delta = Math.max(-MAX_PERFORMANCE_DELTA, Math.min(MAX_PERFORMANCE_DELTA, delta));
        }
        return Math.round(average + delta);
    }

    private List<RoundEntry> ratedGames(PlayerHistory own) {
        return own.entries().stream()
            .filter(RoundEntry::isPlayedGame)
            .filter(entry -> history.registry().get(entry.opponentId()).rating() != null)
            .toList();
    }

    /**
     * Leading rounds in which the section has no pending game.
     */
    private static int completedRounds(TournamentState state, String section) {
        int completed = 0;
        for (Round round : state.rounds()) {
            if (round.pairingsInSection(section).stream().anyMatch(Pairing::isPending)) {
                break;
            }
            completed++;
        }
        return completed;
    }

    private static double sum(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).sum();
    }

    /**
     * Sum after discarding the {@code lowest} smallest and {@code highest} largest values.
     */
    static double cut(List<Double> values, int lowest, int highest) {
        if (lowest + highest >= values.size()) {
            return 0;
        }
        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(null);
        return sum(sorted.subList(lowest, sorted.size() - highest));
    }

    private static Map<String, Integer> addedScores(TournamentState state) {
        Map<String, Integer> totals = new HashMap<>();
        for (Round round : state.rounds()) {
            round.addedScores().forEach((id, points) -> totals.merge(id, Points.toHalves(points), Integer::sum));
        }
        return totals;
    }
}
