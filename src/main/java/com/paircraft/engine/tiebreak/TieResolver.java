package com.paircraft.engine.tiebreak;

import com.paircraft.engine.config.TiebreakCriterion;
import com.paircraft.engine.history.PlayerHistory;
import com.paircraft.engine.history.RoundEntry;
import com.paircraft.engine.model.Player;
import com.paircraft.engine.model.Points;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Orders players by score and then criterion by criterion, only ever comparing players still
 * tied on everything before. Players left tied after the last criterion share a rank; they are
 * listed by rating, then id, but that order carries no meaning.
 */
final class TieResolver {

    record Row(Player player, PlayerHistory history, Map<TiebreakCriterion, Double> values) {}

    private final List<TiebreakCriterion> criteria;
    private final Map<String, Double> directEncounter = new HashMap<>();
    private final List<RankedStanding> standings = new ArrayList<>();

    TieResolver(List<TiebreakCriterion> criteria) {
        this.criteria = criteria;
    }

    /**
     * @param rows players in display order (rating, then id)
     */
    List<RankedStanding> rank(List<Row> rows) {
        List<Row> byScore = new ArrayList<>(rows);
        byScore.sort(Comparator.comparingInt((Row row) -> row.history().scoreHalves()).reversed());

        int i = 0;
        while (i < byScore.size()) {
            int score = byScore.get(i).history().scoreHalves();
            List<Row> tied = new ArrayList<>();
            while (i < byScore.size() && byScore.get(i).history().scoreHalves() == score) {
                tied.add(byScore.get(i));
                i++;
            }
            resolve(tied, 0);
        }
        return standings;
    }

    private void resolve(List<Row> group, int criterionIndex) {
        if (group.size() == 1 || criterionIndex == criteria.size()) {
            emit(group);
            return;
        }
        TiebreakCriterion criterion = criteria.get(criterionIndex);
        Map<String, Double> values = new HashMap<>();
        if (criterion == TiebreakCriterion.DIRECT_ENCOUNTER) {
            Map<String, Double> encounter = headToHead(group);
            if (encounter == null) {
                resolve(group, criterionIndex + 1);
                return;
            }
            directEncounter.putAll(encounter);
            values.putAll(encounter);
        } else {
            group.forEach(row -> values.put(row.player().id(), row.values().get(criterion)));
        }

        List<Row> sorted = new ArrayList<>(group);
        sorted.sort(Comparator.comparingDouble((Row row) -> values.get(row.player().id())).reversed());
        int i = 0;
        while (i < sorted.size()) {
            double value = values.get(sorted.get(i).player().id());
            List<Row> tied = new ArrayList<>();
            while (i < sorted.size() && Double.compare(values.get(sorted.get(i).player().id()), value) == 0) {
                tied.add(sorted.get(i));
                i++;
            }
            resolve(tied, criterionIndex + 1);
        }
    }

    /**
     * Points each tied player scored against the others over the board, or {@code null} when
     * some pair of them never played each other. Forfeited games do not count as meetings.
     */
    private Map<String, Double> headToHead(List<Row> group) {
        Set<String> ids = group.stream().map(row -> row.player().id()).collect(Collectors.toSet());
        Map<String, Double> points = new HashMap<>();
        for (Row row : group) {
            Set<String> met = row.history().entries().stream()
                .filter(RoundEntry::isPlayedGame)
                .map(RoundEntry::opponentId)
                .collect(Collectors.toSet());
            for (String other : ids) {
                if (!other.equals(row.player().id()) && !met.contains(other)) {
                    return null;
                }
            }
            int halves = row.history().entries().stream()
                .filter(entry -> entry.isPlayedGame() && ids.contains(entry.opponentId()))
                .mapToInt(RoundEntry::pointsHalves)
                .sum();
            points.put(row.player().id(), Points.toPoints(halves));
        }
        return points;
    }

    private void emit(List<Row> group) {
        int rank = standings.size() + 1;
        boolean shared = group.size() > 1;
        for (Row row : group) {
            standings.add(standing(row, rank, shared));
        }
    }

    private RankedStanding standing(Row row, int rank, boolean shared) {
        Player player = row.player();
        PlayerHistory own = row.history();
        Map<String, Double> tiebreaks = new LinkedHashMap<>();
        for (TiebreakCriterion criterion : criteria) {
            tiebreaks.put(criterion.key(), criterion == TiebreakCriterion.DIRECT_ENCOUNTER
                ? directEncounter.get(player.id())
                : row.values().get(criterion));
        }
        return new RankedStanding(rank, shared, player.id(), player.name(), player.rating(), player.section(),
            player.status(), own.score(), (int) own.gamesPlayed(),
            (int) (own.count(RoundEntry.Outcome.WIN) + own.count(RoundEntry.Outcome.FORFEIT_WIN)),
            (int) own.count(RoundEntry.Outcome.DRAW),
            (int) (own.count(RoundEntry.Outcome.LOSS) + own.count(RoundEntry.Outcome.FORFEIT_LOSS)),
            (int) own.byeCount(), tiebreaks);
    }
}
