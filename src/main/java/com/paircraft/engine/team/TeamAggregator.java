package com.paircraft.engine.team;

import com.paircraft.engine.config.TeamTiebreak;
import com.paircraft.engine.config.TiebreakConfig;
import com.paircraft.engine.history.PlayerRegistry;
import com.paircraft.engine.history.RoundEntry;
import com.paircraft.engine.history.TournamentHistory;
import com.paircraft.engine.model.Color;
import com.paircraft.engine.model.Pairing;
import com.paircraft.engine.model.Round;
import com.paircraft.engine.model.Team;
import com.paircraft.engine.model.TournamentState;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rolls individual board results up into team matches and team standings.
 *
 * <p>A team match is the set of boards sharing a pairing group label; the team of board 1's
 * white player is the side that had white on board 1. Matches with pending boards are ignored.
 */
public final class TeamAggregator {

    public static final int MATCH_WIN = 2;
    public static final int MATCH_DRAW = 1;

    private TeamAggregator() {
        // Utility class
    }

    /**
     * Finished team matches per team id, in round order.
     */
    public static Map<String, List<TeamMatchRecord>> matchRecords(TournamentState state, TournamentHistory history) {
        PlayerRegistry registry = history.registry();
        Map<String, List<TeamMatchRecord>> records = new LinkedHashMap<>();
        for (Team team : registry.teams()) {
            records.put(team.id(), new ArrayList<>());
        }

        for (Round round : state.rounds()) {
            Map<String, List<Pairing>> matches = new LinkedHashMap<>();
            for (Pairing pairing : round.pairings()) {
                String anyPlayer = pairing.whiteId() != null ? pairing.whiteId() : pairing.blackId();
                if (pairing.group() != null && registry.teamOf(anyPlayer).isPresent()) {
                    matches.computeIfAbsent(pairing.group(), g -> new ArrayList<>()).add(pairing);
                }
            }
            for (List<Pairing> boards : matches.values()) {
                if (boards.stream().anyMatch(Pairing::isPending)) {
                    continue;
                }
                boards.sort(Comparator.comparingInt(Pairing::board));
                addMatch(round.number(), boards, registry, history, records);
            }
        }
        return records;
    }

    private static void addMatch(int round, List<Pairing> boards, PlayerRegistry registry,
                                 TournamentHistory history, Map<String, List<TeamMatchRecord>> records) {
        Optional<Pairing> boardOne = boards.stream().filter(p -> !p.isBye()).findFirst();
        if (boardOne.isEmpty()) {
            Optional<Team> team = registry.teamOf(boards.get(0).byePlayerId());
            team.ifPresent(t -> records.get(t.id()).add(new TeamMatchRecord(round, t.id(), null, null,
                gamePoints(t, round, boards, history), 0, MATCH_WIN)));
            return;
        }
        Optional<Team> teamA = registry.teamOf(boardOne.get().whiteId());
        Optional<Team> teamB = registry.teamOf(boardOne.get().blackId());
        if (teamA.isEmpty() || teamB.isEmpty()) {
            return;
        }
        int pointsA = gamePoints(teamA.get(), round, boards, history);
        int pointsB = gamePoints(teamB.get(), round, boards, history);
        records.get(teamA.get().id()).add(new TeamMatchRecord(round, teamA.get().id(), teamB.get().id(),
            Color.WHITE, pointsA, pointsB, matchPoints(pointsA, pointsB)));
        records.get(teamB.get().id()).add(new TeamMatchRecord(round, teamB.get().id(), teamA.get().id(),
            Color.BLACK, pointsB, pointsA, matchPoints(pointsB, pointsA)));
    }

    private static int gamePoints(Team team, int round, List<Pairing> boards, TournamentHistory history) {
        int total = 0;
        for (Pairing pairing : boards) {
            for (String playerId : new String[] {pairing.whiteId(), pairing.blackId()}) {
                if (playerId != null && team.memberIds().contains(playerId)) {
                    total += history.of(playerId).entry(round).map(RoundEntry::pointsHalves).orElse(0);
                }
            }
        }
        return total;
    }

    private static int matchPoints(int own, int opponent) {
        if (own > opponent) {
            return MATCH_WIN;
        }
        return own == opponent ? MATCH_DRAW : 0;
    }

    /**
     * Team standings per section, each section ranked by the configured team tiebreaks.
     * Teams equal on every criterion share a rank.
     */
    public static List<TeamStanding> standings(TournamentState state, TournamentHistory history,
                                               TiebreakConfig config) {
        Map<String, List<TeamMatchRecord>> records = matchRecords(state, history);
        Map<String, Integer> matchPointTotals = new LinkedHashMap<>();
        records.forEach((id, list) -> matchPointTotals.put(id,
            list.stream().mapToInt(TeamMatchRecord::matchPoints).sum()));

        List<TeamStanding> result = new ArrayList<>();
        Map<String, List<Team>> bySection = new LinkedHashMap<>();
        for (Team team : history.registry().teams()) {
            bySection.computeIfAbsent(team.section(), s -> new ArrayList<>()).add(team);
        }
        bySection.keySet().stream().sorted().forEach(section -> {
            List<Row> rows = new ArrayList<>();
            for (Team team : bySection.get(section)) {
                rows.add(row(team, records.get(team.id()), matchPointTotals, config.teamTiebreaks()));
            }
            rows.sort((a, b) -> {
                int byValues = compareValues(b.values, a.values);
                return byValues != 0 ? byValues : a.team.id().compareTo(b.team.id());
            });
            for (int i = 0; i < rows.size(); i++) {
                Row row = rows.get(i);
                int first = i;
                while (first > 0 && compareValues(rows.get(first - 1).values, row.values) == 0) {
                    first--;
                }
                boolean shared = first != i
                    || (i + 1 < rows.size() && compareValues(rows.get(i + 1).values, row.values) == 0);
                result.add(row.toStanding(first + 1, shared, config.teamTiebreaks()));
            }
        });
        return result;
    }

    private static Row row(Team team, List<TeamMatchRecord> matches, Map<String, Integer> matchPointTotals,
                           List<TeamTiebreak> order) {
        double[] values = new double[order.size()];
        for (int i = 0; i < order.size(); i++) {
            values[i] = switch (order.get(i)) {
                case MATCH_POINTS -> matches.stream().mapToInt(TeamMatchRecord::matchPoints).sum();
                case GAME_POINTS -> matches.stream().mapToInt(TeamMatchRecord::gamePointsHalves).sum() / 2.0;
                case BUCHHOLZ -> matches.stream()
                    .filter(m -> !m.isBye())
                    .mapToInt(m -> matchPointTotals.getOrDefault(m.opponentTeamId(), 0))
                    .sum();
                case SONNEBORN_BERGER -> matches.stream()
                    .filter(m -> !m.isBye())
                    .mapToDouble(m -> matchPointTotals.getOrDefault(m.opponentTeamId(), 0) * (m.gamePointsHalves() / 2.0))
                    .sum();
            };
        }
        return new Row(team, matches, values);
    }

    private static int compareValues(double[] a, double[] b) {
        for (int i = 0; i < a.length; i++) {
            int c = Double.compare(a[i], b[i]);
            if (c != 0) {
                return c;
            }
        }
        return 0;
    }

    private record Row(Team team, List<TeamMatchRecord> matches, double[] values) {

        TeamStanding toStanding(int rank, boolean shared, List<TeamTiebreak> order) {
            Map<String, Double> tiebreaks = new LinkedHashMap<>();
            for (int i = 0; i < order.size(); i++) {
                tiebreaks.put(order.get(i).key(), values[i]);
            }
            int wins = (int) matches.stream().filter(m -> m.matchPoints() == MATCH_WIN).count();
            int draws = (int) matches.stream().filter(m -> m.matchPoints() == MATCH_DRAW).count();
            int losses = matches.size() - wins - draws;
            return new TeamStanding(rank, shared, team.id(), team.name(), team.section(),
                matches.stream().mapToInt(TeamMatchRecord::matchPoints).sum(),
                matches.stream().mapToInt(TeamMatchRecord::gamePointsHalves).sum() / 2.0,
                wins, draws, losses, tiebreaks);
        }
    }
}
