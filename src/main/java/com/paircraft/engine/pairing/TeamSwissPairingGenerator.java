package com.paircraft.engine.pairing;

import com.paircraft.engine.config.PairingConfig;
import com.paircraft.engine.config.TeamScoring;
import com.paircraft.engine.history.ColorProfile;
import com.paircraft.engine.model.ByeType;
import com.paircraft.engine.model.Pairing;
import com.paircraft.engine.model.Player;
import com.paircraft.engine.model.Team;
import com.paircraft.engine.team.TeamAggregator;
import com.paircraft.engine.team.TeamMatch;
import com.paircraft.engine.team.TeamMatchRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Team Swiss: teams are paired with the Dutch engine, then every match is expanded into
 * {@code teamBoardCount} boards. The team holding white on board 1 has white on every odd board.
 *
 * <p>A team's lineup is its active members in board order. When one side cannot fill a board the
 * other side's player on that board receives a full-point bye inside the match.
 */
public final class TeamSwissPairingGenerator implements PairingGenerator {

    private static final Logger log = LoggerFactory.getLogger(TeamSwissPairingGenerator.class);

    @Override
    public SectionPairing generate(SectionInput input) {
        PairingConfig config = input.config();
        int boardCount = config.teamBoardCount();
        Map<String, Player> players = input.players().stream()
            .collect(Collectors.toMap(Player::id, Function.identity()));

        Map<String, List<String>> lineups = new LinkedHashMap<>();
        for (Team team : input.teams()) {
            List<String> lineup = team.memberIds().stream()
                .filter(id -> players.containsKey(id) && players.get(id).isActive())
                .limit(boardCount)
                .toList();
            if (!lineup.isEmpty()) {
                lineups.put(team.id(), lineup);
            }
        }

        List<Team> ranked = input.teams().stream()
            .filter(team -> lineups.containsKey(team.id()))
            .sorted(Comparator.comparingDouble((Team team) -> averageRating(lineups.get(team.id()), players))
                .reversed()
                .thenComparing(Team::id))
            .toList();

        Map<String, List<TeamMatchRecord>> records = TeamAggregator.matchRecords(input.state(), input.history());
        List<Entrant> entrants = new ArrayList<>(ranked.size());
        for (int rank = 0; rank < ranked.size(); rank++) {
            String teamId = ranked.get(rank).id();
            List<TeamMatchRecord> matches = records.getOrDefault(teamId, List.of());
            int score = score(matches, config.teamScoring());
            Set<String> opponents = new HashSet<>();
            ColorProfile colors = ColorProfile.EMPTY;
            boolean hadBye = false;
            for (TeamMatchRecord match : matches) {
                if (match.isBye()) {
                    hadBye = true;
                } else {
                    opponents.add(match.opponentTeamId());
                    colors = colors.plus(match.boardOneColor());
                }
            }
            entrants.add(new Entrant(teamId, score, score, rank, opponents, colors, !hadBye));
        }

        int perRound = config.teamScoring() == TeamScoring.MATCH_POINTS
            ? TeamAggregator.MATCH_WIN
            : boardCount * input.state().scoring().winHalves();
        DutchPairingEngine.Context context = new DutchPairingEngine.Context(input.section(), input.round(),
            input.isFinalRound(), input.history().roundsPlayed() * perRound / 2);
        DutchPairingEngine.Result result = new DutchPairingEngine(ColorRules.from(config))
            .pair(entrants, context, input.budget());

        List<Pairing> pairings = new ArrayList<>();
        List<TeamMatch> teamMatches = new ArrayList<>();
        int matchNumber = 1;
        for (EntrantPair pair : result.pairs()) {
            String matchId = TeamMatch.matchId(input.section(), input.round(), matchNumber++);
            List<Pairing> boards = expand(lineups.get(pair.first().id()), lineups.get(pair.second().id()),
                boardCount, input, pairings.size() + 1, matchId);
            pairings.addAll(boards);
            teamMatches.add(new TeamMatch(matchId, input.round(), input.section(), pair.first().id(),
                pair.second().id(), boards.stream().map(Pairing::id).toList()));
        }
        if (result.bye() != null) {
            String matchId = TeamMatch.matchId(input.section(), input.round(), matchNumber);
            List<String> ids = new ArrayList<>();
            for (String memberId : lineups.get(result.bye().id())) {
                Pairing bye = Pairing.bye(input.round(), input.section(), pairings.size() + 1, memberId,
                    ByeType.PAIRING_ALLOCATED, matchId);
                pairings.add(bye);
                ids.add(bye.id());
            }
            teamMatches.add(new TeamMatch(matchId, input.round(), input.section(), result.bye().id(), null, ids));
        }

        log.info("Section {} round {}: {} team matches, team bye {}", input.section(), input.round(),
            result.pairs().size(), result.bye() == null ? "none" : result.bye().id());
        return new SectionPairing(input.section(), pairings, result.deviations(), null, teamMatches,
            SectionPairing.statusOf(result.deviations()));
    }

    private static List<Pairing> expand(List<String> teamA, List<String> teamB, int boardCount,
                                        SectionInput input, int firstBoard, String matchId) {
        List<Pairing> boards = new ArrayList<>();
        int board = firstBoard;
        for (int i = 0; i < boardCount; i++) {
            String a = i < teamA.size() ? teamA.get(i) : null;
            String b = i < teamB.size() ? teamB.get(i) : null;
            if (a == null && b == null) {
                break;
            }
            if (a == null || b == null) {
                String present = a != null ? a : b;
                boards.add(Pairing.bye(input.round(), input.section(), board++, present, ByeType.FULL_POINT, matchId));
                continue;
            }
            boolean aWhite = i % 2 == 0;
            boards.add(Pairing.game(input.round(), input.section(), board++, aWhite ? a : b, aWhite ? b : a, matchId));
        }
        return boards;
    }

    private static int score(List<TeamMatchRecord> matches, TeamScoring scoring) {
        return scoring == TeamScoring.MATCH_POINTS
            ? matches.stream().mapToInt(TeamMatchRecord::matchPoints).sum()
            : matches.stream().mapToInt(TeamMatchRecord::gamePointsHalves).sum();
    }

    private static double averageRating(List<String> lineup, Map<String, Player> players) {
        return lineup.stream().mapToInt(id -> players.get(id).ratingOrZero()).average().orElse(0);
    }
}
