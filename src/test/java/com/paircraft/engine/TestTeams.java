package com.paircraft.engine;

import com.paircraft.engine.model.Player;
import com.paircraft.engine.model.Team;
import com.paircraft.engine.model.TournamentState;

import java.util.ArrayList;
import java.util.List;

/**
 * Team fixtures: two-player teams A, B, C... built from consecutive players p1..pN.
 */
public final class TestTeams {

    private TestTeams() {
    }

    public static TournamentState teamState(int... ratings) {
        List<Player> players = new ArrayList<>();
        List<Team> teams = new ArrayList<>();
        List<Player> base = TestTournaments.players(ratings);
        for (int i = 0; i < base.size(); i += 2) {
            String teamId = String.valueOf((char) ('A' + i / 2));
            List<String> members = new ArrayList<>();
            for (int j = i; j < Math.min(i + 2, base.size()); j++) {
                players.add(base.get(j).withTeam(teamId));
                members.add(base.get(j).id());
            }
            teams.add(new Team(teamId, "Team " + teamId, null, members));
        }
        return TournamentState.ofTeams("t1", players, teams);
    }
}
