package com.gnovoa.matchsim;

import com.gnovoa.matchsim.model.Player;
import com.gnovoa.matchsim.model.PlayerAttributes;
import com.gnovoa.matchsim.model.Position;
import com.gnovoa.matchsim.model.Posture;
import com.gnovoa.matchsim.model.Tactics;
import com.gnovoa.matchsim.model.Team;
import java.util.ArrayList;
import java.util.List;

/**
 * Synthetic squads for tests. Player ids are {@code <teamId>-01} to {@code <teamId>-18}: 01-02
 * goalkeepers, 03-08 defenders, 09-14 midfielders, 15-18 attackers.
 */
public final class TestRosters {

  private TestRosters() {}

  public static Team team(String teamId, int level) {
    return team(teamId, level, level, level, level);
  }

  public static Team team(String teamId, int gk, int def, int mid, int att) {
    List<Player> players = new ArrayList<>();
    for (int i = 1; i <= 18; i++) {
      Position position = positionOf(i);
      int level =
          switch (position) {
            case GK -> gk;
            case DEF -> def;
            case MID -> mid;
            case ATT -> att;
          };
      players.add(player(id(teamId, i), position, level));
    }
    return new Team(teamId, "Team " + teamId, teamId.toUpperCase(), players);
  }

  public static Player player(String playerId, Position position, int level) {
    return new Player(playerId, "Player " + playerId, null, 26, position, PlayerAttributes.uniform(level), 100);
  }

  /** Replaces the player with the same id. */
  public static Team withPlayer(Team team, Player replacement) {
    List<Player> players = new ArrayList<>();
    for (Player p : team.players()) {
      players.add(p.playerId().equals(replacement.playerId()) ? replacement : p);
    }
    return new Team(team.teamId(), team.name(), team.shortName(), players);
  }

  /** 4-3-3: 01, 03-06, 09-11, 15-17 start; 02, 07, 08, 12, 13, 14, 18 on the bench. */
  public static Tactics tactics433(Team team) {
    return tactics433(team, Posture.BALANCED);
  }

  public static Tactics tactics433(Team team, Posture posture) {
    return new Tactics(
        "4-3-3",
        posture,
        ids(team.teamId(), 1, 3, 4, 5, 6, 9, 10, 11, 15, 16, 17),
        ids(team.teamId(), 2, 7, 8, 12, 13, 14, 18));
  }

  public static String id(String teamId, int number) {
    return String.format("%s-%02d", teamId, number);
  }

  public static List<String> ids(String teamId, int... numbers) {
    List<String> out = new ArrayList<>();
    for (int n : numbers) out.add(id(teamId, n));
    return out;
  }

  private static Position positionOf(int number) {
    if (number <= 2) return Position.GK;
    if (number <= 8) return Position.DEF;
    if (number <= 14) return Position.MID;
    return Position.ATT;
  }
}
