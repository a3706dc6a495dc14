package com.gnovoa.matchsim.rosters;

import com.gnovoa.matchsim.model.Formation;
import com.gnovoa.matchsim.model.Player;
import com.gnovoa.matchsim.model.Position;
import com.gnovoa.matchsim.model.Posture;
import com.gnovoa.matchsim.model.Tactics;
import com.gnovoa.matchsim.model.Team;
import com.gnovoa.matchsim.sim.AttributeModel;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Picks a playable lineup from a roster when a side does not send its own tactics: the best
 * goalkeeper and the best players per line for the formation, then the strongest remaining
 * players on the bench.
 */
public final class DefaultTactics {

  public static final int BENCH_SIZE = 7;

  private final AttributeModel attributes;

  public DefaultTactics(AttributeModel attributes) {
    this.attributes = attributes;
  }

  public Tactics pick(Team team) {
    return pick(team, Formation.F_4_3_3, Posture.BALANCED);
  }

  public Tactics pick(Team team, Formation formation, Posture posture) {
    Comparator<Player> best =
        Comparator.comparingInt((Player p) -> attributes.overall(p)).reversed()
            .thenComparing(Player::playerId);
    List<Player> pool = new ArrayList<>(team.players());
    pool.sort(best);

    List<Player> lineup = new ArrayList<>();
    take(pool, lineup, Position.GK, 1);
    take(pool, lineup, Position.DEF, formation.defenders());
    take(pool, lineup, Position.MID, formation.midfielders());
    take(pool, lineup, Position.ATT, formation.attackers());
    // short lines are filled with the best remaining outfield players
    for (Player p : new ArrayList<>(pool)) {
      if (lineup.size() >= 11) break;
      if (p.position() == Position.GK) continue;
      lineup.add(p);
      pool.remove(p);
    }

    List<Player> bench = new ArrayList<>();
    take(pool, bench, Position.GK, 1);
    for (Player p : new ArrayList<>(pool)) {
      if (bench.size() >= BENCH_SIZE) break;
      bench.add(p);
      pool.remove(p);
    }

    return new Tactics(
        formation.label(),
        posture,
        lineup.stream().map(Player::playerId).toList(),
        bench.stream().map(Player::playerId).toList());
  }

  private static void take(List<Player> pool, List<Player> into, Position position, int count) {
    int taken = 0;
    for (Player p : new ArrayList<>(pool)) {
      if (taken >= count) return;
      if (p.position() != position) continue;
      into.add(p);
      pool.remove(p);
      taken++;
    }
  }
}
