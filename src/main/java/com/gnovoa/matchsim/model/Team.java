package com.gnovoa.matchsim.model;

import java.util.List;
import java.util.Optional;

public record Team(String teamId, String name, String shortName, List<Player> players) {

  public Team {
    players = players == null ? List.of() : List.copyOf(players);
  }

  public Optional<Player> player(String playerId) {
    return players.stream().filter(p -> p.playerId().equals(playerId)).findFirst();
  }
}
