package com.gnovoa.matchsim.rosters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.matchsim.config.SimProperties;
import com.gnovoa.matchsim.model.Player;
import com.gnovoa.matchsim.model.Team;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Loads and validates team rosters from resource locations.
 *
 * <p>Rosters are configured via {@code sim.rosters.files} (e.g. {@code
 * classpath:rosters/demo-league.json}) and are expected to be JSON matching {@link RosterFile}.
 *
 * <p>This component keeps all rosters in memory (no DB) and shares them read-only between matches.
 * It is constructed once at application startup and fails fast if any roster file is missing or
 * invalid.
 */
public final class RosterCatalog {

  private static final Logger log = LoggerFactory.getLogger(RosterCatalog.class);

  /** Minimum squad size: eleven starters plus a bench. */
  public static final int MIN_PLAYERS = 18;

  /** In-memory roster cache by team id, in file order. */
  private final Map<String, Team> teams = new LinkedHashMap<>();

  /**
   * Loads all configured rosters into memory.
   *
   * @param mapper Jackson mapper used to deserialize JSON roster files
   * @param resources resolves {@code classpath:} and {@code file:} locations
   * @param props simulation properties (includes roster file locations)
   * @throws IllegalStateException if a roster file cannot be read or parsed
   * @throws IllegalArgumentException if roster content is invalid (duplicate ids, short squads)
   */
  public RosterCatalog(ObjectMapper mapper, ResourceLoader resources, SimProperties props) {
    for (String location : props.rosters().files()) {
      Resource resource = resources.getResource(location);
      RosterFile roster;
      try (InputStream in = resource.getInputStream()) {
        roster = mapper.readValue(in, RosterFile.class);
      } catch (Exception e) {
        throw new IllegalStateException("Failed to load roster from " + location, e);
      }
      validate(roster, location);
      roster.teams().forEach(t -> teams.put(t.teamId(), t));
      log.info("Loaded roster '{}' with {} teams from {}", roster.name(), roster.teams().size(), location);
    }
  }

  /** Catalog over teams already in memory. */
  public RosterCatalog(List<Team> teams) {
    validate(new RosterFile("in-memory", teams), "memory");
    teams.forEach(t -> this.teams.put(t.teamId(), t));
  }

  public Optional<Team> find(String teamId) {
    return Optional.ofNullable(teamId == null ? null : teams.get(teamId));
  }

  /**
   * Returns the team with the given id.
   *
   * @throws IllegalArgumentException if no such team is loaded
   */
  public Team team(String teamId) {
    return find(teamId).orElseThrow(() -> new IllegalArgumentException("No roster loaded for " + teamId));
  }

  public List<Team> teams() {
    return List.copyOf(teams.values());
  }

  /**
   * Validates a roster:
   *
   * <ul>
   *   <li>Team ids are unique across all loaded files
   *   <li>At least {@value #MIN_PLAYERS} players per team
   *   <li>Player ids are unique within a team
   * </ul>
   *
   * @param location resource location used only for error reporting
   */
  private void validate(RosterFile roster, String location) {
    if (roster.teams() == null || roster.teams().isEmpty()) {
      throw new IllegalArgumentException("Roster " + location + " has no teams");
    }
    List<String> seenTeams = new ArrayList<>();
    for (Team t : roster.teams()) {
      if (t.teamId() == null || teams.containsKey(t.teamId()) || seenTeams.contains(t.teamId())) {
        throw new IllegalArgumentException("Duplicate or missing team id " + t.teamId() + " (file " + location + ")");
      }
      seenTeams.add(t.teamId());
      if (t.players().size() < MIN_PLAYERS) {
        throw new IllegalArgumentException(
            "Team " + t.name() + " must have at least " + MIN_PLAYERS + " players (file " + location + ")");
      }
      Set<String> playerIds = new HashSet<>();
      for (Player p : t.players()) {
        if (p.playerId() == null || !playerIds.add(p.playerId())) {
          throw new IllegalArgumentException(
              "Duplicate or missing player id " + p.playerId() + " in " + t.name() + " (file " + location + ")");
        }
        if (p.position() == null || p.attributes() == null) {
          throw new IllegalArgumentException(
              "Player " + p.playerId() + " in " + t.name() + " needs a position and attributes (file " + location + ")");
        }
      }
    }
  }
}
