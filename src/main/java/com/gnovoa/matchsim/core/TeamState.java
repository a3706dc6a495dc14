package com.gnovoa.matchsim.core;

import com.gnovoa.matchsim.model.Control;
import com.gnovoa.matchsim.model.Formation;
import com.gnovoa.matchsim.model.Player;
import com.gnovoa.matchsim.model.Position;
import com.gnovoa.matchsim.model.Posture;
import com.gnovoa.matchsim.model.Tactics;
import com.gnovoa.matchsim.model.Team;
import com.gnovoa.matchsim.model.TeamSide;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Live overlay of one side: current lineup, bench, energy, bookings and dismissals.
 *
 * <p>Roster players stay immutable; everything that changes during the match lives here.
 * Mutators are package-private and only reached through {@link MatchState} and
 * {@link MatchEngine}.
 */
public final class TeamState {

    private final TeamSide side;
    private final Team team;
    private final Control control;
    private final Formation formation;
    private final Posture posture;

    private final Map<String, Player> playersById = new LinkedHashMap<>();
    private final List<String> startingLineup;
    private final List<String> lineup;
    private final List<String> bench;

    private final Map<String, Double> energy = new LinkedHashMap<>();
    private final Map<String, Integer> bookings = new LinkedHashMap<>();
    private final Map<String, Boolean> sentOff = new LinkedHashMap<>();
    private final Map<String, Integer> minutesPlayed = new LinkedHashMap<>();
    private final Set<String> usedSubstitutes = new LinkedHashSet<>();
    private final Set<String> substitutedOff = new LinkedHashSet<>();
    private final Map<SubstitutionReason, Integer> subsByReason = new EnumMap<>(SubstitutionReason.class);

    private int subsUsed = 0;

    TeamState(TeamSide side, Team team, Tactics tactics, Formation formation, Control control) {
        this.side = side;
        this.team = team;
        this.control = control;
        this.formation = formation;
        this.posture = tactics.posture();
        for (Player p : team.players()) playersById.put(p.playerId(), p);
        this.startingLineup = List.copyOf(tactics.lineup());
        this.lineup = new ArrayList<>(tactics.lineup());
        this.bench = new ArrayList<>(tactics.substitutes());
        for (String id : lineup) energy.put(id, (double) clampEnergy(playersById.get(id).energy()));
        for (String id : bench) energy.put(id, (double) clampEnergy(playersById.get(id).energy()));
    }

    public TeamSide side() { return side; }
    public Team team() { return team; }
    public Control control() { return control; }
    public Formation formation() { return formation; }
    public Posture posture() { return posture; }
    public int subsUsed() { return subsUsed; }

    public Player player(String playerId) {
        Player p = playersById.get(playerId);
        if (p == null) throw new IllegalArgumentException("Unknown player " + playerId + " for " + team.name());
        return p;
    }

    /** The eleven who kicked off, in slot order. */
    public List<String> startingLineup() {
        return startingLineup;
    }

    /** Current lineup ids in slot order, including dismissed players who keep their slot. */
    public List<String> lineupIds() {
        return Collections.unmodifiableList(lineup);
    }

    /** Players on the pitch and still playing, in slot order. */
    public List<Player> onPitch() {
        List<Player> out = new ArrayList<>(lineup.size());
        for (String id : lineup) if (!isSentOff(id)) out.add(playersById.get(id));
        return out;
    }

    /** Bench players still available to come on, in bench order. */
    public List<Player> availableBench() {
        List<Player> out = new ArrayList<>(bench.size());
        for (String id : bench) if (!usedSubstitutes.contains(id)) out.add(playersById.get(id));
        return out;
    }

    public List<String> benchIds() {
        return Collections.unmodifiableList(bench);
    }

    public Optional<Player> goalkeeper() {
        return onPitch().stream().filter(p -> p.position() == Position.GK).findFirst();
    }

    public boolean isOnPitch(String playerId) {
        return lineup.contains(playerId) && !isSentOff(playerId);
    }

    public boolean isAvailableSubstitute(String playerId) {
        return bench.contains(playerId) && !usedSubstitutes.contains(playerId) && !substitutedOff.contains(playerId);
    }

    public double energyOf(String playerId) {
        return energy.getOrDefault(playerId, 0.0);
    }

    public double energyOf(Player player) {
        return energyOf(player.playerId());
    }

    public int bookingsOf(String playerId) {
        return bookings.getOrDefault(playerId, 0);
    }

    public boolean isSentOff(String playerId) {
        return sentOff.getOrDefault(playerId, false);
    }

    public int sentOffCount() {
        return (int) sentOff.values().stream().filter(Boolean::booleanValue).count();
    }

    public int minutesPlayed(String playerId) {
        return minutesPlayed.getOrDefault(playerId, 0);
    }

    public int subsFor(SubstitutionReason reason) {
        return subsByReason.getOrDefault(reason, 0);
    }

    public Map<String, Double> energy() { return Collections.unmodifiableMap(energy); }
    public Map<String, Integer> bookings() { return Collections.unmodifiableMap(bookings); }
    public Map<String, Boolean> sentOff() { return Collections.unmodifiableMap(sentOff); }
    public Set<String> usedSubstitutes() { return Collections.unmodifiableSet(usedSubstitutes); }
    public Set<String> substitutedOff() { return Collections.unmodifiableSet(substitutedOff); }

    /**
     * Checks a substitution against the match rules without applying it.
     *
     * @return the rejection reason, or empty when the substitution is legal
     */
    public Optional<String> checkSubstitution(String outgoingId, String incomingId, int maxSubs,
                                              boolean requireSamePosition) {
        if (subsUsed >= maxSubs) return Optional.of("no substitutions left");
        if (!lineup.contains(outgoingId)) return Optional.of("outgoing player is not on the pitch");
        if (isSentOff(outgoingId)) return Optional.of("outgoing player was sent off");
        if (!isAvailableSubstitute(incomingId)) return Optional.of("incoming player is not available on the bench");
        if (requireSamePosition && player(outgoingId).position() != player(incomingId).position()) {
            return Optional.of("incoming player plays a different position");
        }
        return Optional.empty();
    }

    // --- mutators -------------------------------------------------------------------------

    void setEnergy(String playerId, double value) {
        energy.put(playerId, value);
    }

    void playMinute(String playerId) {
        minutesPlayed.merge(playerId, 1, Integer::sum);
    }

    void book(String playerId) {
        int current = bookingsOf(playerId);
        if (current >= 1) {
            throw new IllegalStateException("second booking for " + playerId + " must be a red card");
        }
        bookings.put(playerId, 1);
    }

    void sendOff(String playerId) {
        if (isSentOff(playerId)) throw new IllegalStateException(playerId + " already sent off");
        bookings.put(playerId, 2);
        sentOff.put(playerId, true);
    }

    void substitute(String outgoingId, String incomingId, SubstitutionReason reason) {
        int slot = lineup.indexOf(outgoingId);
        lineup.set(slot, incomingId);
        usedSubstitutes.add(incomingId);
        substitutedOff.add(outgoingId);
        subsByReason.merge(reason, 1, Integer::sum);
        subsUsed++;
    }

    private static int clampEnergy(int value) {
        return Math.max(0, Math.min(100, value));
    }
}
