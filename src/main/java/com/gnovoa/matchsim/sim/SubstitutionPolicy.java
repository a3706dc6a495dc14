package com.gnovoa.matchsim.sim;

import com.gnovoa.matchsim.config.SimProperties;
import com.gnovoa.matchsim.core.SubstitutionReason;
import com.gnovoa.matchsim.core.TeamState;
import com.gnovoa.matchsim.model.Player;
import com.gnovoa.matchsim.model.Position;
import com.gnovoa.matchsim.trace.AiTraceEvent;
import com.gnovoa.matchsim.trace.AiTraceType;
import com.gnovoa.matchsim.trace.TraceRecorder;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * AI substitution policy, evaluated every minute for each AI-controlled side.
 *
 * <p>Reasons are tried in priority order: {@code fatigue}, {@code protect_lead},
 * {@code tactical}. The first reason with a qualifying pair wins and, within it, the pair with the
 * largest gap. Ties go to the lowest outgoing id, then the lowest incoming id.
 */
public final class SubstitutionPolicy {

    private final AttributeModel attributes;
    private final SimProperties.Substitution config;

    public SubstitutionPolicy(AttributeModel attributes, SimProperties.Substitution config) {
        this.attributes = attributes;
        this.config = config;
    }

    private record Pair(Player out, Player in, double gap) {}

    private static final Comparator<Pair> BEST_FIRST = Comparator
            .comparingDouble(Pair::gap).reversed()
            .thenComparing(p -> p.out().playerId())
            .thenComparing(p -> p.in().playerId());

    /**
     * @param minute elapsed match minute
     * @param goalDifference goals for minus goals against for {@code team}
     */
    public Optional<SubstitutionDecision> evaluate(TeamState team, int minute, int goalDifference, TraceRecorder trace) {
        if (minute < config.earliestMinute()) return Optional.empty();
        if (team.subsUsed() >= config.maxSubs()) return Optional.empty();

        Optional<Pair> fatigue = best(team, this::fatiguePair);
        Optional<Pair> protect = fatigue.isEmpty() && protectsLead(team, minute, goalDifference)
                ? best(team, this::protectLeadPair)
                : Optional.empty();
        Optional<Pair> tactical = fatigue.isEmpty() && protect.isEmpty() && minute >= config.tacticalFromMinute()
                ? best(team, this::tacticalPair)
                : Optional.empty();

        Optional<SubstitutionDecision> decision;
        if (fatigue.isPresent()) decision = fatigue.map(p -> decide(team, SubstitutionReason.FATIGUE, p));
        else if (protect.isPresent()) decision = protect.map(p -> decide(team, SubstitutionReason.PROTECT_LEAD, p));
        else decision = tactical.map(p -> decide(team, SubstitutionReason.TACTICAL, p));

        trace.record(() -> {
            Map<String, Object> inputs = new LinkedHashMap<>();
            inputs.put("minute", minute);
            inputs.put("goalDifference", goalDifference);
            inputs.put("subsUsed", team.subsUsed());
            inputs.put("bench", team.availableBench().size());
            Map<String, Object> computed = new LinkedHashMap<>();
            computed.put("fatigueGap", fatigue.map(Pair::gap).orElse(null));
            computed.put("protectLeadGap", protect.map(Pair::gap).orElse(null));
            computed.put("tacticalGap", tactical.map(Pair::gap).orElse(null));
            Map<String, Object> outcome = new LinkedHashMap<>();
            if (decision.isPresent()) {
                outcome.put("reason", decision.get().reason().wire());
                outcome.put("outgoing", decision.get().outgoing().playerId());
                outcome.put("incoming", decision.get().incoming().playerId());
            } else {
                outcome.put("reason", "none");
            }
            return AiTraceEvent.info(AiTraceType.SUB_CANDIDATE, minute, team.side(),
                    decision.map(d -> "Substitution wanted: " + d.reason().wire()).orElse("No substitution"),
                    inputs, computed, outcome);
        });
        return decision;
    }

    private static SubstitutionDecision decide(TeamState team, SubstitutionReason reason, Pair p) {
        return new SubstitutionDecision(reason, p.out(), p.in(), team.energyOf(p.out()), team.energyOf(p.in()), p.gap());
    }

    private boolean protectsLead(TeamState team, int minute, int goalDifference) {
        return minute >= config.protectLeadFromMinute()
                && goalDifference >= config.protectLeadMargin()
                && team.subsFor(SubstitutionReason.PROTECT_LEAD) < config.protectLeadMaxSubs();
    }

    private Optional<Pair> best(TeamState team, PairRule rule) {
        Pair best = null;
        for (Player out : team.onPitch()) {
            for (Player in : team.availableBench()) {
                Pair candidate = rule.pair(team, out, in);
                if (candidate == null) continue;
                if (best == null || BEST_FIRST.compare(candidate, best) < 0) best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    @FunctionalInterface
    private interface PairRule {
        /** @return the qualifying pair, or null */
        Pair pair(TeamState team, Player out, Player in);
    }

    private Pair fatiguePair(TeamState team, Player out, Player in) {
        if (out.position() != in.position()) return null;
        double outEnergy = team.energyOf(out);
        if (outEnergy >= config.fatigueThreshold()) return null;
        double gain = team.energyOf(in) - outEnergy;
        return gain >= config.minEnergyGain() ? new Pair(out, in, gain) : null;
    }

    private Pair protectLeadPair(TeamState team, Player out, Player in) {
        boolean offensiveOut = out.position() == Position.ATT || out.position() == Position.MID;
        boolean defensiveIn = in.position() == Position.DEF || in.position() == Position.MID;
        if (!offensiveOut || !defensiveIn) return null;
        double gap = attributes.defensiveContribution(in) - attributes.defensiveContribution(out);
        if (gap <= 0) return null;
        // attackers go first
        return new Pair(out, in, gap + (out.position() == Position.ATT ? 100 : 0));
    }

    private Pair tacticalPair(TeamState team, Player out, Player in) {
        if (out.position() != in.position()) return null;
        if (team.energyOf(out) < config.fatigueThreshold() || team.energyOf(in) < config.fatigueThreshold()) return null;
        double gap = attributes.overall(in) - attributes.overall(out);
        return gap > config.tacticalMinDelta() ? new Pair(out, in, gap) : null;
    }
}
