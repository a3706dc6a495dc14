package com.gnovoa.matchsim.sim;

import com.gnovoa.matchsim.config.SimProperties;
import com.gnovoa.matchsim.core.MatchState;
import com.gnovoa.matchsim.core.TeamState;
import com.gnovoa.matchsim.events.MatchEvent;
import com.gnovoa.matchsim.events.MatchEventType;
import com.gnovoa.matchsim.model.Player;
import com.gnovoa.matchsim.model.Position;
import com.gnovoa.matchsim.model.TeamSide;
import com.gnovoa.matchsim.trace.AiTraceEvent;
import com.gnovoa.matchsim.trace.AiTraceType;
import com.gnovoa.matchsim.trace.TraceRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Decides, once per minute, whether something notable happens and what it is.
 *
 * <p>Draw order per minute: possession, trigger, category, then the category's own draws
 * (chance kind, offside, conversion, scorer, assister, fouler, card). Every draw goes through
 * the match's {@link RandomSource}; nothing here keeps state between minutes.
 */
public final class ProbabilityEngine {

    private static final Logger log = LoggerFactory.getLogger(ProbabilityEngine.class);

    enum Category { CHANCE, CARD, SET_PIECE, SAVE, INJURY }

    enum ChanceKind { OPEN_PLAY, PENALTY, OWN_GOAL }

    enum Finish { GOAL, SAVE, MISS }

    private static final Comparator<Player> BY_ID = Comparator.comparing(Player::playerId);

    private final AttributeModel attributes;
    private final DisciplineModel discipline;
    private final SimProperties.Probability config;

    public ProbabilityEngine(AttributeModel attributes, DisciplineModel discipline, SimProperties.Probability config) {
        this.attributes = attributes;
        this.discipline = discipline;
        this.config = config;
    }

    public double teamStrength(TeamState team) {
        return attributes.teamStrength(team.onPitch(), team::energyOf, team.posture(),
                team.sentOffCount(), config.redCardStrengthPenalty());
    }

    public TacticalImpact impact(TeamState own, TeamState opponent) {
        return TacticalImpact.of(own.posture(), own.formation(), opponent.formation());
    }

    /** Home share of possession for the coming minute, clamped to the configured band. */
    public double homePossessionShare(MatchState state) {
        TeamState home = state.home();
        TeamState away = state.away();
        double share = 0.5
                + (teamStrength(home) - teamStrength(away)) / 200.0
                + (state.neutralVenue() ? 0 : config.homePossessionBonus())
                + impact(home, away).possession()
                - impact(away, home).possession();
        return WeightedDraw.clamp(share, config.possessionMin(), config.possessionMax());
    }

    /** Consumes exactly one draw. */
    public TeamSide rollPossession(MatchState state, RandomSource rnd) {
        return WeightedDraw.chance(homePossessionShare(state), rnd) ? TeamSide.HOME : TeamSide.AWAY;
    }

    /**
     * Rolls the current minute for the side in possession.
     *
     * @return the events to append, or empty when nothing notable happens
     */
    public Optional<EventOutcome> rollMinute(MatchState state, RandomSource rnd, TraceRecorder trace) {
        TeamSide acting = state.possession();
        TeamState attack = state.side(acting);
        TeamState defend = state.side(acting.opposite());
        int minute = state.minute();
        int goalDiff = state.goalDifference(acting);

        TacticalImpact attackImpact = impact(attack, defend);
        TacticalImpact defendImpact = impact(defend, attack);
        double attackStrength = teamStrength(attack);
        double defendStrength = teamStrength(defend);

        double rawTrigger = config.eventPerMinute()
                + (minute >= config.lateGameMinute() ? config.lateGameBonus() : 0)
                + (Math.abs(goalDiff) <= 1 ? config.closeScoreBonus() : 0)
                + config.creationTriggerWeight() * attackImpact.creation();
        double trigger = WeightedDraw.clamp01(rawTrigger);
        boolean fired = WeightedDraw.chance(trigger, rnd);

        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("minute", minute);
        inputs.put("possession", acting.wire());
        inputs.put("attackStrength", attackStrength);
        inputs.put("defendStrength", defendStrength);
        inputs.put("goalDifference", goalDiff);
        inputs.put("posture", attack.posture().wire());

        if (!fired) {
            trace.record(() -> AiTraceEvent.info(AiTraceType.EVENT_PROBABILITY, minute, acting,
                    "Quiet minute", inputs,
                    Map.of("rawTrigger", rawTrigger, "trigger", trigger),
                    Map.of("triggered", false)));
            return Optional.empty();
        }

        double ratio = Math.max(1, attackStrength) / (Math.max(1, attackStrength) + Math.max(1, defendStrength));
        boolean trailing = goalDiff < 0;
        List<WeightedDraw.Candidate<Category>> categories = List.of(
                new WeightedDraw.Candidate<>(Category.CHANCE, config.chanceWeight() * 2 * ratio
                        * (1 + attackImpact.creation() - defendImpact.prevention())
                        * (trailing ? 1 + config.trailingChanceBias() : 1)),
                new WeightedDraw.Candidate<>(Category.CARD, config.cardWeight() * (0.5 + ratio)),
                new WeightedDraw.Candidate<>(Category.SET_PIECE, config.setPieceWeight() * (0.5 + ratio)),
                new WeightedDraw.Candidate<>(Category.SAVE, defend.goalkeeper().isPresent()
                        ? config.saveWeight() * (1 + defendImpact.prevention()) : 0),
                new WeightedDraw.Candidate<>(Category.INJURY, config.injuryWeight()));

        var drawn = WeightedDraw.draw(categories, rnd);
        if (drawn.isEmpty()) {
            log.debug("All category weights are zero at minute {}", minute);
            return Optional.empty();
        }
        Category category = drawn.get().value();

        trace.record(() -> {
            Map<String, Object> computed = new LinkedHashMap<>();
            computed.put("rawTrigger", rawTrigger);
            computed.put("trigger", trigger);
            computed.put("strengthRatio", ratio);
            Map<String, Object> weights = new LinkedHashMap<>();
            for (var c : categories) weights.put(wire(c.value()), drawn.get().probability(c.weight()));
            computed.put("categoryProbabilities", weights);
            return AiTraceEvent.info(AiTraceType.EVENT_PROBABILITY, minute, acting,
                    "Notable minute: " + wire(category), inputs, computed,
                    Map.of("triggered", true, "category", wire(category)));
        });

        Roll roll = new Roll(state, acting, attack, defend, attackImpact, defendImpact,
                attackStrength, defendStrength, rnd, trace);
        return switch (category) {
            case CHANCE -> resolveChance(roll);
            case CARD -> resolveCard(roll);
            case SET_PIECE -> resolveSetPiece(roll);
            case SAVE -> resolveSave(roll);
            case INJURY -> resolveInjury(roll);
        };
    }

    /** Everything the resolution steps of one minute share. */
    private record Roll(MatchState state, TeamSide acting, TeamState attack, TeamState defend,
                        TacticalImpact attackImpact, TacticalImpact defendImpact,
                        double attackStrength, double defendStrength,
                        RandomSource rnd, TraceRecorder trace) {

        int minute() { return state.minute(); }

        MatchEvent event(MatchEventType type, TeamSide team, String playerId, String assistId, String text) {
            return MatchEvent.forPlayer(state.stampMinute(), state.stampAddedTime(), type, team, playerId, assistId, text);
        }
    }

    // --- chances -----------------------------------------------------------------------------

    private Optional<EventOutcome> resolveChance(Roll r) {
        double openPlay = Math.max(0, 1 - config.penaltyShare() - config.ownGoalShare());
        var kind = WeightedDraw.draw(List.of(
                new WeightedDraw.Candidate<>(ChanceKind.OPEN_PLAY, openPlay),
                new WeightedDraw.Candidate<>(ChanceKind.PENALTY, config.penaltyShare()),
                new WeightedDraw.Candidate<>(ChanceKind.OWN_GOAL, config.ownGoalShare())), r.rnd());
        if (kind.isEmpty()) return Optional.empty();
        return switch (kind.get().value()) {
            case OPEN_PLAY -> openPlay(r);
            case PENALTY -> penalty(r);
            case OWN_GOAL -> ownGoal(r);
        };
    }

    private Optional<EventOutcome> openPlay(Roll r) {
        var shooterDraw = WeightedDraw.draw(outfield(r.attack()),
                p -> attributes.scorerWeight(p, r.attack().energyOf(p)), BY_ID, r.rnd());
        if (shooterDraw.isEmpty()) {
            log.debug("No outfield shooter left for {} at minute {}", r.attack().team().name(), r.minute());
            return Optional.empty();
        }
        Player shooter = shooterDraw.get().value();

        if (WeightedDraw.chance(config.offsideShare(), r.rnd())) {
            recordChance(r, "open_play", shooter, config.offsideShare(), config.offsideShare(), "offside");
            return Optional.of(EventOutcome.of(r.event(MatchEventType.OFFSIDE, r.acting(), shooter.playerId(), null,
                    shooter.displayName() + " is caught offside")));
        }

        Optional<Player> keeper = r.defend().goalkeeper();
        double keeperEdge = keeper.map(gk -> (attributes.goalkeeping(gk) - 70) / 100.0 * config.keeperEdgeFactor())
                .orElse(config.missingKeeperEdge());
        double raw = config.baseConversion()
                + config.strengthConversionFactor() * (r.attackStrength() - r.defendStrength()) / 100.0
                + config.finishingConversionFactor() * (attributes.finishingQuality(shooter, r.attack().energyOf(shooter)) - 70) / 100.0
                + r.attackImpact().creation()
                - r.defendImpact().prevention()
                + (r.acting() == TeamSide.HOME && !r.state().neutralVenue() ? config.homeConversionBonus() : 0)
                - keeperEdge;
        double conversion = WeightedDraw.clamp(raw, config.minConversion(), config.maxConversion());
        double misses = 1 - conversion;
        var finish = WeightedDraw.draw(List.of(
                new WeightedDraw.Candidate<>(Finish.GOAL, conversion),
                new WeightedDraw.Candidate<>(Finish.SAVE, keeper.isPresent() ? misses * config.saveShareOfMisses() : 0),
                new WeightedDraw.Candidate<>(Finish.MISS, keeper.isPresent() ? misses * (1 - config.saveShareOfMisses()) : misses)),
                r.rnd()).map(WeightedDraw.Result::value).orElse(Finish.MISS);

        recordChance(r, "open_play", shooter, raw, conversion, finish.name().toLowerCase(Locale.ROOT));

        String team = r.attack().team().name();
        return Optional.of(switch (finish) {
            case GOAL -> {
                String assist = drawAssister(r, shooter).map(Player::playerId).orElse(null);
                yield EventOutcome.of(r.event(MatchEventType.GOAL, r.acting(), shooter.playerId(), assist,
                        "GOAL! " + shooter.displayName() + " scores for " + team));
            }
            case SAVE -> {
                Player gk = keeper.orElseThrow();
                yield EventOutcome.of(r.event(MatchEventType.SAVE, r.acting().opposite(), gk.playerId(), null,
                        "Great save by " + gk.displayName() + " to deny " + shooter.displayName()));
            }
            case MISS -> EventOutcome.of(r.event(MatchEventType.CHANCE_MISSED, r.acting(), shooter.playerId(), null,
                    shooter.displayName() + " misses a chance"));
        });
    }

    private Optional<EventOutcome> penalty(Roll r) {
        Comparator<Player> byTakerScore = Comparator.comparingDouble(attributes::penaltyTakerScore);
        Optional<Player> taker = outfield(r.attack()).stream()
                .max(byTakerScore.thenComparing(BY_ID.reversed()));
        if (taker.isEmpty()) {
            log.debug("No penalty taker left for {} at minute {}", r.attack().team().name(), r.minute());
            return Optional.empty();
        }
        Player p = taker.get();
        Player gk = r.defend().goalkeeper().orElse(null);
        double raw = attributes.rawPenaltyConversion(p, gk);
        double conversion = attributes.penaltyConversion(p, gk);
        boolean scored = WeightedDraw.chance(conversion, r.rnd());
        recordChance(r, "penalty", p, raw, conversion, scored ? "penalty_scored" : "penalty_missed");

        if (scored) {
            return Optional.of(EventOutcome.of(r.event(MatchEventType.PENALTY_SCORED, r.acting(), p.playerId(), null,
                    p.displayName() + " converts the penalty for " + r.attack().team().name())));
        }
        return Optional.of(EventOutcome.of(r.event(MatchEventType.PENALTY_MISSED, r.acting(), p.playerId(), null,
                p.displayName() + " misses the penalty")));
    }

    private Optional<EventOutcome> ownGoal(Roll r) {
        var defender = WeightedDraw.draw(outfield(r.defend()),
                p -> 100.0 - p.attributes().composure(), BY_ID, r.rnd());
        if (defender.isEmpty()) {
            log.debug("No defender left for an own goal by {} at minute {}", r.defend().team().name(), r.minute());
            return Optional.empty();
        }
        Player p = defender.get().value();
        recordChance(r, "own_goal", p, config.ownGoalShare(), config.ownGoalShare(), "own_goal");
        return Optional.of(EventOutcome.of(r.event(MatchEventType.OWN_GOAL, r.acting(), p.playerId(), null,
                "Own goal! " + p.displayName() + " puts it past their own keeper")));
    }

    private Optional<Player> drawAssister(Roll r, Player scorer) {
        if (!WeightedDraw.chance(config.assistProbability(), r.rnd())) return Optional.empty();
        List<Player> candidates = new ArrayList<>(outfield(r.attack()));
        candidates.removeIf(p -> p.playerId().equals(scorer.playerId()));
        return WeightedDraw.draw(candidates, attributes::assistWeight, BY_ID, r.rnd()).map(WeightedDraw.Result::value);
    }

    private void recordChance(Roll r, String kind, Player player, double raw, double clamped, String outcome) {
        r.trace().record(() -> {
            Map<String, Object> inputs = new LinkedHashMap<>();
            inputs.put("kind", kind);
            inputs.put("playerId", player.playerId());
            inputs.put("attackStrength", r.attackStrength());
            inputs.put("defendStrength", r.defendStrength());
            inputs.put("creation", r.attackImpact().creation());
            inputs.put("prevention", r.defendImpact().prevention());
            Map<String, Object> computed = new LinkedHashMap<>();
            computed.put("rawProbability", raw);
            computed.put("clampedProbability", clamped);
            return AiTraceEvent.info(AiTraceType.CHANCE_EVALUATION, r.minute(), r.acting(),
                    "Chance for " + player.displayName() + ": " + outcome, inputs, computed,
                    Map.of("result", outcome));
        });
    }

    // --- other categories --------------------------------------------------------------------

    private Optional<EventOutcome> resolveCard(Roll r) {
        String attackName = r.attack().team().name();
        var foul = discipline.maybeFoul(r.defend(), r.minute(), r.rnd(), r.trace());
        if (foul.isEmpty()) {
            return Optional.of(EventOutcome.of(r.event(MatchEventType.FREE_KICK, r.acting(), null, null,
                    "Free kick to " + attackName)));
        }
        Player fouler = foul.get().player();
        TeamSide defending = r.acting().opposite();
        MatchEvent freeKick = r.event(MatchEventType.FREE_KICK, r.acting(), null, null,
                "Foul by " + fouler.displayName() + ", free kick to " + attackName);
        MatchEvent card = switch (foul.get().severity()) {
            case YELLOW -> r.event(MatchEventType.YELLOW_CARD, defending, fouler.playerId(), null,
                    "Yellow card for " + fouler.displayName());
            case SECOND_YELLOW -> r.event(MatchEventType.RED_CARD, defending, fouler.playerId(), null,
                    "Second yellow! " + fouler.displayName() + " is sent off");
            case DIRECT_RED -> r.event(MatchEventType.RED_CARD, defending, fouler.playerId(), null,
                    "RED CARD! " + fouler.displayName() + " is sent off");
        };
        return Optional.of(EventOutcome.of(freeKick, card));
    }

    private Optional<EventOutcome> resolveSetPiece(Roll r) {
        boolean corner = WeightedDraw.chance(config.cornerShare(), r.rnd());
        String team = r.attack().team().name();
        MatchEvent setPiece = corner
                ? r.event(MatchEventType.CORNER, r.acting(), null, null, "Corner kick for " + team)
                : r.event(MatchEventType.FREE_KICK, r.acting(), null, null, "Free kick in a dangerous position for " + team);

        double goalRate = corner ? config.cornerGoalRate() : config.freeKickGoalRate();
        if (!WeightedDraw.chance(goalRate, r.rnd())) return Optional.of(EventOutcome.of(setPiece));

        var scorer = WeightedDraw.draw(outfield(r.attack()),
                p -> corner ? p.attributes().heading() + p.attributes().strength() / 2.0
                        : p.attributes().shooting() + p.attributes().composure() / 2.0,
                BY_ID, r.rnd());
        if (scorer.isEmpty()) return Optional.of(EventOutcome.of(setPiece));
        Player p = scorer.get().value();
        MatchEvent goal = r.event(MatchEventType.GOAL, r.acting(), p.playerId(), null,
                corner ? "GOAL! " + p.displayName() + " heads in from the corner"
                        : "GOAL! " + p.displayName() + " curls the free kick in");
        return Optional.of(EventOutcome.of(setPiece, goal));
    }

    private Optional<EventOutcome> resolveSave(Roll r) {
        Optional<Player> keeper = r.defend().goalkeeper();
        if (keeper.isEmpty()) return Optional.empty();
        Player gk = keeper.get();
        return Optional.of(EventOutcome.of(r.event(MatchEventType.SAVE, r.acting().opposite(), gk.playerId(), null,
                "Great save by " + gk.displayName())));
    }

    private record OnPitch(TeamSide side, Player player, double energy) {}

    private Optional<EventOutcome> resolveInjury(Roll r) {
        List<OnPitch> everyone = new ArrayList<>();
        for (Player p : r.attack().onPitch()) everyone.add(new OnPitch(r.acting(), p, r.attack().energyOf(p)));
        for (Player p : r.defend().onPitch()) everyone.add(new OnPitch(r.acting().opposite(), p, r.defend().energyOf(p)));
        var injured = WeightedDraw.draw(everyone,
                o -> 1.0 + (100.0 - o.energy()) / config.injuryFatigueScale(),
                Comparator.comparing(OnPitch::side).thenComparing(o -> o.player().playerId()),
                r.rnd());
        if (injured.isEmpty()) return Optional.empty();
        OnPitch o = injured.get().value();
        return Optional.of(EventOutcome.injury(r.event(MatchEventType.INJURY, o.side(), o.player().playerId(), null,
                o.player().displayName() + " is down injured"), o.side(), o.player().playerId()));
    }

    private static List<Player> outfield(TeamState team) {
        List<Player> out = new ArrayList<>();
        for (Player p : team.onPitch()) if (p.position() != Position.GK) out.add(p);
        return out;
    }

    private static String wire(Category category) {
        return category.name().toLowerCase(Locale.ROOT);
    }
}
