package com.gnovoa.matchsim.sim;

import com.gnovoa.matchsim.config.SimProperties;
import com.gnovoa.matchsim.core.TeamState;
import com.gnovoa.matchsim.model.Player;
import com.gnovoa.matchsim.trace.AiTraceEvent;
import com.gnovoa.matchsim.trace.AiTraceType;
import com.gnovoa.matchsim.trace.TraceRecorder;
import com.gnovoa.matchsim.trace.TraceSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the fouling player of the side without possession and the card they receive.
 *
 * <p>A booked player who is drawn again is always sent off. Players without a booking get a
 * yellow, or rarely a direct red when their foul weight stands far above the side's average.
 */
public final class DisciplineModel {

    private static final Logger log = LoggerFactory.getLogger(DisciplineModel.class);

    public record Foul(Player player, CardSeverity severity, double weight, double selectionProbability) {}

    private final AttributeModel attributes;
    private final SimProperties.Discipline config;

    public DisciplineModel(AttributeModel attributes, SimProperties.Discipline config) {
        this.attributes = attributes;
        this.config = config;
    }

    /**
     * @param minute elapsed match minute
     * @return the foul, or empty when the side has nobody left to book
     */
    public Optional<Foul> maybeFoul(TeamState defending, int minute, RandomSource rnd, TraceRecorder trace) {
        List<Player> eligible = defending.onPitch();
        Map<String, Double> weights = new LinkedHashMap<>();
        eligible.stream()
                .sorted(Comparator.comparing(Player::playerId))
                .forEach(p -> weights.put(p.playerId(),
                        attributes.foulPropensity(p, defending.energyOf(p), defending.bookingsOf(p.playerId()), minute)));

        var drawn = WeightedDraw.draw(eligible,
                p -> weights.get(p.playerId()),
                Comparator.comparing(Player::playerId),
                rnd);
        if (drawn.isEmpty()) {
            log.debug("No eligible fouler for {} at minute {}", defending.team().name(), minute);
            return Optional.empty();
        }

        Player fouler = drawn.get().value();
        double weight = weights.get(fouler.playerId());
        double selection = drawn.get().probability(weight);

        CardSeverity severity;
        double directRedChance = 0;
        if (defending.bookingsOf(fouler.playerId()) >= 1) {
            severity = CardSeverity.SECOND_YELLOW;
        } else {
            double average = drawn.get().totalWeight() / weights.size();
            double ratio = average <= 0 ? 1 : weight / average;
            directRedChance = Math.min(config.directRedMax(), config.directRedBase() * ratio * ratio);
            severity = WeightedDraw.chance(directRedChance, rnd) ? CardSeverity.DIRECT_RED : CardSeverity.YELLOW;
        }

        Foul foul = new Foul(fouler, severity, weight, selection);
        double redChance = directRedChance;
        trace.record(() -> {
            Map<String, Object> inputs = new LinkedHashMap<>();
            inputs.put("minute", minute);
            inputs.put("eligible", weights.size());
            inputs.put("existingBookings", defending.bookingsOf(fouler.playerId()));
            Map<String, Object> computed = new LinkedHashMap<>();
            computed.put("weights", weights);
            computed.put("selectionProbability", selection);
            computed.put("directRedChance", redChance);
            Map<String, Object> outcome = new LinkedHashMap<>();
            outcome.put("playerId", fouler.playerId());
            outcome.put("severity", severity.name().toLowerCase(Locale.ROOT));
            return new AiTraceEvent(AiTraceType.FOUL_SELECTION, minute, defending.side(), severityOf(severity),
                    "Foul by " + fouler.displayName() + " (" + severity.name().toLowerCase(Locale.ROOT) + ")",
                    inputs, computed, outcome);
        });
        return Optional.of(foul);
    }

    private static TraceSeverity severityOf(CardSeverity severity) {
        return switch (severity) {
            case YELLOW -> TraceSeverity.INFO;
            case SECOND_YELLOW -> TraceSeverity.WARNING;
            case DIRECT_RED -> TraceSeverity.CRITICAL;
        };
    }
}
