package com.gnovoa.matchsim.sim;

import com.gnovoa.matchsim.config.SimProperties;
import com.gnovoa.matchsim.model.Player;
import com.gnovoa.matchsim.model.PlayerAttributes;
import com.gnovoa.matchsim.model.Position;
import com.gnovoa.matchsim.model.Posture;

import java.util.Collection;
import java.util.function.ToDoubleFunction;

/**
 * Pure functions turning attributes and live state into the scalars the other models draw
 * against. No randomness and no state.
 */
public final class AttributeModel {

    /** Neutral rating used when a side has nobody left to rate. */
    public static final double NEUTRAL_RATING = 50.0;

    // energy -> penalty on effective rating; linear between the breakpoints
    private static final double[][] ENERGY_PENALTY_CURVE = {
            {0, 0.40},
            {40, 0.28},
            {55, 0.16},
            {70, 0.06},
            {85, 0.0},
    };

    private final SimProperties.Discipline discipline;
    private final SimProperties.Probability probability;

    public AttributeModel(SimProperties props) {
        this.discipline = props.discipline();
        this.probability = props.probability();
    }

    /** Position-weighted overall rating, rounded like the squad screens show it. */
    public int overall(Player player) {
        PlayerAttributes a = player.attributes();
        if (a == null || player.position() == null) return (int) NEUTRAL_RATING;
        double weighted = switch (player.position()) {
            case GK -> (a.reflexes() * 3 + a.handling() * 3 + a.diving() * 3 + a.positioning() * 2
                    + a.composure()) / 12.0;
            case DEF -> (a.tackling() * 3 + a.heading() * 2 + a.strength() * 2 + a.positioning() * 2
                    + a.speed()) / 10.0;
            case MID -> (a.passing() * 3 + a.vision() * 2 + a.stamina() * 2 + a.dribbling()
                    + a.positioning() + a.tackling()) / 10.0;
            case ATT -> (a.shooting() * 3 + a.positioning() * 2 + a.dribbling() * 2 + a.speed() * 2
                    + a.composure()) / 10.0;
        };
        return (int) Math.round(weighted);
    }

    /**
     * Fraction of a player's rating lost to fatigue: 0 from 85 energy upwards, 0.4 at 0.
     */
    public double energyPenalty(double energy) {
        double e = WeightedDraw.clamp(energy, 0, 100);
        if (e >= ENERGY_PENALTY_CURVE[ENERGY_PENALTY_CURVE.length - 1][0]) return 0.0;
        for (int i = 1; i < ENERGY_PENALTY_CURVE.length; i++) {
            double[] lo = ENERGY_PENALTY_CURVE[i - 1];
            double[] hi = ENERGY_PENALTY_CURVE[i];
            if (e <= hi[0]) {
                double t = (e - lo[0]) / (hi[0] - lo[0]);
                return lo[1] + t * (hi[1] - lo[1]);
            }
        }
        return 0.0;
    }

    public double effectiveRating(Player player, double energy) {
        return overall(player) * (1.0 - energyPenalty(energy));
    }

    /**
     * Average effective rating of the players on the pitch, shifted by posture and penalised
     * per dismissed player.
     */
    public double teamStrength(Collection<Player> onPitch, ToDoubleFunction<Player> energyOf,
                               Posture posture, int sentOffCount, double redCardPenalty) {
        if (onPitch.isEmpty()) return NEUTRAL_RATING;
        double sum = 0;
        for (Player p : onPitch) sum += effectiveRating(p, energyOf.applyAsDouble(p));
        double postureBonus = switch (posture) {
            case ATTACKING -> probability.postureStrengthBonus();
            case DEFENSIVE -> -probability.postureStrengthBonus();
            case BALANCED -> 0;
        };
        return sum / onPitch.size() + postureBonus - sentOffCount * redCardPenalty;
    }

    /**
     * Relative likelihood that {@code player} commits the foul. Grows with aggression, lack of
     * composure, tiredness, bookings already held and the minute. Goalkeepers rarely qualify.
     */
    public double foulPropensity(Player player, double energy, int bookings, int minute) {
        PlayerAttributes a = player.attributes();
        double aggression = a.aggression() / 99.0;
        double composureGap = 1.0 - a.composure() / 99.0;
        double energyDeficit = (100.0 - WeightedDraw.clamp(energy, 0, 100)) / 100.0;
        double lateness = Math.min(1.2, Math.max(0, minute) / 90.0);

        double base = 0.1
                + discipline.aggressionWeight() * aggression
                + discipline.composureWeight() * composureGap
                + discipline.energyDeficitWeight() * energyDeficit
                + discipline.latenessWeight() * lateness;
        double weight = base * (1.0 + discipline.bookingWeight() * Math.max(0, bookings));
        return player.position() == Position.GK ? weight * discipline.goalkeeperFoulFactor() : weight;
    }

    public double finishingQuality(Player player, double energy) {
        PlayerAttributes a = player.attributes();
        double raw = (a.shooting() * 3 + a.positioning() * 2 + a.composure()) / 6.0;
        return raw * (1.0 - energyPenalty(energy));
    }

    public double scorerWeight(Player player, double energy) {
        PlayerAttributes a = player.attributes();
        return (a.shooting() + a.positioning()) * (1.0 - energyPenalty(energy));
    }

    public double assistWeight(Player player) {
        PlayerAttributes a = player.attributes();
        return a.passing() + a.vision() + a.dribbling() / 2.0;
    }

    public double defensiveContribution(Player player) {
        PlayerAttributes a = player.attributes();
        return (a.tackling() * 2 + a.positioning() + a.strength() + a.heading()) / 5.0;
    }

    public double goalkeeping(Player goalkeeper) {
        PlayerAttributes a = goalkeeper.attributes();
        return (a.reflexes() + a.handling() + a.diving()) / 3.0;
    }

    public double penaltyTakerScore(Player player) {
        PlayerAttributes a = player.attributes();
        return a.shooting() * 0.5 + a.composure() * 0.3 + a.positioning() * 0.2;
    }

    /**
     * Penalty conversion of a taker against a goalkeeper, clamped to the configured band. A
     * missing goalkeeper counts as a very weak one.
     */
    public double penaltyConversion(Player taker, Player goalkeeper) {
        return WeightedDraw.clamp(rawPenaltyConversion(taker, goalkeeper),
                probability.minPenaltyConversion(), probability.maxPenaltyConversion());
    }

    public double rawPenaltyConversion(Player taker, Player goalkeeper) {
        double takerEdge = (penaltyTakerScore(taker) - 70) / 100.0 * probability.penaltyTakerFactor();
        double keeperEdge = goalkeeper == null
                ? probability.missingKeeperEdge()
                : (goalkeeping(goalkeeper) - 70) / 100.0 * probability.penaltyKeeperFactor();
        return probability.penaltyBaseConversion() + takerEdge - keeperEdge;
    }
}
