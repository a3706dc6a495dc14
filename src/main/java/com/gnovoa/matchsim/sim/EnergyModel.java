package com.gnovoa.matchsim.sim;

import com.gnovoa.matchsim.config.SimProperties;
import com.gnovoa.matchsim.model.Player;
import com.gnovoa.matchsim.model.Position;
import com.gnovoa.matchsim.model.Posture;

/**
 * Per-minute live energy decay. Deterministic and pure; the result never exceeds the input.
 */
public final class EnergyModel {

    private final SimProperties.Energy config;

    public EnergyModel(SimProperties.Energy config) {
        this.config = config;
    }

    /**
     * @param minutesPlayed minutes the player has been on the pitch in this match, including the
     *     one being played
     * @return energy after one more minute, clamped to [0, energy]
     */
    public double decay(Player player, double energy, int minutesPlayed, Posture posture) {
        double current = WeightedDraw.clamp(energy, 0, 100);
        double next = current - drainPerMinute(player, posture, minutesPlayed);
        return WeightedDraw.clamp(next, 0, current);
    }

    public double drainPerMinute(Player player, Posture posture, int minutesPlayed) {
        double stamina = player.attributes().stamina();
        double staminaFactor = 1.5 - WeightedDraw.clamp(stamina, 1, 99) / 99.0;
        double lateFactor = minutesPlayed >= config.lateMatchMinute() ? config.lateMatchMultiplier() : 1.0;
        double keeperFactor = player.position() == Position.GK ? config.goalkeeperMultiplier() : 1.0;

        return config.baseDrainPerMinute()
                * staminaFactor
                * ageFactor(player.age())
                * postureFactor(player.position(), posture)
                * lateFactor
                * keeperFactor;
    }

    /** 1.0 up to 24, then +0.25 over nine years, capped at 1.35. */
    static double ageFactor(int age) {
        if (age <= 24) return 1.0;
        return Math.min(1.35, 1.0 + (age - 24) * (0.25 / 9));
    }

    /** The line a posture leans on works harder; the opposite line gets a little relief. */
    double postureFactor(Position position, Posture posture) {
        double shift = config.postureDrainShift();
        return switch (posture) {
            case BALANCED -> 1.0;
            case ATTACKING -> switch (position) {
                case ATT -> 1.0 + shift;
                case MID -> 1.0 + shift / 2;
                case DEF -> 1.0 - shift / 4;
                case GK -> 1.0;
            };
            case DEFENSIVE -> switch (position) {
                case DEF -> 1.0 + shift;
                case MID -> 1.0 + shift / 2;
                case ATT -> 1.0 - shift / 4;
                case GK -> 1.0;
            };
        };
    }
}
