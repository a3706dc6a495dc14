package com.gnovoa.matchsim.sim;

import com.gnovoa.matchsim.model.Formation;
import com.gnovoa.matchsim.model.Posture;

/**
 * Tactical modifiers of one side against its opponent, each clamped to [-0.2, 0.2].
 *
 * @param possession shift of the possession share
 * @param creation shift of chance creation (trigger and conversion for the attacking side)
 * @param prevention shift of chance prevention (conversion against the side)
 */
public record TacticalImpact(double possession, double creation, double prevention) {

    public static final double MIN = -0.2;
    public static final double MAX = 0.2;

    public static final TacticalImpact NEUTRAL = new TacticalImpact(0, 0, 0);

    public static TacticalImpact posture(Posture posture) {
        return switch (posture) {
            case DEFENSIVE -> new TacticalImpact(-0.03, -0.06, 0.08);
            case BALANCED -> NEUTRAL;
            case ATTACKING -> new TacticalImpact(0.03, 0.08, -0.06);
        };
    }

    /** Line-count matchup: numbers in midfield win the ball, attackers against defenders create. */
    public static TacticalImpact formationMatchup(Formation own, Formation opponent) {
        double possession = (own.midfielders() - opponent.midfielders()) * 0.012
                + (own.defenders() - opponent.attackers()) * 0.006
                + (own.attackers() - opponent.defenders()) * 0.004;
        double creation = (own.attackers() - opponent.defenders()) * 0.018
                + (own.midfielders() - opponent.midfielders()) * 0.008;
        double prevention = (own.defenders() - opponent.attackers()) * 0.018
                + (own.midfielders() - opponent.midfielders()) * 0.006;
        return new TacticalImpact(possession, creation, prevention).clamped();
    }

    public static TacticalImpact of(Posture posture, Formation own, Formation opponent) {
        return posture(posture).plus(formationMatchup(own, opponent));
    }

    public TacticalImpact plus(TacticalImpact other) {
        return new TacticalImpact(
                possession + other.possession,
                creation + other.creation,
                prevention + other.prevention).clamped();
    }

    private TacticalImpact clamped() {
        return new TacticalImpact(
                WeightedDraw.clamp(possession, MIN, MAX),
                WeightedDraw.clamp(creation, MIN, MAX),
                WeightedDraw.clamp(prevention, MIN, MAX));
    }
}
