package com.gnovoa.matchsim.sim;

import com.fasterxml.jackson.annotation.JsonValue;
import com.gnovoa.matchsim.model.Formation;
import com.gnovoa.matchsim.model.Posture;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Qualitative hints for the half-time screen. Exposes hint keys only, never the coefficients
 * behind them.
 */
public final class HalfTimeAdvisor {

    /** Matchup impacts smaller than this in either direction read as neutral. */
    static final double BUCKET_THRESHOLD = 0.02;

    public enum Situation {
        WINNING, DRAWING, LOSING;

        @JsonValue
        public String wire() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * @param goalDifference absolute goal difference
     */
    public record HalfTimeHints(
            Situation situation,
            int goalDifference,
            Map<String, String> postureHints,
            List<String> formationMatchupHints
    ) {}

    public HalfTimeHints hints(int ownScore, int opponentScore, Formation own, Formation opponent) {
        int diff = ownScore - opponentScore;
        Situation situation = diff > 0 ? Situation.WINNING : diff < 0 ? Situation.LOSING : Situation.DRAWING;

        Map<String, String> postureHints = new LinkedHashMap<>();
        postureHints.put(Posture.DEFENSIVE.wire(), "increases_prevention");
        postureHints.put(Posture.BALANCED.wire(), "neutral");
        postureHints.put(Posture.ATTACKING.wire(), "increases_creation");

        TacticalImpact matchup = TacticalImpact.formationMatchup(own, opponent);
        List<String> matchupHints = new ArrayList<>();
        bucket(matchup.creation(), "attack_favourable", "attack_under_pressure", matchupHints);
        bucket(matchup.prevention(), "defence_favourable", "defence_under_pressure", matchupHints);
        bucket(matchup.possession(), "midfield_favourable", "midfield_under_pressure", matchupHints);
        if (matchupHints.isEmpty()) matchupHints.add("neutral");

        return new HalfTimeHints(situation, Math.abs(diff), Collections.unmodifiableMap(postureHints), List.copyOf(matchupHints));
    }

    private static void bucket(double value, String high, String low, List<String> out) {
        if (value >= BUCKET_THRESHOLD) out.add(high);
        else if (value <= -BUCKET_THRESHOLD) out.add(low);
    }
}
