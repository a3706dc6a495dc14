package com.gnovoa.matchsim.sim;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Weighted categorical draw shared by every random selection in the match (event category,
 * conversion outcome, fouler, scorer, assister).
 *
 * <p>Weights that are negative, NaN or infinite count as zero. A draw over no positive weight
 * returns empty without consuming randomness. Candidate order decides ties, so callers pass
 * candidates in a stable order (usually by player id).
 */
public final class WeightedDraw {

    private WeightedDraw() {}

    public record Candidate<T>(T value, double weight) {}

    /**
     * @param roll the scaled roll in [0, totalWeight) that selected the value
     */
    public record Result<T>(T value, int index, double roll, double totalWeight) {

        public double probability(double weight) {
            return totalWeight <= 0 ? 0 : weight / totalWeight;
        }
    }

    public static <T> Optional<Result<T>> draw(List<Candidate<T>> candidates, RandomSource rnd) {
        if (candidates == null || candidates.isEmpty()) return Optional.empty();

        double total = 0;
        for (Candidate<T> c : candidates) total += sanitize(c.weight());
        if (total <= 0) return Optional.empty();

        double roll = rnd.nextDouble() * total;
        double cumulative = 0;
        int lastPositive = -1;
        for (int i = 0; i < candidates.size(); i++) {
            double w = sanitize(candidates.get(i).weight());
            if (w <= 0) continue;
            lastPositive = i;
            cumulative += w;
            if (roll < cumulative) {
                return Optional.of(new Result<>(candidates.get(i).value(), i, roll, total));
            }
        }
        // rounding left the roll just past the last bucket
        return Optional.of(new Result<>(candidates.get(lastPositive).value(), lastPositive, roll, total));
    }

    /** Sorts {@code items} by {@code order}, weighs them and draws one. */
    public static <T> Optional<Result<T>> draw(List<T> items, ToDoubleFunction<T> weight,
                                               Comparator<? super T> order, RandomSource rnd) {
        List<T> sorted = new ArrayList<>(items);
        sorted.sort(order);
        List<Candidate<T>> candidates = new ArrayList<>(sorted.size());
        for (T item : sorted) candidates.add(new Candidate<>(item, weight.applyAsDouble(item)));
        return draw(candidates, rnd);
    }

    /** Bernoulli draw against a clamped probability. Always consumes exactly one value. */
    public static boolean chance(double probability, RandomSource rnd) {
        return rnd.nextDouble() < clamp01(probability);
    }

    public static double clamp01(double p) {
        return clamp(p, 0.0, 1.0);
    }

    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) return min;
        return Math.max(min, Math.min(max, value));
    }

    private static double sanitize(double weight) {
        if (Double.isNaN(weight) || Double.isInfinite(weight) || weight < 0) return 0;
        return weight;
    }
}
