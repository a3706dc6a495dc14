package com.gnovoa.matchsim.sim;

import java.util.ArrayDeque;
import java.util.Deque;

/** Replays fixed draws and fails on any draw that was not scripted. */
public final class ScriptedRandomSource implements RandomSource {

    private final Deque<Double> doubles = new ArrayDeque<>();
    private int consumed = 0;

    public ScriptedRandomSource(double... values) {
        for (double v : values) doubles.addLast(v);
    }

    @Override
    public int nextIntInclusive(int fromInclusive, int toInclusive) {
        consumed++;
        return fromInclusive;
    }

    @Override
    public double nextDouble() {
        if (doubles.isEmpty()) throw new IllegalStateException("unscripted draw #" + (consumed + 1));
        consumed++;
        return doubles.removeFirst();
    }

    public int consumed() {
        return consumed;
    }

    public int remaining() {
        return doubles.size();
    }
}
