package com.gnovoa.matchsim.sim;

/**
 * Random stream used by the match models. One instance belongs to exactly one match.
 */
public interface RandomSource {

    int nextIntInclusive(int fromInclusive, int toInclusive);

    /** @return a value in [0, 1). */
    double nextDouble();
}
