package com.gnovoa.matchsim.sim;

/** Card shown for a foul. {@link #SECOND_YELLOW} is emitted as a red card. */
public enum CardSeverity {
    YELLOW,
    SECOND_YELLOW,
    DIRECT_RED;

    public boolean dismisses() {
        return this != YELLOW;
    }
}
