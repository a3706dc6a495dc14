package com.gnovoa.matchsim.core;

import java.util.List;

/** A round of independent matches, ticked together on one pacing schedule. */
public interface FixtureRuntime {
    String fixtureId();

    List<RunningMatch> matches(); // for API mapping

    List<MatchEngine> engines();

    boolean isFinished();
    void start();
    void stop();
    void onFinished(Runnable callback);

    record RunningMatch(String matchId, String homeTeam, String awayTeam) {}
}
