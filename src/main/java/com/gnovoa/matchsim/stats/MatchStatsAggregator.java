package com.gnovoa.matchsim.stats;

import com.gnovoa.matchsim.events.MatchEvent;
import com.gnovoa.matchsim.events.MatchEventType;
import com.gnovoa.matchsim.model.TeamSide;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recomputes player match lines (minutes, goals, assists, bookings) and standing deltas from a
 * finished match's event log.
 *
 * <p>Pure: the same record always gives equal stats, so recomputing after a retry never double
 * counts.
 */
public final class MatchStatsAggregator {

    public static final int POINTS_FOR_WIN = 3;
    public static final int POINTS_FOR_DRAW = 1;

    private static final class Line {
        final String playerId;
        final TeamSide side;
        int onAt;
        Integer offAt;
        int goals, assists, ownGoals, yellows, reds;

        Line(String playerId, TeamSide side, int onAt) {
            this.playerId = playerId;
            this.side = side;
            this.onAt = onAt;
        }
    }

    public MatchStats aggregate(MatchRecord match) {
        Map<String, Line> lines = new LinkedHashMap<>();
        for (String id : match.homeStarters()) lines.put(id, new Line(id, TeamSide.HOME, 0));
        for (String id : match.awayStarters()) lines.put(id, new Line(id, TeamSide.AWAY, 0));

        int homeGoals = 0;
        int awayGoals = 0;
        int end = 0;

        for (MatchEvent e : match.events()) {
            int at = elapsed(e);
            end = Math.max(end, at);
            if (e.type().isScoring()) {
                if (e.team() == TeamSide.HOME) homeGoals++; else awayGoals++;
            }
            switch (e.type()) {
                case GOAL, PENALTY_SCORED -> {
                    line(lines, e.playerId(), e.team(), at).goals++;
                    if (e.assistPlayerId() != null) line(lines, e.assistPlayerId(), e.team(), at).assists++;
                }
                case OWN_GOAL -> line(lines, e.playerId(), e.team().opposite(), at).ownGoals++;
                case YELLOW_CARD -> line(lines, e.playerId(), e.team(), at).yellows++;
                case RED_CARD -> {
                    Line l = line(lines, e.playerId(), e.team(), at);
                    l.reds++;
                    l.offAt = at;
                }
                case SUBSTITUTION -> {
                    line(lines, e.assistPlayerId(), e.team(), at).offAt = at;
                    lines.computeIfAbsent(e.playerId(), id -> new Line(id, e.team(), at)).onAt = at;
                }
                default -> { }
            }
        }

        List<MatchStats.PlayerMatchLine> players = new ArrayList<>(lines.size());
        for (Line l : lines.values()) {
            int off = l.offAt == null ? end : l.offAt;
            players.add(new MatchStats.PlayerMatchLine(l.playerId, l.side, Math.max(0, off - l.onAt),
                    l.goals, l.assists, l.ownGoals, l.yellows, l.reds));
        }
        return new MatchStats(match.matchId(), List.copyOf(players),
                delta(match.homeTeamId(), homeGoals, awayGoals),
                delta(match.awayTeamId(), awayGoals, homeGoals));
    }

    /** Minutes since kickoff, counting stoppage minutes. */
    static int elapsed(MatchEvent e) {
        return e.minute() + e.addedTime();
    }

    private static Line line(Map<String, Line> lines, String playerId, TeamSide side, int at) {
        if (playerId == null) return new Line("?", side, at);
        return lines.computeIfAbsent(playerId, id -> new Line(id, side, at));
    }

    private static MatchStats.StandingDelta delta(String teamId, int goalsFor, int goalsAgainst) {
        boolean won = goalsFor > goalsAgainst;
        boolean drawn = goalsFor == goalsAgainst;
        return new MatchStats.StandingDelta(teamId, 1,
                won ? 1 : 0, drawn ? 1 : 0, !won && !drawn ? 1 : 0,
                goalsFor, goalsAgainst,
                won ? POINTS_FOR_WIN : drawn ? POINTS_FOR_DRAW : 0);
    }
}
