package com.gnovoa.matchsim.stats;

import com.gnovoa.matchsim.events.MatchEvent;
import com.gnovoa.matchsim.model.TeamSide;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pure reducer replaying the append-only event log into a {@link Scoreboard}.
 *
 * <p>{@code reduce(reduce(s, a), b)} equals replaying {@code [a, b]} from {@code s}, so clients
 * can fold new events into a cached view as they arrive.
 */
public final class EventLogReducer {

    public Scoreboard replay(List<MatchEvent> events) {
        return replay(events, Integer.MAX_VALUE);
    }

    /** Replays events up to and including {@code upToMinute} (stoppage events count as 90). */
    public Scoreboard replay(List<MatchEvent> events, int upToMinute) {
        Scoreboard view = Scoreboard.EMPTY;
        for (MatchEvent e : events) {
            if (e.minute() > upToMinute) break;
            view = reduce(view, e);
        }
        return view;
    }

    public Scoreboard reduce(Scoreboard view, MatchEvent e) {
        int home = view.homeScore();
        int away = view.awayScore();
        Map<String, Integer> bookings = new LinkedHashMap<>(view.bookings());
        Set<String> sentOff = new LinkedHashSet<>(view.sentOff());
        int homeSubs = view.homeSubsUsed();
        int awaySubs = view.awaySubsUsed();
        List<MatchEvent> substitutions = view.substitutions();

        if (e.type().isScoring()) {
            if (e.team() == TeamSide.HOME) home++; else away++;
        }
        switch (e.type()) {
            case YELLOW_CARD -> bookings.merge(e.playerId(), 1, Integer::sum);
            case RED_CARD -> {
                bookings.put(e.playerId(), 2);
                sentOff.add(e.playerId());
            }
            case SUBSTITUTION -> {
                if (e.team() == TeamSide.HOME) homeSubs++; else awaySubs++;
                substitutions = append(substitutions, e);
            }
            default -> { }
        }

        return new Scoreboard(
                phaseAfter(view.phase(), e),
                e.minute(),
                e.addedTime(),
                home,
                away,
                Collections.unmodifiableMap(bookings),
                Collections.unmodifiableSet(sentOff),
                homeSubs,
                awaySubs,
                substitutions,
                append(view.events(), e));
    }

    private static String phaseAfter(String phase, MatchEvent e) {
        return switch (e.type()) {
            case KICKOFF -> "first_half";
            case HALF_TIME -> "half_time";
            case FULL_TIME -> "full_time";
            default -> "half_time".equals(phase) && e.minute() > 45 ? "second_half" : phase;
        };
    }

    private static List<MatchEvent> append(List<MatchEvent> list, MatchEvent e) {
        List<MatchEvent> next = new ArrayList<>(list.size() + 1);
        next.addAll(list);
        next.add(e);
        return Collections.unmodifiableList(next);
    }
}
