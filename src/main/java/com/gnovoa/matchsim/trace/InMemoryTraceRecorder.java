package com.gnovoa.matchsim.trace;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded, append-only trace buffer for one match. When full, the oldest entries are dropped.
 *
 * <p>Synchronized because the API may read while a paced ticker appends.
 */
public final class InMemoryTraceRecorder implements TraceRecorder {

    public static final int DEFAULT_MAX_EVENTS = 5_000;

    private final int maxEvents;
    private final Deque<AiTraceEvent> events = new ArrayDeque<>();
    private long dropped = 0;

    public InMemoryTraceRecorder() {
        this(DEFAULT_MAX_EVENTS);
    }

    public InMemoryTraceRecorder(int maxEvents) {
        if (maxEvents <= 0) throw new IllegalArgumentException("maxEvents must be positive");
        this.maxEvents = maxEvents;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public synchronized void record(AiTraceEvent event) {
        events.addLast(event);
        while (events.size() > maxEvents) {
            events.removeFirst();
            dropped++;
        }
    }

    public synchronized List<AiTraceEvent> events() {
        return List.copyOf(events);
    }

    public synchronized List<AiTraceEvent> query(TraceQuery query) {
        return events.stream().filter(query::matches).toList();
    }

    public synchronized Map<AiTraceType, Integer> countsByType() {
        Map<AiTraceType, Integer> counts = new EnumMap<>(AiTraceType.class);
        for (AiTraceType t : AiTraceType.values()) counts.put(t, 0);
        for (AiTraceEvent e : events) counts.merge(e.type(), 1, Integer::sum);
        return counts;
    }

    /** @return number of entries evicted because the buffer was full. */
    public synchronized long dropped() {
        return dropped;
    }
}
