package com.gnovoa.matchsim.trace;

import java.util.function.Supplier;

/**
 * Optional side channel the models report their computations to.
 *
 * <p>Models must build trace payloads only through {@link #record(Supplier)} so that a disabled
 * recorder costs nothing, and must never branch on the recorder in a way that changes random
 * draws: the simulation behaves identically with or without tracing.
 */
public interface TraceRecorder {

    boolean enabled();

    void record(AiTraceEvent event);

    default void record(Supplier<AiTraceEvent> event) {
        if (enabled()) record(event.get());
    }

    static TraceRecorder disabled() {
        return Disabled.INSTANCE;
    }

    enum Disabled implements TraceRecorder {
        INSTANCE;

        @Override public boolean enabled() { return false; }
        @Override public void record(AiTraceEvent event) { }
    }
}
