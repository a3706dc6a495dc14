package com.gnovoa.matchsim.out;

import com.gnovoa.matchsim.events.LiveMatchUpdate;

/** Receives every event a match appends, in append order. */
public interface EventPublisher {

    EventPublisher NOOP = update -> { };

    void publish(LiveMatchUpdate update);
}
