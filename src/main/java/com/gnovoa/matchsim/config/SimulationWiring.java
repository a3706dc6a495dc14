package com.gnovoa.matchsim.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.matchsim.core.FixtureRuntimeFactory;
import com.gnovoa.matchsim.core.MatchFactory;
import com.gnovoa.matchsim.core.MatchModels;
import com.gnovoa.matchsim.core.TacticsValidator;
import com.gnovoa.matchsim.out.EventPublisher;
import com.gnovoa.matchsim.rosters.DefaultTactics;
import com.gnovoa.matchsim.rosters.RosterCatalog;
import com.gnovoa.matchsim.stats.EventLogReducer;
import com.gnovoa.matchsim.stats.MatchStatsAggregator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/** Builds the plain-Java engine objects from {@link SimProperties}. */
@Configuration
public class SimulationWiring {

    @Bean
    public MatchModels matchModels(SimProperties simProps) {
        return MatchModels.from(simProps);
    }

    @Bean
    public MatchFactory matchFactory(MatchModels models) {
        return new MatchFactory(models, new TacticsValidator());
    }

    @Bean
    public FixtureRuntimeFactory fixtureRuntimeFactory(MatchFactory matches, EventPublisher publisher, SimProperties simProps) {
        return new FixtureRuntimeFactory(matches, publisher, simProps);
    }

    @Bean
    public RosterCatalog rosterCatalog(ObjectMapper mapper, ResourceLoader resourceLoader, SimProperties simProps) {
        return new RosterCatalog(mapper, resourceLoader, simProps);
    }

    @Bean
    public DefaultTactics defaultTactics(MatchModels models) {
        return new DefaultTactics(models.attributes());
    }

    @Bean
    public MatchStatsAggregator matchStatsAggregator() {
        return new MatchStatsAggregator();
    }

    @Bean
    public EventLogReducer eventLogReducer() {
        return new EventLogReducer();
    }
}
