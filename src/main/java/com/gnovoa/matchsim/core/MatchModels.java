package com.gnovoa.matchsim.core;

import com.gnovoa.matchsim.config.SimProperties;
import com.gnovoa.matchsim.sim.AttributeModel;
import com.gnovoa.matchsim.sim.DisciplineModel;
import com.gnovoa.matchsim.sim.EnergyModel;
import com.gnovoa.matchsim.sim.HalfTimeAdvisor;
import com.gnovoa.matchsim.sim.ProbabilityEngine;
import com.gnovoa.matchsim.sim.SubstitutionPolicy;

/**
 * The stateless match models, built once from configuration and shared by every match.
 */
public record MatchModels(
        SimProperties properties,
        AttributeModel attributes,
        EnergyModel energy,
        DisciplineModel discipline,
        ProbabilityEngine probability,
        SubstitutionPolicy substitutions,
        HalfTimeAdvisor halfTime
) {

    public static MatchModels from(SimProperties props) {
        AttributeModel attributes = new AttributeModel(props);
        DisciplineModel discipline = new DisciplineModel(attributes, props.discipline());
        return new MatchModels(
                props,
                attributes,
                new EnergyModel(props.energy()),
                discipline,
                new ProbabilityEngine(attributes, discipline, props.probability()),
                new SubstitutionPolicy(attributes, props.substitution()),
                new HalfTimeAdvisor());
    }
}
