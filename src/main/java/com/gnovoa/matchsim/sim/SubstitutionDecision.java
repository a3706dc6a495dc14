package com.gnovoa.matchsim.sim;

import com.gnovoa.matchsim.core.SubstitutionReason;
import com.gnovoa.matchsim.model.Player;

/**
 * A substitution the policy wants to make.
 *
 * @param gap size of the winning gap (energy, defensive contribution or overall), larger is more
 *     urgent
 */
public record SubstitutionDecision(
        SubstitutionReason reason,
        Player outgoing,
        Player incoming,
        double outgoingEnergy,
        double incomingEnergy,
        double gap
) {}
