package org.freightplan.engine.domain.service;

import org.freightplan.engine.domain.model.RoutePlan;
import org.freightplan.engine.domain.model.RoutingProblem;

/**
 * Capacitated vehicle routing with time windows.
 */
public interface RoutingSolver {

    /**
     * Solve within the problem's time limit.
     *
     * @return the best plan found, or {@link RoutePlan#noSolution()}; never throws
     */
    RoutePlan solve(RoutingProblem problem);
}
