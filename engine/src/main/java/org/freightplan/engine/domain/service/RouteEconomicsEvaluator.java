package org.freightplan.engine.domain.service;

import org.freightplan.engine.domain.model.Order;
import org.freightplan.engine.domain.model.RouteCandidate;
import org.freightplan.engine.domain.model.RouteEconomics;
import org.freightplan.engine.domain.model.RouteMetrics;

import java.util.List;

/**
 * Prices and costs route candidates and decides which are worth running.
 */
public interface RouteEconomicsEvaluator {

    /**
     * Revenue the order earns when carried over a route of the given length.
     */
    double orderRevenue(Order order, double routeDistanceKm);

    /**
     * Compute revenue, cost breakdown and profit of one candidate.
     */
    RouteEconomics evaluate(RouteCandidate candidate);

    /**
     * Evaluate every candidate, accept or reject each, and rank them by descending profit.
     *
     * @return metrics for all candidates, accepted and rejected, most profitable first
     */
    List<RouteMetrics> evaluateAll(List<RouteCandidate> candidates);
}
