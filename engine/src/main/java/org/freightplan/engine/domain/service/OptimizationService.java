package org.freightplan.engine.domain.service;

import org.freightplan.engine.domain.model.OptimizationResult;
import org.freightplan.engine.domain.model.Order;

import java.util.List;

/**
 * Service assigning orders to trucks and trailers on profitable routes.
 */
public interface OptimizationService {

    /**
     * Optimize one batch of orders against the currently available fleet.
     * Collaborator failures degrade the result but never throw.
     *
     * @param orders orders to place
     * @return assignments made, orders left unassigned with reasons, and route metrics
     */
    OptimizationResult optimize(List<Order> orders);

    /**
     * Fetch every pending order and optimize them as one batch.
     * Called by the scheduler every N seconds.
     */
    OptimizationResult optimizePending();

    /**
     * Optimize a single pending order on its own.
     *
     * @return empty result if the order is unknown or no longer pending
     */
    OptimizationResult optimizeOrder(String orderId);
}
