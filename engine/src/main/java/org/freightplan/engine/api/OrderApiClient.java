package org.freightplan.engine.api;

import org.freightplan.engine.domain.model.Order;
import org.freightplan.engine.domain.model.OrderAssignment;
import org.freightplan.engine.domain.model.OrderStatus;

import java.util.List;
import java.util.Optional;

/**
 * Client interface for the order store.
 */
public interface OrderApiClient {

    /**
     * Get all orders still waiting for assignment.
     */
    List<Order> getPendingOrders();

    /**
     * Get one order by id.
     */
    Optional<Order> getOrder(String orderId);

    /**
     * Persist an assignment record.
     *
     * @return true if the record was stored
     */
    boolean saveAssignment(OrderAssignment assignment);

    /**
     * Update an order's status.
     *
     * @return true if the update was accepted
     */
    boolean updateOrderStatus(String orderId, OrderStatus status);
}
