package org.freightplan.engine.domain.service;

import org.freightplan.engine.domain.model.EconomicsConfig;
import org.freightplan.engine.domain.model.Order;
import org.freightplan.engine.domain.model.RouteCandidate;
import org.freightplan.engine.domain.model.RouteEconomics;
import org.freightplan.engine.domain.model.RouteMetrics;
import org.freightplan.engine.domain.model.SpecialRequirement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Implementation of RouteEconomicsEvaluator.
 *
 * Revenue per order: base rate x weight x max(1, km x distance factor) x (1 + surcharges).
 * Cost per route: fuel and maintenance per km, driver per hour, overhead fixed plus per hour.
 */
public final class RouteEconomicsEvaluatorImpl implements RouteEconomicsEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RouteEconomicsEvaluatorImpl.class);

    private final EconomicsConfig config;

    public RouteEconomicsEvaluatorImpl(EconomicsConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    @Override
    public double orderRevenue(Order order, double routeDistanceKm) {
        double distanceFactor = Math.max(1.0, routeDistanceKm * config.getDistanceFactorPerKm());
        double multiplier = 1.0;
        for (SpecialRequirement requirement : order.getSpecialRequirements()) {
            multiplier += config.getSurcharge(requirement);
        }
        return config.getBaseRatePerKg() * order.getWeightKg() * distanceFactor * multiplier;
    }

    @Override
    public RouteEconomics evaluate(RouteCandidate candidate) {
        double km = candidate.getTotalDistanceKm();
        double hours = candidate.getTotalTimeHours();

        double revenue = 0.0;
        for (Order order : candidate.getOrders()) {
            revenue += orderRevenue(order, km);
        }

        double fuel = km * config.getFuelCostPerKm();
        double driver = hours * config.getDriverCostPerHour();
        double maintenance = km * config.getMaintenanceCostPerKm();
        double overhead = config.getOverheadFixed() + hours * config.getOverheadPerHour();
        return new RouteEconomics(revenue, fuel, driver, maintenance, overhead);
    }

    @Override
    public List<RouteMetrics> evaluateAll(List<RouteCandidate> candidates) {
        List<RouteMetrics> metrics = new ArrayList<>(candidates.size());
        for (RouteCandidate candidate : candidates) {
            RouteEconomics economics = evaluate(candidate);
            String reason = rejectionReason(economics);
            if (reason == null) {
                metrics.add(RouteMetrics.accepted(candidate, economics));
            } else {
                log.info("Rejected route for truck {}: {} (profit {})", candidate.getTruck().getId(), reason,
                        String.format("%.2f", economics.getProfit()));
                metrics.add(RouteMetrics.rejected(candidate, economics, reason));
            }
        }
        metrics.sort(RouteMetrics.BY_PROFIT_DESC);
        return metrics;
    }

    private String rejectionReason(RouteEconomics economics) {
        if (!(economics.getProfit() > 0)) {
            return "unprofitable";
        }
        double floor = config.getMinProfitMargin();
        if (economics.getMargin() < floor) {
            return String.format("margin %.1f%% below minimum %.1f%%", economics.getMargin() * 100, floor * 100);
        }
        return null;
    }
}
