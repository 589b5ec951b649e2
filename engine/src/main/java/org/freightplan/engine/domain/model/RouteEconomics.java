package org.freightplan.engine.domain.model;

/**
 * Revenue, cost breakdown and profit of a route candidate.
 * Profit is always exactly revenue minus the sum of the cost components.
 */
public final class RouteEconomics {

    private final double revenue;
    private final double fuelCost;
    private final double driverCost;
    private final double maintenanceCost;
    private final double overheadCost;
    private final double cost;
    private final double profit;
    private final double margin;

    public RouteEconomics(double revenue, double fuelCost, double driverCost,
                          double maintenanceCost, double overheadCost) {
        this.revenue = revenue;
        this.fuelCost = fuelCost;
        this.driverCost = driverCost;
        this.maintenanceCost = maintenanceCost;
        this.overheadCost = overheadCost;
        this.cost = fuelCost + driverCost + maintenanceCost + overheadCost;
        this.profit = revenue - cost;
        this.margin = revenue > 0 ? profit / revenue : 0.0;
    }

    public double getRevenue() {
        return revenue;
    }

    public double getFuelCost() {
        return fuelCost;
    }

    public double getDriverCost() {
        return driverCost;
    }

    public double getMaintenanceCost() {
        return maintenanceCost;
    }

    public double getOverheadCost() {
        return overheadCost;
    }

    public double getCost() {
        return cost;
    }

    public double getProfit() {
        return profit;
    }

    /**
     * Profit divided by revenue, 0 when there is no revenue.
     */
    public double getMargin() {
        return margin;
    }

    @Override
    public String toString() {
        return String.format("RouteEconomics{revenue=%.2f, cost=%.2f, profit=%.2f, margin=%.2f%%}",
                revenue, cost, profit, margin * 100);
    }
}
