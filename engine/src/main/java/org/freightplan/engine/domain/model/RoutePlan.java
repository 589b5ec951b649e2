package org.freightplan.engine.domain.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Solver output: one route per vehicle, or nothing when no feasible solution was found in time.
 */
public final class RoutePlan {

    public enum Outcome {
        SOLVED,
        NO_SOLUTION
    }

    private static final RoutePlan NO_SOLUTION = new RoutePlan(Outcome.NO_SOLUTION, Collections.emptyList(), 0L);

    private final Outcome outcome;
    private final List<VehicleRoute> routes;
    private final long objective;

    private RoutePlan(Outcome outcome, List<VehicleRoute> routes, long objective) {
        this.outcome = outcome;
        this.routes = routes;
        this.objective = objective;
    }

    public static RoutePlan solved(List<VehicleRoute> routes, long objective) {
        Objects.requireNonNull(routes, "routes must not be null");
        return new RoutePlan(Outcome.SOLVED, Collections.unmodifiableList(routes), objective);
    }

    public static RoutePlan noSolution() {
        return NO_SOLUTION;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isSolved() {
        return outcome == Outcome.SOLVED;
    }

    public List<VehicleRoute> getRoutes() {
        return routes;
    }

    /**
     * Solver objective: arc length in metres plus the penalty of every dropped node.
     */
    public long getObjective() {
        return objective;
    }

    @Override
    public String toString() {
        return "RoutePlan{" + outcome + ", routes=" + routes.size() + ", objective=" + objective + "}";
    }
}
