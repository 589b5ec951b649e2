package org.freightplan.engine.domain.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Evaluated route: the candidate, its economics and the acceptance decision.
 */
public final class RouteMetrics {

    /** Most profitable first. */
    public static final Comparator<RouteMetrics> BY_PROFIT_DESC =
            Comparator.comparingDouble((RouteMetrics m) -> m.getEconomics().getProfit()).reversed();

    private final RouteCandidate candidate;
    private final RouteEconomics economics;
    private final boolean accepted;
    private final String rejectionReason;

    private RouteMetrics(RouteCandidate candidate, RouteEconomics economics, boolean accepted, String rejectionReason) {
        this.candidate = Objects.requireNonNull(candidate, "candidate must not be null");
        this.economics = Objects.requireNonNull(economics, "economics must not be null");
        this.accepted = accepted;
        this.rejectionReason = rejectionReason;
    }

    public static RouteMetrics accepted(RouteCandidate candidate, RouteEconomics economics) {
        return new RouteMetrics(candidate, economics, true, null);
    }

    public static RouteMetrics rejected(RouteCandidate candidate, RouteEconomics economics, String reason) {
        return new RouteMetrics(candidate, economics, false, Objects.requireNonNull(reason, "reason must not be null"));
    }

    public RouteCandidate getCandidate() {
        return candidate;
    }

    public RouteEconomics getEconomics() {
        return economics;
    }

    public boolean isAccepted() {
        return accepted;
    }

    /**
     * Why the route was dropped, or null when it was accepted.
     */
    public String getRejectionReason() {
        return rejectionReason;
    }

    @Override
    public String toString() {
        return "RouteMetrics{" + candidate + ", " + economics + (accepted ? ", accepted" : ", rejected: " + rejectionReason) + '}';
    }
}
