package org.freightplan.engine.domain.model;

/**
 * Service window at a node, in minutes from route start.
 */
public final class TimeWindow {

    private final long earliest;
    private final long latest;

    public TimeWindow(long earliest, long latest) {
        if (earliest < 0 || latest < earliest) {
            throw new IllegalArgumentException("invalid time window [" + earliest + ", " + latest + "]");
        }
        this.earliest = earliest;
        this.latest = latest;
    }

    public long getEarliest() {
        return earliest;
    }

    public long getLatest() {
        return latest;
    }

    /**
     * Returns whichever of the two windows closes first.
     */
    public TimeWindow tighten(TimeWindow other) {
        return other.latest < latest ? other : this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeWindow)) {
            return false;
        }
        TimeWindow that = (TimeWindow) o;
        return earliest == that.earliest && latest == that.latest;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(earliest) * 31 + Long.hashCode(latest);
    }

    @Override
    public String toString() {
        return "[" + earliest + ", " + latest + "]";
    }
}
