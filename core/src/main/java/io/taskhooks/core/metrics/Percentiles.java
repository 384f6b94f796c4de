package io.taskhooks.core.metrics;

/** Exact nearest-rank percentiles. */
public final class Percentiles {

    private Percentiles() {}

    /**
     * Returns the smallest value such that at least {@code percentile}% of the values are less than
     * or equal to it: element {@code ceil(p/100 * n)} (1-based) of the sorted values.
     *
     * @param sorted     values in ascending order
     * @param percentile in (0, 100]
     * @return the percentile value, or 0 when there are no values
     */
    public static long nearestRank(long[] sorted, double percentile) {
        if (percentile <= 0 || percentile > 100) {
            throw new IllegalArgumentException("percentile must be in (0, 100], got: " + percentile);
        }
        if (sorted.length == 0) {
            return 0;
        }
        int rank = (int) Math.ceil(percentile / 100.0 * sorted.length);
        return sorted[Math.max(rank, 1) - 1];
    }
}
