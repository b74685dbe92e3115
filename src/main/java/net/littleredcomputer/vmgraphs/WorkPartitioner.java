package net.littleredcomputer.vmgraphs;

import com.google.common.collect.ImmutableList;

/**
 * Static, order-preserving division of the variables to process among worker threads.
 */
public final class WorkPartitioner {
    private WorkPartitioner() {}

    /**
     * @throws GraphGenerationException with stage {@code THREADS} unless
     * {@code 1 <= requested <= available}
     */
    public static void validateThreadCount(int requested, int available) throws GraphGenerationException {
        if (requested < 1) {
            throw new GraphGenerationException(GraphGenerationException.Stage.THREADS,
                    "Number of threads must be at least 1 (" + available + " cores available), got " + requested);
        }
        if (requested > available) {
            throw new GraphGenerationException(GraphGenerationException.Stage.THREADS,
                    "Requested " + requested + " threads but only " + available
                            + " cores available. Reduce thread count.");
        }
    }

    /** Threads actually started: never more than there are variables. */
    public static int effectiveThreads(int requested, int nVariables) {
        return Math.min(requested, nVariables);
    }

    /**
     * Splits {@code n} positions into {@code effectiveThreads(threads, n)} contiguous ranges.
     * Sizes differ by at most one, and the first {@code n mod t} ranges are the larger ones.
     */
    public static ImmutableList<WorkRange> partition(int n, int threads) {
        if (threads < 1) throw new IllegalArgumentException("threads must be positive: " + threads);
        final int t = effectiveThreads(threads, n);
        ImmutableList.Builder<WorkRange> ranges = ImmutableList.builder();
        if (t == 0) return ranges.build();
        final int perThread = n / t;
        final int remainder = n % t;
        int start = 0;
        for (int i = 0; i < t; ++i) {
            int end = start + perThread + (i < remainder ? 1 : 0);
            ranges.add(new WorkRange(start, end));
            start = end;
        }
        return ranges.build();
    }
}
