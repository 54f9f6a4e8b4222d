package de.mirkosertic.mcp.memoryindex.search;

import de.mirkosertic.mcp.memoryindex.index.BackendKind;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe runtime statistics of free-text searches.
 *
 * <p>Counters are atomics so recording stays lock-free. The last {@value #WINDOW} durations are kept in a
 * ring guarded by its own monitor and used for percentiles.</p>
 */
public class QueryRuntimeStats {

    static final int WINDOW = 1000;

    private final AtomicLong searches = new AtomicLong();
    private final AtomicLong durationSumMs = new AtomicLong();
    private final AtomicLong resultSum = new AtomicLong();
    private final AtomicLong fastestMs = new AtomicLong(Long.MAX_VALUE);
    private final AtomicLong slowestMs = new AtomicLong();
    private final AtomicLong degradedSearches = new AtomicLong();
    private final AtomicLong failedSearches = new AtomicLong();
    private final ConcurrentHashMap<BackendKind, AtomicLong> routeCounts = new ConcurrentHashMap<>();

    private final long[] recentDurations = new long[WINDOW];
    private int nextSlot;
    private boolean wrapped;
    private final Object ringLock = new Object();

    public record Percentiles(long p50, long p90, long p99) {
    }

    /**
     * @param routes backends that answered at least one keyword of the search
     */
    public void recordQuery(final long durationMs, final long results, final Collection<BackendKind> routes,
                            final SearchStatus status) {
        searches.incrementAndGet();
        durationSumMs.addAndGet(durationMs);
        resultSum.addAndGet(results);
        fastestMs.accumulateAndGet(durationMs, Math::min);
        slowestMs.accumulateAndGet(durationMs, Math::max);

        for (final BackendKind route : routes) {
            routeCounts.computeIfAbsent(route, k -> new AtomicLong()).incrementAndGet();
        }
        if (status == SearchStatus.DEGRADED) {
            degradedSearches.incrementAndGet();
        } else if (status == SearchStatus.FAILED) {
            failedSearches.incrementAndGet();
        }

        synchronized (ringLock) {
            recentDurations[nextSlot] = durationMs;
            nextSlot = (nextSlot + 1) % WINDOW;
            if (nextSlot == 0) {
                wrapped = true;
            }
        }
    }

    /**
     * @return percentiles over the recent window, or null before the first search
     */
    public @Nullable Percentiles getPercentiles() {
        final long[] sorted;
        synchronized (ringLock) {
            final int size = wrapped ? WINDOW : nextSlot;
            if (size == 0) {
                return null;
            }
            sorted = Arrays.copyOf(recentDurations, size);
        }
        Arrays.sort(sorted);
        return new Percentiles(nearestRank(sorted, 50), nearestRank(sorted, 90), nearestRank(sorted, 99));
    }

    private static long nearestRank(final long[] sorted, final int percentile) {
        final int rank = (int) Math.ceil(percentile / 100.0 * sorted.length) - 1;
        return sorted[Math.max(0, Math.min(rank, sorted.length - 1))];
    }

    public void reset() {
        searches.set(0);
        durationSumMs.set(0);
        resultSum.set(0);
        fastestMs.set(Long.MAX_VALUE);
        slowestMs.set(0);
        degradedSearches.set(0);
        failedSearches.set(0);
        routeCounts.clear();
        synchronized (ringLock) {
            nextSlot = 0;
            wrapped = false;
            Arrays.fill(recentDurations, 0L);
        }
    }

    public long getTotalQueries() {
        return searches.get();
    }

    /**
     * Fastest search in milliseconds, 0 before the first search.
     */
    public long getMinDurationMs() {
        final long fastest = fastestMs.get();
        return fastest == Long.MAX_VALUE ? 0 : fastest;
    }

    public long getMaxDurationMs() {
        return slowestMs.get();
    }

    public double getAverageDurationMs() {
        final long count = searches.get();
        return count == 0 ? 0.0 : (double) durationSumMs.get() / count;
    }

    public double getAverageResultCount() {
        final long count = searches.get();
        return count == 0 ? 0.0 : (double) resultSum.get() / count;
    }

    public long getDegradedQueries() {
        return degradedSearches.get();
    }

    public long getFailedQueries() {
        return failedSearches.get();
    }

    /**
     * Number of searches each backend took part in.
     */
    public Map<BackendKind, Long> getRouteCounts() {
        final Map<BackendKind, Long> snapshot = new EnumMap<>(BackendKind.class);
        for (final BackendKind kind : BackendKind.values()) {
            final AtomicLong counter = routeCounts.get(kind);
            snapshot.put(kind, counter == null ? 0L : counter.get());
        }
        return snapshot;
    }
}
