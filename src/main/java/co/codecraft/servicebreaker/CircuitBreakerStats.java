package co.codecraft.servicebreaker;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <p>Counts of what happened to the requests aimed at one service during the current consideration window:
 * how many succeeded, how many failed, and how many were rejected by an open circuit.</p>
 *
 * <p>No counter can ever go below zero. Every mutator clamps, so a negative delta can be used to decrement
 * without any risk of underflow.</p>
 *
 * <p>Instances are plain mutable values with no knowledge of storage or time, and they are not threadsafe.
 * A {@link StatsStore} owns the stored copy of each service's stats and only ever hands out copies.</p>
 */
public class CircuitBreakerStats {

    private long successes;
    private long failures;
    private long rejections;

    /** Create empty stats. */
    public CircuitBreakerStats() {
        this(0, 0, 0);
    }

    public CircuitBreakerStats(long successes, long failures, long rejections) {
        this.successes = clamp(successes);
        this.failures = clamp(failures);
        this.rejections = clamp(rejections);
    }

    private static long clamp(long value) {
        return value < 0 ? 0 : value;
    }

    public long getSuccesses() {
        return successes;
    }

    public void setSuccesses(long successes) {
        this.successes = clamp(successes);
    }

    public long getFailures() {
        return failures;
    }

    public void setFailures(long failures) {
        this.failures = clamp(failures);
    }

    public long getRejections() {
        return rejections;
    }

    public void setRejections(long rejections) {
        this.rejections = clamp(rejections);
    }

    public void addSuccesses(long n) {
        successes = clamp(successes + n);
    }

    public void addFailures(long n) {
        failures = clamp(failures + n);
    }

    public void addRejections(long n) {
        rejections = clamp(rejections + n);
    }

    /**
     * Add <code>n</code> (which may be negative) to the counter that matches <code>event</code>.
     */
    public void add(StatsEvent event, long n) {
        switch (event) {
            case SUCCESS:
                addSuccesses(n);
                break;
            case FAILURE:
                addFailures(n);
                break;
            case REJECTION:
                addRejections(n);
                break;
            default:
                throw new IllegalArgumentException(String.format("Unrecognized event %s.", event));
        }
    }

    /**
     * @return the number of requests that actually reached the service: successes plus failures.
     */
    public long getRequestsSentToService() {
        return successes + failures;
    }

    /**
     * @return every request we saw, including the ones rejected without being sent.
     */
    public long getTotalAttempted() {
        return getRequestsSentToService() + rejections;
    }

    /**
     * @return the percentage of sent requests that succeeded, rounded half up to an integer between 0 and 100.
     *     If no request has reached the service yet, this is 100: having no data is not a reason to
     *     distrust a service.
     */
    public int getSuccessRatio() {
        long sent = getRequestsSentToService();
        if (sent == 0) {
            return 100;
        }
        // Integer form of round(successes * 100 / sent), so ratios like 2/3 land exactly.
        return (int) ((successes * 200 + sent) / (2 * sent));
    }

    /**
     * @return 100 minus {@link #getSuccessRatio()}.
     */
    public int getFailureRatio() {
        return 100 - getSuccessRatio();
    }

    public CircuitBreakerStats copy() {
        return new CircuitBreakerStats(successes, failures, rejections);
    }

    /**
     * @return the three counters keyed by name, in a stable order; handy for structured logging.
     */
    public Map<String, Long> toMap() {
        Map<String, Long> map = new LinkedHashMap<String, Long>();
        map.put("successes", successes);
        map.put("failures", failures);
        map.put("rejections", rejections);
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CircuitBreakerStats)) {
            return false;
        }
        CircuitBreakerStats other = (CircuitBreakerStats) o;
        return successes == other.successes && failures == other.failures && rejections == other.rejections;
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(successes);
        result = 31 * result + Long.hashCode(failures);
        result = 31 * result + Long.hashCode(rejections);
        return result;
    }

    @Override
    public String toString() {
        return "successes " + successes + ", failures " + failures + ", rejections " + rejections;
    }
}
