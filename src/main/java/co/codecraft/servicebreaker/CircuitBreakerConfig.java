package co.codecraft.servicebreaker;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Properties;

/**
 * <p>The thresholds that decide when a {@link CircuitBreaker} trips. A config is immutable; a breaker swaps in a
 * new one when its setters are called, and each request reads the config exactly once.</p>
 *
 * <p>The policy reads: "Open the circuit for a service once at least <em style="color:red">minRequests</em>
 * requests have reached it and <em style="color:red">failureThreshold</em>% or more of them failed, counting
 * everything since the service last went quiet for <em style="color:red">considerationWindow</em>."</p>
 */
public final class CircuitBreakerConfig {

    public static final int DEFAULT_FAILURE_THRESHOLD = 50;
    public static final int DEFAULT_MIN_REQUESTS = 3;
    public static final Duration DEFAULT_CONSIDERATION_WINDOW = Duration.ofMinutes(15);

    /** The longest window a cache can be asked to hold an entry for; its length in nanoseconds must fit a long. */
    public static final Duration MAX_CONSIDERATION_WINDOW = Duration.ofDays(365L * 100);

    /** Prefix for every key read by {@link #fromProperties(Properties)}. */
    public static final String PROPERTY_PREFIX = "circuitbreaker.";

    /**
     * Open a service's circuit once its failure ratio is &gt;= this percentage. A value between 0 and 100,
     * inclusive.
     */
    public final int failureThreshold;

    /**
     * The minimum number of requests that must have reached a service before its failure ratio means anything.
     * Below this, the circuit stays closed no matter how bad the ratio looks.
     */
    public final int minRequests;

    /**
     * How long a service's stats survive after its most recent event. Each new event restarts the window.
     */
    public final Duration considerationWindow;

    /**
     * If false, stats are still gathered and listeners still hear about trips and rejections (as
     * "theoretical" events), but no request is ever blocked.
     */
    public final boolean enabled;

    /**
     * If true, rejected requests are counted in {@link CircuitBreakerStats#getRejections()}. Recording a
     * rejection also restarts the consideration window, so a service under steady traffic stays open until
     * it is reset by hand. Off by default.
     */
    public final boolean countRejections;

    /**
     * @param failureThreshold  See {@link #failureThreshold the member variable}.
     * @param minRequests  See {@link #minRequests the member variable}.
     * @param considerationWindow  See {@link #considerationWindow the member variable}.
     * @param enabled  See {@link #enabled the member variable}.
     * @param countRejections  See {@link #countRejections the member variable}.
     */
    public CircuitBreakerConfig(int failureThreshold, int minRequests, Duration considerationWindow,
                                boolean enabled, boolean countRejections) {
        if (failureThreshold < 0 || failureThreshold > 100) {
            throw new IllegalArgumentException("failureThreshold must be >= 0 and <= 100");
        }
        if (minRequests < 1) {
            throw new IllegalArgumentException("minRequests must be >= 1");
        }
        if (considerationWindow == null || considerationWindow.isNegative() || considerationWindow.isZero()) {
            throw new IllegalArgumentException("considerationWindow must be positive");
        }
        if (considerationWindow.compareTo(MAX_CONSIDERATION_WINDOW) > 0) {
            throw new IllegalArgumentException("considerationWindow must be <= " + MAX_CONSIDERATION_WINDOW);
        }
        this.failureThreshold = failureThreshold;
        this.minRequests = minRequests;
        this.considerationWindow = considerationWindow;
        this.enabled = enabled;
        this.countRejections = countRejections;
    }

    /**
     * @return a config with every value at its default: 50%, 3 requests, 15 minutes, enabled.
     */
    public static CircuitBreakerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder that starts from this config's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .setFailureThreshold(failureThreshold)
                .setMinRequests(minRequests)
                .setConsiderationWindow(considerationWindow)
                .setEnabled(enabled)
                .setCountRejections(countRejections);
    }

    /**
     * <p>Read a config from properties. Recognized keys (all optional):</p>
     * <ul>
     *     <li><code>circuitbreaker.failure-threshold</code> (percent)</li>
     *     <li><code>circuitbreaker.min-requests</code></li>
     *     <li><code>circuitbreaker.consideration-window</code> (ISO-8601 such as <code>PT15M</code>, or whole
     *     seconds)</li>
     *     <li><code>circuitbreaker.enabled</code></li>
     *     <li><code>circuitbreaker.count-rejections</code></li>
     * </ul>
     *
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range.
     */
    public static CircuitBreakerConfig fromProperties(Properties props) {
        Builder b = builder();
        String value = property(props, "failure-threshold");
        if (value != null) {
            b.setFailureThreshold(parseInt("failure-threshold", value));
        }
        value = property(props, "min-requests");
        if (value != null) {
            b.setMinRequests(parseInt("min-requests", value));
        }
        value = property(props, "consideration-window");
        if (value != null) {
            b.setConsiderationWindow(parseDuration(value));
        }
        value = property(props, "enabled");
        if (value != null) {
            b.setEnabled(Boolean.parseBoolean(value));
        }
        value = property(props, "count-rejections");
        if (value != null) {
            b.setCountRejections(Boolean.parseBoolean(value));
        }
        return b.build();
    }

    /**
     * Read a config from a properties file on the classpath. See {@link #fromProperties(Properties)}.
     *
     * @throws IOException if the resource is missing or unreadable.
     */
    public static CircuitBreakerConfig load(String resource) throws IOException {
        InputStream in = CircuitBreakerConfig.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IOException(String.format("Resource %s not found on the classpath.", resource));
        }
        Properties props = new Properties();
        try {
            props.load(in);
        } finally {
            in.close();
        }
        return fromProperties(props);
    }

    private static String property(Properties props, String name) {
        String value = props.getProperty(PROPERTY_PREFIX + name);
        if (value == null) {
            return null;
        }
        value = value.trim();
        return value.isEmpty() ? null : value;
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format("%s%s must be an integer, not \"%s\".", PROPERTY_PREFIX, name, value), e);
        }
    }

    private static Duration parseDuration(String value) {
        try {
            if (Character.isDigit(value.charAt(0))) {
                return Duration.ofSeconds(Long.parseLong(value));
            }
            return Duration.parse(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format("%sconsideration-window is not a duration: \"%s\".", PROPERTY_PREFIX, value), e);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(
                    String.format("%sconsideration-window is not a duration: \"%s\".", PROPERTY_PREFIX, value), e);
        }
    }

    @Override
    public String toString() {
        return "failureThreshold=" + failureThreshold + "%, minRequests=" + minRequests
                + ", considerationWindow=" + considerationWindow + ", enabled=" + enabled
                + ", countRejections=" + countRejections;
    }

    /**
     * A convenience class to make constructor parameters less opaque.
     */
    public static class Builder {
        private int failureThreshold = DEFAULT_FAILURE_THRESHOLD;
        private int minRequests = DEFAULT_MIN_REQUESTS;
        private Duration considerationWindow = DEFAULT_CONSIDERATION_WINDOW;
        private boolean enabled = true;
        private boolean countRejections = false;

        public Builder setFailureThreshold(int value) {
            failureThreshold = value;
            return this;
        }
        public Builder setMinRequests(int value) {
            minRequests = value;
            return this;
        }
        public Builder setConsiderationWindow(Duration value) {
            considerationWindow = value;
            return this;
        }
        public Builder setEnabled(boolean value) {
            enabled = value;
            return this;
        }
        public Builder setCountRejections(boolean value) {
            countRejections = value;
            return this;
        }
        public CircuitBreakerConfig build() {
            return new CircuitBreakerConfig(failureThreshold, minRequests, considerationWindow, enabled,
                    countRejections);
        }
    }
}
