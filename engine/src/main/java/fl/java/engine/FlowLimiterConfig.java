package fl.java.engine;

import java.time.Duration;

/**
 * Configuration for a FlowLimiterEngine.
 *
 * Every subject tracked by one engine shares the same epoch length; limits are per subject
 * and start at {@code defaultLimit} unless registered with an explicit value.
 *
 * @param epochNanos Epoch length in nanoseconds (must be > 0)
 * @param defaultLimit Limit given to subjects created implicitly (0 = enforcement disabled)
 */
public record FlowLimiterConfig(
    long epochNanos,
    long defaultLimit
) {
    /**
     * Six-hour epochs, a common choice for bridge-style transfer limits.
     */
    public static final Duration DEFAULT_EPOCH = Duration.ofHours(6);

    public FlowLimiterConfig {
        if (epochNanos <= 0) throw new IllegalArgumentException("epoch must be > 0");
        if (defaultLimit < 0) throw new IllegalArgumentException("defaultLimit must be >= 0");
    }

    /**
     * Six-hour epochs with enforcement disabled until a limit is set.
     *
     * @return Default configuration
     */
    public static FlowLimiterConfig defaults() {
        return of(DEFAULT_EPOCH, 0L);
    }

    /**
     * Creates a configuration from a Duration.
     *
     * @param epoch Epoch length
     * @param defaultLimit Limit for implicitly created subjects
     * @return Configuration
     */
    public static FlowLimiterConfig of(Duration epoch, long defaultLimit) {
        if (epoch == null) throw new IllegalArgumentException("epoch cannot be null");
        return new FlowLimiterConfig(epoch.toNanos(), defaultLimit);
    }

    public Duration epoch() {
        return Duration.ofNanos(epochNanos);
    }
}
