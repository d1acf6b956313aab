package fl.core.clock;

import java.time.Instant;

/**
 * Wall-clock time as nanoseconds since the Unix epoch.
 * System.nanoTime() has an arbitrary origin, so it cannot be used for windows aligned to absolute time.
 */
public final class SystemClock implements Clock {
    private static final SystemClock INSTANCE = new SystemClock();

    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowNanos() {
        Instant now = Instant.now();
        return Math.addExact(Math.multiplyExact(now.getEpochSecond(), 1_000_000_000L), now.getNano());
    }
}
