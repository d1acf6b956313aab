package fl.core.clock;

/**
 * Time source for epoch computation.
 * Values are nanoseconds on an absolute timeline so that epoch windows align to wall-clock time.
 */
public interface Clock {
    long nowNanos();
}
