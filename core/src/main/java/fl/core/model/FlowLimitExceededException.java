package fl.core.model;

/**
 * Raised when recording a flow would push the net flow of the current epoch past the limit.
 *
 * The rejected call left the limiter untouched, so the caller may retry with a smaller amount,
 * wait {@link #retryAfterNanos()} for the next epoch, or abort the enclosing transfer.
 */
public class FlowLimitExceededException extends RuntimeException {

    private final String subject;
    private final FlowDirection direction;
    private final long attempted;
    private final long available;
    private final long retryAfterNanos;

    public FlowLimitExceededException(String subject, FlowResult result) {
        super(String.format("Flow limit exceeded for %s: %s of %d requested, %d available",
            subject, result.direction(), result.attempted(), result.available()));
        this.subject = subject;
        this.direction = result.direction();
        this.attempted = result.attempted();
        this.available = result.available();
        this.retryAfterNanos = result.retryAfterNanos();
    }

    public String subject() {
        return subject;
    }

    public FlowDirection direction() {
        return direction;
    }

    public long attempted() {
        return attempted;
    }

    public long available() {
        return available;
    }

    public long retryAfterNanos() {
        return retryAfterNanos;
    }
}
