package fl.core.model;

/**
 * Outcome of a single flow recording.
 *
 * @param decision ALLOW if the amount was committed, REJECT if nothing changed
 * @param direction Direction that was recorded
 * @param attempted Amount the caller tried to record
 * @param available Amount still admissible in this direction after the call
 *                  ({@link Long#MAX_VALUE} when the limit is disabled)
 * @param retryAfterNanos On REJECT, time until the current epoch ends; 0 on ALLOW
 */
public record FlowResult(
    Decision decision,
    FlowDirection direction,
    long attempted,
    long available,
    long retryAfterNanos
) {
    public static FlowResult allow(FlowDirection direction, long attempted, long available) {
        return new FlowResult(Decision.ALLOW, direction, attempted, available, 0L);
    }

    public static FlowResult reject(FlowDirection direction, long attempted, long available, long retryAfterNanos) {
        return new FlowResult(Decision.REJECT, direction, attempted, Math.max(0L, available), Math.max(0L, retryAfterNanos));
    }

    public boolean allowed() {
        return decision == Decision.ALLOW;
    }
}
