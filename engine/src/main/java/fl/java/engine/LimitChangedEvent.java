package fl.java.engine;

/**
 * Emitted after every setLimit call.
 *
 * @param subject Subject whose limit changed
 * @param previousLimit Limit before the call
 * @param newLimit Limit after the call
 * @param actor Identity supplied by the (already authorized) caller
 * @param changedAtNanos Clock value when the change was applied
 */
public record LimitChangedEvent(
    String subject,
    long previousLimit,
    long newLimit,
    String actor,
    long changedAtNanos
) {
}
