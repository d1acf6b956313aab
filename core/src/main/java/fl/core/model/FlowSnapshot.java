package fl.core.model;

/**
 * Point-in-time view of one subject's limiter state in the live epoch.
 *
 * @param subject Subject identifier
 * @param epochIndex floor(now / epochLength) at the time of the snapshot
 * @param limit Configured limit (0 = disabled)
 * @param outflow Outflow recorded in this epoch
 * @param inflow Inflow recorded in this epoch
 * @param epochEndsAtNanos Clock value at which the next epoch starts
 */
public record FlowSnapshot(
    String subject,
    long epochIndex,
    long limit,
    long outflow,
    long inflow,
    long epochEndsAtNanos
) {
    public boolean enforced() {
        return limit != 0;
    }

    public long availableOutflow() {
        return headroom(outflow, inflow);
    }

    public long availableInflow() {
        return headroom(inflow, outflow);
    }

    private long headroom(long same, long opposite) {
        if (!enforced()) return Long.MAX_VALUE;
        long ceiling = NetFlowMath.saturatedAdd(opposite, limit);
        return Math.max(0L, ceiling - same);
    }
}
