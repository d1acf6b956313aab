package fl.core.algorithms.net_flow;

import fl.core.clock.Clock;
import fl.core.model.FlowDirection;
import fl.core.model.FlowResult;
import fl.core.model.FlowSnapshot;
import fl.core.model.NetFlowMath;

import java.util.HashMap;
import java.util.Map;

/**
 * Net-flow window for a single subject:
 * - epoch = floor(now / epochNanos), aligned to absolute time
 * - outflow[e] <= inflow[e] + limit, inflow[e] <= outflow[e] + limit
 * - limit == 0 disables enforcement (records succeed, counters untouched)
 *
 * Inflow earns back outflow capacity within the same epoch and vice versa, so the cap is on
 * net exposure, not on turnover. Nothing carries over between epochs.
 *
 * Not thread-safe: callers serialize access (FlowLimiterEngine holds a per-subject lock).
 */
public final class NetFlowWindow {
    private final Clock clock;
    private final long epochNanos;

    private long limit;
    private final Map<Long, Long> outflowByEpoch = new HashMap<>();
    private final Map<Long, Long> inflowByEpoch = new HashMap<>();

    public NetFlowWindow(Clock clock, long epochNanos, long limit) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (epochNanos <= 0) throw new IllegalArgumentException("epoch <= 0");
        if (limit < 0) throw new IllegalArgumentException("limit < 0");
        this.clock = clock;
        this.epochNanos = epochNanos;
        this.limit = limit;
    }

    public FlowResult tryRecordOutflow(long amount) {
        return tryRecord(FlowDirection.OUTFLOW, amount);
    }

    public FlowResult tryRecordInflow(long amount) {
        return tryRecord(FlowDirection.INFLOW, amount);
    }

    /**
     * Check-then-commit: a rejected call never touches the counters.
     */
    public FlowResult tryRecord(FlowDirection direction, long amount) {
        if (direction == null) throw new IllegalArgumentException("direction cannot be null");
        if (amount <= 0) throw new IllegalArgumentException("amount <= 0");

        if (limit == 0) {
            return FlowResult.allow(direction, amount, Long.MAX_VALUE);
        }

        long now = clock.nowNanos();
        long epoch = epochOf(now);

        Map<Long, Long> same = counters(direction);
        long prior = same.getOrDefault(epoch, 0L);
        long opposite = counters(direction.opposite()).getOrDefault(epoch, 0L);

        // Lowering the limit mid-epoch can leave prior above the ceiling.
        long available = Math.max(0L, NetFlowMath.saturatedAdd(opposite, limit) - prior);
        if (amount > available) {
            return FlowResult.reject(direction, amount, available, epochEndNanos(epoch) - now);
        }

        same.put(epoch, prior + amount);
        prune(epoch);
        return FlowResult.allow(direction, amount, available - amount);
    }

    /**
     * Replaces the limit. Already-recorded flow is not re-validated.
     *
     * @return the previous limit
     */
    public long setLimit(long newLimit) {
        if (newLimit < 0) throw new IllegalArgumentException("limit < 0");
        long previous = limit;
        limit = newLimit;
        return previous;
    }

    public long limit() {
        return limit;
    }

    public long epochNanos() {
        return epochNanos;
    }

    public long currentOutflow() {
        return outflowByEpoch.getOrDefault(currentEpoch(), 0L);
    }

    public long currentInflow() {
        return inflowByEpoch.getOrDefault(currentEpoch(), 0L);
    }

    public long currentEpoch() {
        return epochOf(clock.nowNanos());
    }

    public FlowSnapshot snapshot(String subject) {
        long epoch = currentEpoch();
        return new FlowSnapshot(
            subject,
            epoch,
            limit,
            outflowByEpoch.getOrDefault(epoch, 0L),
            inflowByEpoch.getOrDefault(epoch, 0L),
            epochEndNanos(epoch)
        );
    }

    int trackedEpochs() {
        return Math.max(outflowByEpoch.size(), inflowByEpoch.size());
    }

    private Map<Long, Long> counters(FlowDirection direction) {
        return direction == FlowDirection.OUTFLOW ? outflowByEpoch : inflowByEpoch;
    }

    private long epochOf(long nowNanos) {
        return Math.floorDiv(nowNanos, epochNanos);
    }

    private long epochEndNanos(long epoch) {
        return (epoch + 1) * epochNanos;
    }

    // Epoch indices never recur, so anything before the previous epoch is unreachable.
    private void prune(long epoch) {
        long oldest = epoch - 1;
        outflowByEpoch.keySet().removeIf(e -> e < oldest);
        inflowByEpoch.keySet().removeIf(e -> e < oldest);
    }
}
