package fl.core.model;

/**
 * Overflow-safe arithmetic shared by the window and its snapshots.
 */
public final class NetFlowMath {

    private NetFlowMath() {
    }

    /** a + b for non-negative operands, clamped to Long.MAX_VALUE. */
    public static long saturatedAdd(long a, long b) {
        long sum = a + b;
        return sum < 0 ? Long.MAX_VALUE : sum;
    }
}
