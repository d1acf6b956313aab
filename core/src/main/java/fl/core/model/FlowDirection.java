package fl.core.model;

/**
 * Direction of a recorded flow relative to the boundary the limit guards.
 */
public enum FlowDirection {
    OUTFLOW,
    INFLOW;

    public FlowDirection opposite() {
        return this == OUTFLOW ? INFLOW : OUTFLOW;
    }
}
