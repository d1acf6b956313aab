package fl.core.model;

/**
 * Net-flow limiter contract: bounds |outflow - inflow| per subject within each aligned epoch.
 *
 * Authorization of {@link #setLimit} belongs to the caller; {@code actor} is recorded for audit only.
 */
public interface FlowLimiter {

    void setLimit(String subject, long newLimit, String actor);

    /**
     * Records an outflow, throwing if it would exceed inflow + limit for the current epoch.
     *
     * @throws FlowLimitExceededException if rejected; state is unchanged in that case
     */
    void recordOutflow(String subject, long amount);

    /**
     * Records an inflow, throwing if it would exceed outflow + limit for the current epoch.
     *
     * @throws FlowLimitExceededException if rejected; state is unchanged in that case
     */
    void recordInflow(String subject, long amount);

    long currentLimit(String subject);

    long currentOutflow(String subject);

    long currentInflow(String subject);
}
