package fl.java.engine;

import fl.core.algorithms.net_flow.NetFlowWindow;
import fl.core.clock.Clock;
import fl.core.model.FlowDirection;
import fl.core.model.FlowLimitExceededException;
import fl.core.model.FlowLimiter;
import fl.core.model.FlowResult;
import fl.core.model.FlowSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Thread-safe net-flow limiter with one state per subject.
 *
 * Features:
 * - ConcurrentHashMap registry of subjects (asset ids, accounts, ...)
 * - ReentrantLock per subject: check-then-commit is atomic, different subjects never contend
 * - Clock injection enables deterministic epoch transitions in tests
 * - Limit changes are published to a LimitChangeListener (SLF4J audit log by default)
 *
 * Subjects are never evicted: dropping one would silently reset its configured limit.
 *
 * Usage example:
 * <pre>
 * FlowLimiterEngine engine = new FlowLimiterEngine(SystemClock.instance(), FlowLimiterConfig.defaults());
 * engine.setLimit("USDC", 1_000_000, "ops@example");
 *
 * engine.recordOutflow("USDC", amount); // throws FlowLimitExceededException before the transfer is committed
 * </pre>
 */
public final class FlowLimiterEngine implements FlowLimiter {

    private static final Logger log = LoggerFactory.getLogger(FlowLimiterEngine.class);

    private final Clock clock;
    private final FlowLimiterConfig config;
    private final LimitChangeListener listener;
    private final ConcurrentMap<String, LimiterEntry> subjects = new ConcurrentHashMap<>();

    /**
     * Creates an engine that audits limit changes through SLF4J.
     *
     * @param clock Clock instance (injected for testability)
     * @param config Epoch length and default limit
     */
    public FlowLimiterEngine(Clock clock, FlowLimiterConfig config) {
        this(clock, config, new LoggingLimitChangeListener());
    }

    /**
     * Creates an engine with a custom limit-change listener.
     *
     * @param clock Clock instance (injected for testability)
     * @param config Epoch length and default limit
     * @param listener Receives every setLimit call
     * @throws IllegalArgumentException if any parameter is null
     */
    public FlowLimiterEngine(Clock clock, FlowLimiterConfig config, LimitChangeListener listener) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.clock = clock;
        this.config = config;
        this.listener = listener;
    }

    /**
     * Registers a subject with an explicit initial limit.
     * Does nothing if the subject already exists; use setLimit to change it.
     *
     * @param subject Subject identifier
     * @param initialLimit Limit for the new subject (0 = disabled)
     * @return The subject's limit after the call
     */
    public long register(String subject, long initialLimit) {
        requireSubject(subject);
        if (initialLimit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        return withSubject(subject, initialLimit, NetFlowWindow::limit);
    }

    public boolean isRegistered(String subject) {
        requireSubject(subject);
        return subjects.containsKey(subject);
    }

    @Override
    public void setLimit(String subject, long newLimit, String actor) {
        requireSubject(subject);
        if (newLimit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }

        LimiterEntry entry = getOrCreate(subject, config.defaultLimit());
        ReentrantLock auditLock = entry.getAuditLock();
        auditLock.lock();
        try {
            long previous;
            ReentrantLock lock = entry.getLock();
            lock.lock();
            try {
                previous = entry.getWindow().setLimit(newLimit);
            } finally {
                lock.unlock();
            }

            // Recording never takes the audit lock.
            LimitChangedEvent event = new LimitChangedEvent(subject, previous, newLimit, actor, clock.nowNanos());
            try {
                listener.onLimitChanged(event);
            } catch (RuntimeException e) {
                // The limit is already in force; a broken sink must not make the caller think otherwise.
                log.warn("Limit change listener failed for subject {}", subject, e);
            }
        } finally {
            auditLock.unlock();
        }
    }

    @Override
    public void recordOutflow(String subject, long amount) {
        throwIfRejected(subject, tryRecordOutflow(subject, amount));
    }

    @Override
    public void recordInflow(String subject, long amount) {
        throwIfRejected(subject, tryRecordInflow(subject, amount));
    }

    /**
     * Non-throwing variant of recordOutflow.
     *
     * @param subject Subject identifier
     * @param amount Amount to record (must be > 0)
     * @return ALLOW if committed, REJECT (with nothing changed) otherwise
     */
    public FlowResult tryRecordOutflow(String subject, long amount) {
        return tryRecord(subject, FlowDirection.OUTFLOW, amount);
    }

    /**
     * Non-throwing variant of recordInflow.
     *
     * @param subject Subject identifier
     * @param amount Amount to record (must be > 0)
     * @return ALLOW if committed, REJECT (with nothing changed) otherwise
     */
    public FlowResult tryRecordInflow(String subject, long amount) {
        return tryRecord(subject, FlowDirection.INFLOW, amount);
    }

    @Override
    public long currentLimit(String subject) {
        return read(subject, NetFlowWindow::limit);
    }

    @Override
    public long currentOutflow(String subject) {
        return read(subject, NetFlowWindow::currentOutflow);
    }

    @Override
    public long currentInflow(String subject) {
        return read(subject, NetFlowWindow::currentInflow);
    }

    /**
     * Consistent view of limit and both counters, taken under the subject lock.
     */
    public FlowSnapshot snapshot(String subject) {
        return read(subject, window -> window.snapshot(subject));
    }

    /**
     * Returns the number of tracked subjects.
     */
    public int size() {
        return subjects.size();
    }

    /**
     * Forgets every subject, limits included. Primarily useful for testing.
     *
     * Must not run while other calls are in flight: a call that already fetched its subject
     * commits into the discarded state and its change is lost.
     */
    public void clear() {
        subjects.clear();
    }

    public FlowLimiterConfig getConfig() {
        return config;
    }

    private FlowResult tryRecord(String subject, FlowDirection direction, long amount) {
        requireSubject(subject);
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be > 0");
        }

        FlowResult result = withSubject(subject, config.defaultLimit(), window -> window.tryRecord(direction, amount));
        if (!result.allowed() && log.isDebugEnabled()) {
            log.debug("Flow rejected - subject: {}, direction: {}, attempted: {}, available: {}",
                subject, direction, amount, result.available());
        }
        return result;
    }

    // Unknown subjects read as a fresh window at the default limit, without registering them.
    private <T> T read(String subject, Function<NetFlowWindow, T> reader) {
        requireSubject(subject);
        LimiterEntry entry = subjects.get(subject);
        if (entry == null) {
            return reader.apply(new NetFlowWindow(clock, config.epochNanos(), config.defaultLimit()));
        }
        return locked(entry, reader);
    }

    private <T> T withSubject(String subject, long initialLimit, Function<NetFlowWindow, T> action) {
        return locked(getOrCreate(subject, initialLimit), action);
    }

    private static <T> T locked(LimiterEntry entry, Function<NetFlowWindow, T> action) {
        ReentrantLock lock = entry.getLock();
        lock.lock();
        try {
            return action.apply(entry.getWindow());
        } finally {
            lock.unlock();
        }
    }

    /**
     * computeIfAbsent guarantees a single entry (and lock) per subject.
     */
    private LimiterEntry getOrCreate(String subject, long initialLimit) {
        LimiterEntry entry = subjects.get(subject);
        if (entry != null) {
            return entry;
        }
        return subjects.computeIfAbsent(subject, key -> {
            log.debug("Tracking new subject {} with limit {}", key, initialLimit);
            return new LimiterEntry(new NetFlowWindow(clock, config.epochNanos(), initialLimit));
        });
    }

    private static void throwIfRejected(String subject, FlowResult result) {
        if (!result.allowed()) {
            throw new FlowLimitExceededException(subject, result);
        }
    }

    private static void requireSubject(String subject) {
        if (subject == null) {
            throw new IllegalArgumentException("subject cannot be null");
        }
    }
}
