package fl.java.engine;

import fl.core.algorithms.net_flow.NetFlowWindow;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry holding one subject's NetFlowWindow with its associated lock.
 *
 * Thread-safety:
 * - The lock must be held for every access to the window, reads included
 * - This makes read-compare-write of both counters atomic per subject
 * - The audit lock orders limit changes with their notifications; recording never takes it
 */
final class LimiterEntry {

    private final NetFlowWindow window;
    private final ReentrantLock lock;
    private final ReentrantLock auditLock;

    LimiterEntry(NetFlowWindow window) {
        if (window == null) {
            throw new IllegalArgumentException("window cannot be null");
        }
        this.window = window;
        this.lock = new ReentrantLock(); // Non-fair for better throughput
        this.auditLock = new ReentrantLock(true); // Fair: limit changes apply in arrival order
    }

    /**
     * Returns the window. MUST be called while holding the lock.
     */
    NetFlowWindow getWindow() {
        return window;
    }

    ReentrantLock getLock() {
        return lock;
    }

    /**
     * Held by setLimit across the change and its listener callback, so events for one
     * subject reach the listener in the order the limits were applied.
     */
    ReentrantLock getAuditLock() {
        return auditLock;
    }
}
