package fl.java.engine;

/**
 * Receives limit changes for audit or observability.
 * Invoked outside the subject lock; calls for the same subject are serialized, in the order the limits were applied.
 */
@FunctionalInterface
public interface LimitChangeListener {

    LimitChangeListener NO_OP = event -> { };

    void onLimitChanged(LimitChangedEvent event);
}
