package fl.java.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default audit sink: one INFO line per limit change.
 */
public final class LoggingLimitChangeListener implements LimitChangeListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingLimitChangeListener.class);

    @Override
    public void onLimitChanged(LimitChangedEvent event) {
        log.info("Flow limit changed - subject: {}, previous: {}, new: {}, actor: {}",
            event.subject(), event.previousLimit(), event.newLimit(), event.actor());
    }
}
