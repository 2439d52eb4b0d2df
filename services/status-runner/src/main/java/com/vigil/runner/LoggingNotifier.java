package com.vigil.runner;

import com.vigil.aggregation.transition.Notifier;
import com.vigil.aggregation.transition.TransitionEvent;
import com.vigil.aggregation.transition.TransitionKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link Notifier}: writes transition events to the log. Delivery to an issue tracker
 * or chat channel is done by a separate notifier bean.
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void deliver(TransitionEvent event) {
        if (event.kind() == TransitionKind.INCIDENT) {
            log.warn("Incident started at {}: {} [{}]", event.timestamp(),
                    String.join(", ", event.affectedChecks()), event.dedupKey());
        } else {
            log.info("Recovered at {}: {} back to operational [{}]", event.timestamp(),
                    String.join(", ", event.affectedChecks()), event.dedupKey());
        }
    }
}
