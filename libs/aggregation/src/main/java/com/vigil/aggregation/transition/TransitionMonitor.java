package com.vigil.aggregation.transition;

import com.vigil.aggregation.StatusSummary;
import com.vigil.observability.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Runs transition detection once per invocation: load, detect, deliver, save.
 * <p>
 * The notifier is called before the state is saved. A failed delivery leaves the old state in
 * place so the same event is produced again next time.
 */
public class TransitionMonitor {

    private static final Logger log = LoggerFactory.getLogger(TransitionMonitor.class);

    private final TransitionStateStore store;
    private final Notifier notifier;
    private final EngineMetrics metrics;
    private final TransitionDetector detector;
    private final Clock clock;

    public TransitionMonitor(TransitionStateStore store, Notifier notifier, EngineMetrics metrics, Clock clock) {
        this.store = store;
        this.notifier = notifier;
        this.metrics = metrics;
        this.detector = new TransitionDetector();
        this.clock = clock;
    }

    /**
     * @return the delivered event, if any
     * @throws TransitionStateException if the state cannot be read or written
     */
    public Optional<TransitionEvent> observe(StatusSummary summary) {
        Optional<TransitionState> previous = store.load();
        TransitionDetector.Detection detection = detector.detect(previous, summary, clock.instant());

        detection.event().ifPresent(event -> {
            log.info("Overall status transition {} affecting {} [{}]",
                    event.kind().value(), event.affectedChecks(), event.dedupKey());
            notifier.deliver(event);
            metrics.recordTransition(event.kind().value());
        });
        detection.toSave().ifPresent(store::save);

        if (detection.toSave().isEmpty()) {
            log.debug("Overall status is {}; transition state left unchanged", summary.currentOverallStatus());
        }
        return detection.event();
    }
}
