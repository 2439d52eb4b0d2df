package com.vigil.runner;

import com.vigil.aggregation.Aggregator;
import com.vigil.aggregation.StatusSummary;
import com.vigil.aggregation.SummaryPublisher;
import com.vigil.aggregation.transition.TransitionMonitor;
import com.vigil.aggregation.transition.TransitionStateException;
import com.vigil.checkmodel.CheckDefinitionSet;
import com.vigil.checkmodel.ConfigurationException;
import com.vigil.engine.CheckRunner;
import com.vigil.engine.RunReport;
import com.vigil.resultstore.StorageException;
import com.vigil.runner.config.VigilProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * One batch invocation: run checks, aggregate, publish the summary, detect transitions.
 *
 * <p>Exit codes:
 * <ul>
 *   <li>0: completed</li>
 *   <li>2: invalid configuration, no check was run</li>
 *   <li>3: results, claims or the summary could not be persisted</li>
 *   <li>4: the transition state could not be read or written</li>
 * </ul>
 */
@Component
public class StatusInvocation implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(StatusInvocation.class);

    static final int EXIT_CONFIGURATION = 2;
    static final int EXIT_STORAGE = 3;
    static final int EXIT_TRANSITION_STATE = 4;

    private final VigilProperties properties;
    private final CheckRunner runner;
    private final Aggregator aggregator;
    private final SummaryPublisher publisher;
    private final TransitionMonitor monitor;

    private volatile int exitCode;
    private volatile RunReport lastReport;

    public StatusInvocation(VigilProperties properties, CheckRunner runner, Aggregator aggregator,
                            SummaryPublisher publisher, TransitionMonitor monitor) {
        this.properties = properties;
        this.runner = runner;
        this.aggregator = aggregator;
        this.publisher = publisher;
        this.monitor = monitor;
    }

    @Override
    public void run(String... args) {
        try {
            CheckDefinitionSet definitions = properties.toDefinitions();
            lastReport = runner.run(definitions);
            StatusSummary summary = aggregator.summarize(definitions);
            publisher.publish(summary);
            monitor.observe(summary);
            exitCode = 0;
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", String.join("; ", e.errors()));
            exitCode = EXIT_CONFIGURATION;
        } catch (StorageException e) {
            log.error("Storage failure, invocation aborted", e);
            exitCode = EXIT_STORAGE;
        } catch (TransitionStateException e) {
            log.error("Transition state failure, invocation aborted", e);
            exitCode = EXIT_TRANSITION_STATE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /** Report of the last completed check run, or null before the first. */
    public RunReport lastReport() {
        return lastReport;
    }
}
