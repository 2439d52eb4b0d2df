package com.vigil.aggregation;

import com.vigil.resultstore.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Hands the {@link StatusSummary} to the site renderer as a JSON file.
 */
public class SummaryPublisher {

    private static final Logger log = LoggerFactory.getLogger(SummaryPublisher.class);

    private final Path target;

    public SummaryPublisher(Path target) {
        if (target == null) {
            throw new IllegalArgumentException("target must not be null");
        }
        this.target = target;
    }

    /**
     * @throws StorageException if the file cannot be written
     */
    public void publish(StatusSummary summary) {
        try {
            JsonFiles.writeAtomically(target, summary);
        } catch (IOException e) {
            throw new StorageException("Cannot write status summary to " + target, e);
        }
        log.info("Published status summary to {} ({})", target, summary.currentOverall());
    }

    public Path target() {
        return target;
    }
}
