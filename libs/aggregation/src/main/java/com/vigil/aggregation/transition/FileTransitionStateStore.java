package com.vigil.aggregation.transition;

import com.vigil.aggregation.JsonFiles;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Keeps the transition state in one JSON file, replaced atomically on save.
 */
public class FileTransitionStateStore implements TransitionStateStore {

    private final Path file;

    public FileTransitionStateStore(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("file must not be null");
        }
        this.file = file;
    }

    @Override
    public Optional<TransitionState> load() {
        try {
            return JsonFiles.readIfExists(file, TransitionState.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new TransitionStateException("Cannot read transition state " + file, e);
        }
    }

    @Override
    public void save(TransitionState state) {
        try {
            JsonFiles.writeAtomically(file, state);
        } catch (IOException e) {
            throw new TransitionStateException("Cannot write transition state " + file, e);
        }
    }

    public Path file() {
        return file;
    }
}
