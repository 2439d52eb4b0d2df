package com.vigil.aggregation.transition;

import java.util.Optional;

/**
 * Persistence of the single {@link TransitionState} value.
 */
public interface TransitionStateStore {

    /**
     * @return the stored state, or empty before the first save
     * @throws TransitionStateException if the state exists but cannot be read
     */
    Optional<TransitionState> load();

    /**
     * Replaces the stored state atomically.
     *
     * @throws TransitionStateException if the state cannot be written
     */
    void save(TransitionState state);
}
