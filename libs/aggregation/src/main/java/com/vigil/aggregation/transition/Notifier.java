package com.vigil.aggregation.transition;

/**
 * Delivers transition events to an external channel.
 * <p>
 * Delivery is at-least-once: an event whose state could not be saved afterwards is delivered
 * again on the next invocation with the same {@link TransitionEvent#dedupKey()}. Implementations
 * that need exactly-once must deduplicate on that key.
 */
@FunctionalInterface
public interface Notifier {

    /**
     * @throws RuntimeException if delivery failed; the state is then left unchanged
     */
    void deliver(TransitionEvent event);
}
