package org.tabbit.runner;

/**
 * Receives round changes after they have been saved.
 */
@FunctionalInterface
public interface RoundEventListener {

    RoundEventListener NONE = event -> { };

    void onRoundChanged(RoundEvent event);
}
