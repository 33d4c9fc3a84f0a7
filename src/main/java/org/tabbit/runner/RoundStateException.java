package org.tabbit.runner;

import org.tabbit.compute.TabbitException;

/**
 * Thrown when a round operation is not allowed in the round's current status,
 * or earlier rounds are not yet completed.
 */
public class RoundStateException extends TabbitException {
    public RoundStateException(String message) {
        super(message);
    }
}
