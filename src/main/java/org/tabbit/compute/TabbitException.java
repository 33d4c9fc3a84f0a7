package org.tabbit.compute;

/**
 * Base class of every error raised while computing standings, draws or allocations.
 */
public class TabbitException extends RuntimeException {
    public TabbitException(String message) {
        super(message);
    }
}
