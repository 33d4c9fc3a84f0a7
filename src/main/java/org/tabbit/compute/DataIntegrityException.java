package org.tabbit.compute;

/**
 * Thrown when input data refers to a missing entity or records a participation twice.
 * Needs an operator to fix the data; retrying with the same input fails the same way.
 */
public class DataIntegrityException extends TabbitException {
    public DataIntegrityException(String message) {
        super(message);
    }
}
