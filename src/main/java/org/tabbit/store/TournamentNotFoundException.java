package org.tabbit.store;

/**
 * Thrown when a requested tournament, round or registered entity cannot be found.
 */
public class TournamentNotFoundException extends RuntimeException {
    public TournamentNotFoundException(String message) {
        super(message);
    }
}
