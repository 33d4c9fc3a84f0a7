package org.tabbit.model;

/**
 * Lifecycle of a round: PENDING -> DRAWN -> IN_PROGRESS -> COMPLETED.
 * A DRAWN round may go back to PENDING when its draw is discarded.
 */
public enum RoundStatus {
    PENDING,
    DRAWN,
    IN_PROGRESS,
    COMPLETED;

    public boolean canTransitionTo(RoundStatus next) {
        return switch (this) {
            case PENDING -> next == DRAWN;
            case DRAWN -> next == IN_PROGRESS || next == PENDING;
            case IN_PROGRESS -> next == COMPLETED;
            case COMPLETED -> false;
        };
    }
}
