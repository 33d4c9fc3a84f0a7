package org.tabbit.model;

/**
 * How ranked teams are placed into rooms.
 */
public enum Seeding {
    /** Consecutive ranks share a room: 1-2, 3-4, ... */
    ADJACENT,
    /** Within each point bracket the top half meets the bottom half: 1 v n, 2 v n-1, ... */
    FOLDED,
    /** Within each point bracket teams are shuffled using the configured seed. */
    RANDOM
}
