package org.tabbit.model;

/**
 * Final standings key after points and speaker score.
 */
public enum TieBreak {
    /** Ascending team id. */
    TEAM_ID,
    /** A hash of the team id keyed by the configured seed, then team id. */
    SEEDED
}
