package org.tabbit.compute;

/**
 * Hard constraints a draw or allocation can fail on.
 */
public enum Constraint {
    /** Two teams in one room have met in an earlier round. */
    REPEAT_PAIRING,
    /** Two teams in one room share an institution. */
    INSTITUTION_CLASH,
    /** The roster does not divide into rooms and byes are disabled. */
    TEAM_COUNT,
    /** Not enough eligible adjudicators to fill a room's panel. */
    PANEL_SIZE
}
