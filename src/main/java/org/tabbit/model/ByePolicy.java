package org.tabbit.model;

/**
 * What to do with teams left over when the roster does not divide into full rooms.
 */
public enum ByePolicy {
    /** The lowest-ranked leftover teams each receive a bye. */
    LOWEST_RANK_BYE,
    /** Leftover teams make the draw infeasible. */
    NO_BYE
}
