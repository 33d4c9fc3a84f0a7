package org.tabbit.compute;

import java.util.List;

/**
 * Thrown when no legal draw or allocation exists under the current constraints.
 * Carries the room and constraint so an operator can relax the configuration and retry.
 */
public class InfeasibleException extends TabbitException {

    private final Constraint constraint;
    private final int roomRank;
    private final List<String> teamIds;

    public InfeasibleException(Constraint constraint, int roomRank, List<String> teamIds, String reason) {
        super(String.format("Room %d %s: %s (teams %s)", roomRank, constraint, reason, teamIds));
        this.constraint = constraint;
        this.roomRank = roomRank;
        this.teamIds = List.copyOf(teamIds);
    }

    public Constraint constraint() {
        return constraint;
    }

    /**
     * Rank of the offending room, 1 being the top room.
     */
    public int roomRank() {
        return roomRank;
    }

    public List<String> teamIds() {
        return teamIds;
    }
}
