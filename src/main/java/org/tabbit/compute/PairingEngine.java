package org.tabbit.compute;

import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tabbit.model.ByePolicy;
import org.tabbit.model.Draw;
import org.tabbit.model.DrawConfig;
import org.tabbit.model.Pairing;
import org.tabbit.model.Seeding;
import org.tabbit.model.Standing;
import org.tabbit.model.Team;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Power-pairs teams into rooms for the next round.
 *
 * <p>Key rules:
 * - Teams are placed into rooms in rank order according to the configured {@link Seeding}
 * - No room may hold two teams that have met before, nor (when configured) two teams of one institution
 * - Conflicts are resolved by swapping with the nearest-ranked team, never by emitting an illegal room
 * - Output depends only on the inputs and the configured seed
 */
public final class PairingEngine {

    private static final Logger log = LoggerFactory.getLogger(PairingEngine.class);

    private PairingEngine() {}

    /**
     * Generates the draw for a round.
     *
     * @param roundSequence sequence number of the round being drawn
     * @param standings     current standings, one entry per team to be drawn
     * @param history       meetings and byes from completed rounds
     * @param teams         the team roster, used for institutions
     * @param config        draw settings
     * @return rooms in rank order followed by byes
     * @throws ConfigurationException if {@code config} is invalid
     * @throws DataIntegrityException if the standings name an unknown team or a team twice
     * @throws InfeasibleException    if a room cannot be made legal within the swap window,
     *                                or teams are left over and byes are disabled
     */
    public static Draw generateDraw(int roundSequence, List<Standing> standings, History history,
                                    Collection<Team> teams, DrawConfig config) {
        ConfigurationException.requireValid(config);
        Map<String, Team> roster = Rosters.indexTeams(teams);
        List<Standing> ordered = ordered(standings, roster);

        int sides = config.sidesPerRoom();
        int leftover = ordered.size() % sides;
        List<Standing> byes = List.of();
        if (leftover > 0) {
            if (config.byePolicy() == ByePolicy.NO_BYE) {
                List<String> bottom = ordered.subList(ordered.size() - leftover, ordered.size()).stream()
                    .map(Standing::teamId)
                    .toList();
                throw new InfeasibleException(Constraint.TEAM_COUNT, ordered.size() / sides + 1, bottom,
                    ordered.size() + " teams do not divide into rooms of " + sides + " and byes are disabled");
            }
            byes = chooseByes(ordered, leftover, history);
        }

        List<Standing> paired = new ArrayList<>(ordered);
        paired.removeAll(byes);

        List<List<Standing>> rooms = seed(paired, config);
        new ConflictResolver(rooms, history, roster, config).resolve();

        List<Pairing> pairings = new ArrayList<>(rooms.size() + byes.size());
        for (List<Standing> room : rooms) {
            List<String> teamIds = room.stream().map(Standing::teamId).toList();
            pairings.add(Pairing.room(roundSequence, pairings.size() + 1, teamIds));
        }
        for (Standing bye : byes) {
            pairings.add(Pairing.bye(roundSequence, pairings.size() + 1, bye.teamId()));
        }

        log.debug("Drew round {}: {} rooms, {} byes", roundSequence, rooms.size(), byes.size());
        return new Draw(roundSequence, pairings);
    }

    private static List<Standing> ordered(List<Standing> standings, Map<String, Team> roster) {
        Set<String> seen = new HashSet<>();
        for (Standing standing : standings) {
            if (!roster.containsKey(standing.teamId())) {
                throw new DataIntegrityException("Standings reference unknown team " + standing.teamId());
            }
            if (!seen.add(standing.teamId())) {
                throw new DataIntegrityException("Team " + standing.teamId() + " appears twice in the standings");
            }
        }
        List<Standing> ordered = new ArrayList<>(standings);
        ordered.sort(Comparator.comparingInt(Standing::rank).thenComparing(Standing::teamId));
        return ordered;
    }

    /**
     * Picks the lowest-ranked teams that have not yet had a bye, falling back to the
     * lowest-ranked teams overall when too few remain. Returned in rank order.
     */
    static List<Standing> chooseByes(List<Standing> ordered, int count, History history) {
        List<Standing> chosen = new ArrayList<>(count);
        for (Standing standing : Lists.reverse(ordered)) {
            if (chosen.size() == count) {
                break;
            }
            if (!history.hadBye(standing.teamId())) {
                chosen.add(standing);
            }
        }
        for (Standing standing : Lists.reverse(ordered)) {
            if (chosen.size() == count) {
                break;
            }
            if (!chosen.contains(standing)) {
                chosen.add(standing);
            }
        }
        chosen.sort(Comparator.comparingInt(Standing::rank));
        return chosen;
    }

    /**
     * Places ranked teams into rooms, each room holding its teams in side order.
     */
    static List<List<Standing>> seed(List<Standing> paired, DrawConfig config) {
        int sides = config.sidesPerRoom();
        List<List<Standing>> rooms = new ArrayList<>();
        if (config.seeding() == Seeding.ADJACENT) {
            for (List<Standing> room : Lists.partition(paired, sides)) {
                rooms.add(new ArrayList<>(room));
            }
            return rooms;
        }

        Random random = config.seeding() == Seeding.RANDOM ? new Random(config.tieBreakSeed()) : null;
        for (List<Standing> bracket : brackets(paired, sides)) {
            if (random != null) {
                Collections.shuffle(bracket, random);
                for (List<Standing> room : Lists.partition(bracket, sides)) {
                    rooms.add(new ArrayList<>(room));
                }
            } else {
                rooms.addAll(fold(bracket, sides));
            }
        }
        return rooms;
    }

    /**
     * Groups teams by points, pulling up the highest-ranked teams of the next bracket
     * until every bracket divides into whole rooms.
     */
    static List<List<Standing>> brackets(List<Standing> paired, int sides) {
        List<List<Standing>> brackets = new ArrayList<>();
        for (Standing standing : paired) {
            List<Standing> last = brackets.isEmpty() ? null : brackets.get(brackets.size() - 1);
            if (last != null && last.get(0).points() == standing.points()) {
                last.add(standing);
            } else {
                List<Standing> bracket = new ArrayList<>();
                bracket.add(standing);
                brackets.add(bracket);
            }
        }

        for (int i = 0; i < brackets.size() - 1; i++) {
            List<Standing> bracket = brackets.get(i);
            while (bracket.size() % sides != 0 && i + 1 < brackets.size()) {
                List<Standing> next = brackets.get(i + 1);
                bracket.add(next.remove(0));
                if (next.isEmpty()) {
                    brackets.remove(i + 1);
                }
            }
        }
        return brackets;
    }

    /**
     * Snake-folds a bracket into rooms: with m rooms, room i takes positions i, 2m-1-i, 2m+i, ...
     */
    static List<List<Standing>> fold(List<Standing> bracket, int sides) {
        int roomCount = bracket.size() / sides;
        List<List<Standing>> rooms = new ArrayList<>(roomCount);
        for (int i = 0; i < roomCount; i++) {
            rooms.add(new ArrayList<>(sides));
        }
        for (int position = 0; position < bracket.size(); position++) {
            int layer = position / roomCount;
            int offset = position % roomCount;
            int room = layer % 2 == 0 ? offset : roomCount - 1 - offset;
            rooms.get(room).add(bracket.get(position));
        }
        return rooms;
    }

    /**
     * Walks the rooms top-down and repairs each illegal room with bounded swaps.
     */
    private static final class ConflictResolver {

        private final List<List<Standing>> rooms;
        private final History history;
        private final Map<String, Team> roster;
        private final DrawConfig config;

        ConflictResolver(List<List<Standing>> rooms, History history, Map<String, Team> roster, DrawConfig config) {
            this.rooms = rooms;
            this.history = history;
            this.roster = roster;
            this.config = config;
        }

        void resolve() {
            for (int r = 0; r < rooms.size(); r++) {
                while (violations(rooms.get(r)) > 0) {
                    if (!swapOnce(r)) {
                        List<Standing> room = rooms.get(r);
                        Violation violation = firstViolation(room).orElseThrow();
                        throw new InfeasibleException(violation.constraint(), r + 1,
                            room.stream().map(Standing::teamId).toList(),
                            String.format("%s and %s cannot share a room and no swap within %d ranks resolves it",
                                violation.first(), violation.second(), config.maxSwapDistance()));
                    }
                }
            }
        }

        /**
         * Applies the first swap, in candidate order, that reduces the violations in room {@code r}
         * without making an already finalised room illegal.
         */
        private boolean swapOnce(int r) {
            List<Standing> room = rooms.get(r);
            int before = violations(room);
            for (Standing outgoing : conflicting(room)) {
                for (Standing candidate : candidates(outgoing, r)) {
                    int other = roomOf(candidate);
                    swap(r, outgoing, other, candidate);
                    boolean improves = violations(rooms.get(r)) < before
                        && (other > r || violations(rooms.get(other)) == 0);
                    if (improves) {
                        log.debug("Swapped {} (rank {}) with {} (rank {}) to repair room {}",
                            outgoing.teamId(), outgoing.rank(), candidate.teamId(), candidate.rank(), r + 1);
                        return true;
                    }
                    swap(r, candidate, other, outgoing);
                }
            }
            return false;
        }

        /**
         * Teams involved in a violation, lowest-ranked first.
         */
        private List<Standing> conflicting(List<Standing> room) {
            List<Standing> involved = new ArrayList<>();
            for (int i = 0; i < room.size(); i++) {
                for (int j = i + 1; j < room.size(); j++) {
                    if (clash(room.get(i), room.get(j)).isPresent()) {
                        if (!involved.contains(room.get(i))) {
                            involved.add(room.get(i));
                        }
                        if (!involved.contains(room.get(j))) {
                            involved.add(room.get(j));
                        }
                    }
                }
            }
            involved.sort(Comparator.comparingInt(Standing::rank).reversed());
            return involved;
        }

        /**
         * Swap partners for {@code outgoing}: unplaced teams in rooms below first, then teams in
         * finalised rooms above, each group by rank distance with lower-ranked teams first on ties.
         */
        private List<Standing> candidates(Standing outgoing, int r) {
            Comparator<Standing> byDistance = Comparator
                .<Standing>comparingInt(s -> Math.abs(s.rank() - outgoing.rank()))
                .thenComparing(Comparator.comparingInt(Standing::rank).reversed());
            List<Standing> below = new ArrayList<>();
            List<Standing> above = new ArrayList<>();
            for (int i = 0; i < rooms.size(); i++) {
                if (i == r) {
                    continue;
                }
                for (Standing s : rooms.get(i)) {
                    if (Math.abs(s.rank() - outgoing.rank()) <= config.maxSwapDistance()) {
                        (i > r ? below : above).add(s);
                    }
                }
            }
            below.sort(byDistance);
            above.sort(byDistance);
            List<Standing> ordered = new ArrayList<>(below);
            ordered.addAll(above);
            return ordered;
        }

        private int roomOf(Standing standing) {
            for (int i = 0; i < rooms.size(); i++) {
                if (rooms.get(i).contains(standing)) {
                    return i;
                }
            }
            throw new IllegalStateException("Team " + standing.teamId() + " is not in any room");
        }

        private void swap(int roomA, Standing inA, int roomB, Standing inB) {
            List<Standing> a = rooms.get(roomA);
            List<Standing> b = rooms.get(roomB);
            a.set(a.indexOf(inA), inB);
            b.set(b.indexOf(inB), inA);
        }

        private int violations(List<Standing> room) {
            int count = 0;
            for (int i = 0; i < room.size(); i++) {
                for (int j = i + 1; j < room.size(); j++) {
                    if (clash(room.get(i), room.get(j)).isPresent()) {
                        count++;
                    }
                }
            }
            return count;
        }

        private Optional<Violation> firstViolation(List<Standing> room) {
            for (int i = 0; i < room.size(); i++) {
                for (int j = i + 1; j < room.size(); j++) {
                    Optional<Constraint> clash = clash(room.get(i), room.get(j));
                    if (clash.isPresent()) {
                        return Optional.of(new Violation(clash.get(), room.get(i).teamId(), room.get(j).teamId()));
                    }
                }
            }
            return Optional.empty();
        }

        private Optional<Constraint> clash(Standing a, Standing b) {
            if (history.haveMet(a.teamId(), b.teamId())) {
                return Optional.of(Constraint.REPEAT_PAIRING);
            }
            if (config.avoidInstitutionClash()) {
                Optional<String> institution = roster.get(a.teamId()).institution();
                if (institution.isPresent() && institution.equals(roster.get(b.teamId()).institution())) {
                    return Optional.of(Constraint.INSTITUTION_CLASH);
                }
            }
            return Optional.empty();
        }
    }

    private record Violation(Constraint constraint, String first, String second) {}
}
