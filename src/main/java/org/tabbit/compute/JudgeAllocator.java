package org.tabbit.compute;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tabbit.model.Adjudicator;
import org.tabbit.model.Draw;
import org.tabbit.model.DrawConfig;
import org.tabbit.model.Pairing;
import org.tabbit.model.Panel;
import org.tabbit.model.Team;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Assigns adjudicator panels to the rooms of a draw.
 *
 * <p>Rooms are filled in rank order, each taking the most experienced adjudicators still free
 * who have no conflict with any team in the room. The most experienced panel member chairs.
 */
public final class JudgeAllocator {

    private static final Logger log = LoggerFactory.getLogger(JudgeAllocator.class);

    private static final Comparator<Adjudicator> SENIORITY =
        Comparator.comparingInt(Adjudicator::experience).reversed()
            .thenComparing(Adjudicator::id);

    private JudgeAllocator() {}

    /**
     * Returns {@code draw} with a panel on every room. Byes get no panel; adjudicators
     * left over are simply unassigned.
     *
     * @param draw         the draw to staff
     * @param adjudicators the available pool
     * @param history      prior judging relations from completed rounds
     * @param teams        the team roster, used for institutions
     * @param config       supplies the panel size
     * @throws ConfigurationException if {@code config} is invalid
     * @throws DataIntegrityException if the pool repeats an id or the draw names an unknown team
     * @throws InfeasibleException    naming the first room that cannot be staffed without a conflict
     */
    public static Draw allocatePanels(Draw draw, Collection<Adjudicator> adjudicators, History history,
                                      Collection<Team> teams, DrawConfig config) {
        ConfigurationException.requireValid(config);
        Map<String, Team> roster = Rosters.indexTeams(teams);
        List<Adjudicator> bySeniority = new ArrayList<>(Rosters.indexAdjudicators(adjudicators).values());
        bySeniority.sort(SENIORITY);

        Set<String> seenTeams = new HashSet<>();
        for (Pairing pairing : draw.pairings()) {
            for (String teamId : pairing.teamIds()) {
                if (!roster.containsKey(teamId)) {
                    throw new DataIntegrityException("Draw references unknown team " + teamId);
                }
                if (!seenTeams.add(teamId)) {
                    throw new DataIntegrityException("Team " + teamId + " appears twice in the draw");
                }
            }
        }

        List<Pairing> byRank = new ArrayList<>(draw.pairings());
        byRank.sort(Comparator.comparingInt(Pairing::rank));

        Set<String> used = new HashSet<>();
        List<Pairing> staffed = new ArrayList<>(byRank.size());
        for (Pairing pairing : byRank) {
            if (pairing.bye()) {
                staffed.add(pairing);
                continue;
            }
            List<Team> roomTeams = pairing.teamIds().stream().map(roster::get).toList();
            List<Adjudicator> panel = new ArrayList<>(config.panelSize());
            for (Adjudicator adjudicator : bySeniority) {
                if (panel.size() == config.panelSize()) {
                    break;
                }
                if (!used.contains(adjudicator.id()) && !conflicted(adjudicator, roomTeams, history, config)) {
                    panel.add(adjudicator);
                }
            }
            if (panel.size() < config.panelSize()) {
                throw new InfeasibleException(Constraint.PANEL_SIZE, pairing.rank(), pairing.teamIds(),
                    String.format("needs %d adjudicators but only %d are free and unconflicted",
                        config.panelSize(), panel.size()));
            }
            panel.forEach(a -> used.add(a.id()));
            List<String> panellists = panel.subList(1, panel.size()).stream().map(Adjudicator::id).toList();
            staffed.add(pairing.withPanel(new Panel(panel.get(0).id(), panellists)));
        }

        log.debug("Allocated {} of {} adjudicators across round {}",
            used.size(), bySeniority.size(), draw.roundSequence());
        return new Draw(draw.roundSequence(), staffed);
    }

    static boolean conflicted(Adjudicator adjudicator, List<Team> roomTeams, History history, DrawConfig config) {
        Optional<String> ownInstitution = adjudicator.conflictInstitution();
        for (Team team : roomTeams) {
            if (history.hasJudged(adjudicator.id(), team.id())) {
                return true;
            }
            if (ownInstitution.isPresent() && ownInstitution.equals(team.institution())) {
                return true;
            }
            if (config.avoidJudgedInstitutions() && team.institution().isPresent()
                && history.hasJudgedInstitution(adjudicator.id(), team.institutionId())) {
                return true;
            }
        }
        return false;
    }
}
