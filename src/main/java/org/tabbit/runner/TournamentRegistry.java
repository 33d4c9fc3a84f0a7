package org.tabbit.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tabbit.compute.ConfigurationException;
import org.tabbit.compute.DataIntegrityException;
import org.tabbit.model.Adjudicator;
import org.tabbit.model.DrawConfig;
import org.tabbit.model.Institution;
import org.tabbit.model.RoundRecord;
import org.tabbit.model.Speaker;
import org.tabbit.model.Tag;
import org.tabbit.model.Team;
import org.tabbit.model.Tournament;
import org.tabbit.store.TournamentNotFoundException;
import org.tabbit.store.TournamentRepository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Registers, edits and removes tournaments and their institutions, teams, speakers, adjudicators and tags.
 * Ids are derived from names and made unique with a numeric suffix. Participants referenced by a
 * round's draw or ballots cannot be deleted.
 */
public class TournamentRegistry {

    private static final Logger log = LoggerFactory.getLogger(TournamentRegistry.class);

    private final TournamentRepository repository;
    private final TournamentLocks locks;

    public TournamentRegistry(TournamentRepository repository, TournamentLocks locks) {
        this.repository = repository;
        this.locks = locks;
    }

    public List<Tournament> listTournaments() {
        return repository.listTournaments();
    }

    /**
     * Tournaments whose name contains {@code nameFilter}, ignoring case; a null filter matches all.
     */
    public List<Tournament> listTournaments(String nameFilter, ListQuery query) {
        return query.apply(repository.listTournaments().stream()
            .filter(t -> nameFilter == null || t.name().toLowerCase().contains(nameFilter.toLowerCase()))
            .toList());
    }

    public Tournament getTournament(String tournamentId) {
        return repository.getTournament(tournamentId);
    }

    /**
     * Creates an empty tournament after validating its draw configuration.
     *
     * @throws ConfigurationException if {@code config} is invalid
     */
    public Tournament createTournament(String name, String abbreviation, DrawConfig config) {
        ConfigurationException.requireValid(config);
        String base = slug(name);
        return locks.withRegistry(() -> {
            Set<String> taken = repository.listTournaments().stream()
                .map(Tournament::id)
                .collect(Collectors.toSet());
            String id = unique(base, taken);
            Tournament tournament = new Tournament(id, name, abbreviation, config, List.of(), List.of(), List.of());
            repository.saveTournament(tournament);
            log.info("Created tournament {} ({})", id, name);
            return tournament;
        });
    }

    /**
     * Renames a tournament. Null arguments keep the current value; the id never changes.
     */
    public Tournament updateTournament(String tournamentId, String name, String abbreviation) {
        return locks.withTournament(tournamentId, () -> {
            Tournament tournament = repository.getTournament(tournamentId);
            Tournament updated = tournament.withDetails(
                name != null ? name : tournament.name(),
                abbreviation != null ? abbreviation : tournament.abbreviation());
            repository.saveTournament(updated);
            log.info("Updated tournament {}", tournamentId);
            return updated;
        });
    }

    /**
     * Deletes a tournament with all of its rounds.
     */
    public void deleteTournament(String tournamentId) {
        locks.withRegistry(() -> locks.withTournament(tournamentId, () -> {
            repository.deleteTournament(tournamentId);
            log.info("Deleted tournament {}", tournamentId);
            return null;
        }));
    }

    public Institution addInstitution(String tournamentId, String name) {
        return locks.withTournament(tournamentId, () -> {
            Tournament tournament = repository.getTournament(tournamentId);
            Institution institution = new Institution(uniqueId(name, tournament.institutions(), Institution::id), name);
            repository.saveTournament(tournament.withInstitution(institution));
            log.info("Registered institution {} in {}", institution.id(), tournamentId);
            return institution;
        });
    }

    public List<Institution> listInstitutions(String tournamentId, ListQuery query) {
        return query.apply(repository.getTournament(tournamentId).institutions());
    }

    /**
     * Registers a team; speakers get ids {@code <teamId>-<n>} in speaking order.
     *
     * @throws DataIntegrityException if {@code institutionId} is not registered
     */
    public Team addTeam(String tournamentId, String name, String abbreviation, String institutionId,
                        List<String> speakerNames) {
        return locks.withTournament(tournamentId, () -> {
            Tournament tournament = repository.getTournament(tournamentId);
            requireInstitution(tournament, institutionId);
            String id = uniqueId(name, tournament.teams(), Team::id);
            List<Speaker> speakers = new ArrayList<>();
            for (String speakerName : speakerNames) {
                speakers.add(new Speaker(id + "-" + (speakers.size() + 1), speakerName));
            }
            Team team = new Team(id, name, abbreviation, institutionId, speakers);
            repository.saveTournament(tournament.withTeam(team));
            log.info("Registered team {} in {}", id, tournamentId);
            return team;
        });
    }

    public Team getTeam(String tournamentId, String teamId) {
        return requireTeam(repository.getTournament(tournamentId), teamId);
    }

    /**
     * Teams in registration order, optionally only those of one institution.
     */
    public List<Team> listTeams(String tournamentId, String institutionId, ListQuery query) {
        return query.apply(repository.getTournament(tournamentId).teams().stream()
            .filter(t -> institutionId == null || institutionId.equals(t.institutionId()))
            .toList());
    }

    /**
     * Changes a team's name, abbreviation or institution. Null arguments keep the current value.
     *
     * @throws DataIntegrityException if {@code institutionId} is not registered
     */
    public Team updateTeam(String tournamentId, String teamId, String name, String abbreviation,
                           String institutionId) {
        return locks.withTournament(tournamentId, () -> {
            Tournament tournament = repository.getTournament(tournamentId);
            Team team = requireTeam(tournament, teamId);
            requireInstitution(tournament, institutionId);
            Team updated = team.withDetails(
                name != null ? name : team.name(),
                abbreviation != null ? abbreviation : team.abbreviation(),
                institutionId != null ? institutionId : team.institutionId());
            repository.saveTournament(tournament.withTeams(replace(tournament.teams(), Team::id, updated)));
            log.info("Updated team {} in {}", teamId, tournamentId);
            return updated;
        });
    }

    /**
     * Deletes a team and its speakers.
     *
     * @throws DataIntegrityException if the team appears in any round's draw
     */
    public void deleteTeam(String tournamentId, String teamId) {
        locks.withTournament(tournamentId, () -> {
            Tournament tournament = repository.getTournament(tournamentId);
            requireTeam(tournament, teamId);
            requireUnreferenced(tournamentId, "Team " + teamId,
                round -> round.pairings().stream().anyMatch(p -> p.teamIds().contains(teamId)));
            repository.saveTournament(tournament.withTeams(remove(tournament.teams(), Team::id, teamId)));
            log.info("Deleted team {} from {}", teamId, tournamentId);
            return null;
        });
    }

    /**
     * Appends a speaker to a team, after the existing speakers in speaking order.
     */
    public Speaker addSpeaker(String tournamentId, String teamId, String name) {
        return locks.withTournament(tournamentId, () -> {
            Tournament tournament = repository.getTournament(tournamentId);
            Team team = requireTeam(tournament, teamId);
            int n = team.speakers().size() + 1;
            while (team.hasSpeaker(teamId + "-" + n)) {
                n++;
            }
            Speaker speaker = new Speaker(teamId + "-" + n, name);
            List<Speaker> speakers = new ArrayList<>(team.speakers());
            speakers.add(speaker);
            Team updated = team.withSpeakers(speakers);
            repository.saveTournament(tournament.withTeams(replace(tournament.teams(), Team::id, updated)));
            log.info("Registered speaker {} in {}", speaker.id(), tournamentId);
            return speaker;
        });
    }

    /**
     * Speakers in team order, optionally only one team's or only those carrying a tag.
     */
    public List<Speaker> listSpeakers(String tournamentId, String teamId, String tagId, ListQuery query) {
        Tournament tournament = repository.getTournament(tournamentId);
        if (teamId != null) {
            requireTeam(tournament, teamId);
        }
        if (tagId != null) {
            requireTag(tournament, tagId);
        }
        return query.apply(tournament.teams().stream()
            .filter(t -> teamId == null || t.id().equals(teamId))
            .flatMap(t -> t.speakers().stream())
            .filter(s -> tagId == null || s.hasTag(tagId))
            .toList());
    }

    public Speaker updateSpeaker(String tournamentId, String speakerId, String name) {
        return locks.withTournament(tournamentId, () -> {
            Tournament tournament = repository.getTournament(tournamentId);
            Team team = requireTeamOfSpeaker(tournament, speakerId);
            Speaker updated = team.speaker(speakerId).orElseThrow().withName(name);
            repository.saveTournament(withSpeaker(tournament, team, updated));
            log.info("Updated speaker {} in {}", speakerId, tournamentId);
            return updated;
        });
    }

    /**
     * @throws DataIntegrityException if any ballot scores the speaker
     */
    public void deleteSpeaker(String tournamentId, String speakerId) {
        locks.withTournament(tournamentId, () -> {
            Tournament tournament = repository.getTournament(tournamentId);
            Team team = requireTeamOfSpeaker(tournament, speakerId);
            requireUnreferenced(tournamentId, "Speaker " + speakerId,
                round -> round.ballots().stream()
                    .flatMap(b -> b.results().stream())
                    .flatMap(r -> r.speakerScores().stream())
                    .anyMatch(score -> score.speakerId().equals(speakerId)));
            Team updated = team.withSpeakers(remove(team.speakers(), Speaker::id, speakerId));
            repository.saveTournament(tournament.withTeams(replace(tournament.teams(), Team::id, updated)));
            log.info("Deleted speaker {} from {}", speakerId, tournamentId);
            return null;
        });
    }

    /**
     * @throws DataIntegrityException if {@code institutionId} is not registered
     */
    public Adjudicator addAdjudicator(String tournamentId, String name, String institutionId, int experience,
                                      boolean independent) {
        return locks.withTournament(tournamentId, () -> {
            Tournament tournament = repository.getTournament(tournamentId);
            requireInstitution(tournament, institutionId);
            String id = uniqueId(name, tournament.adjudicators(), Adjudicator::id);
            Adjudicator adjudicator = new Adjudicator(id, name, institutionId, experience, independent);
            repository.saveTournament(tournament.withAdjudicator(adjudicator));
            log.info("Registered adjudicator {} in {}", id, tournamentId);
            return adjudicator;
        });
    }

    public Adjudicator getAdjudicator(String tournamentId, String adjudicatorId) {
        return requireAdjudicator(repository.getTournament(tournamentId), adjudicatorId);
    }

    public List<Adjudicator> listAdjudicators(String tournamentId, String institutionId, String tagId,
                                              ListQuery query) {
        Tournament tournament = repository.getTournament(tournamentId);
        if (tagId != null) {
            requireTag(tournament, tagId);
        }
        return query.apply(tournament.adjudicators().stream()
            .filter(a -> institutionId == null || institutionId.equals(a.institutionId()))
            .filter(a -> tagId == null || a.hasTag(tagId))
            .toList());
    }

    /**
     * Changes an adjudicator's details. Null arguments keep the current value.
     *
     * @throws DataIntegrityException if {@code institutionId} is not registered or {@code experience} is negative
     */
    public Adjudicator updateAdjudicator(String tournamentId, String adjudicatorId, String name,
                                         String institutionId, Integer experience, Boolean independent) {
        if (experience != null && experience < 0) {
            throw new DataIntegrityException("Experience must not be negative, was " + experience);
        }
        return locks.withTournament(tournamentId, () -> {
            Tournament tournament = repository.getTournament(tournamentId);
            Adjudicator adjudicator = requireAdjudicator(tournament, adjudicatorId);
            requireInstitution(tournament, institutionId);
            Adjudicator updated = adjudicator.withDetails(
                name != null ? name : adjudicator.name(),
                institutionId != null ? institutionId : adjudicator.institutionId(),
                experience != null ? experience : adjudicator.experience(),
                independent != null ? independent : adjudicator.independent());
            repository.saveTournament(
                tournament.withAdjudicators(replace(tournament.adjudicators(), Adjudicator::id, updated)));
            log.info("Updated adjudicator {} in {}", adjudicatorId, tournamentId);
            return updated;
        });
    }

    /**
     * @throws DataIntegrityException if the adjudicator sits on any round's panel
     */
    public void deleteAdjudicator(String tournamentId, String adjudicatorId) {
        locks.withTournament(tournamentId, () -> {
            Tournament tournament = repository.getTournament(tournamentId);
            requireAdjudicator(tournament, adjudicatorId);
            requireUnreferenced(tournamentId, "Adjudicator " + adjudicatorId,
                round -> round.pairings().stream()
                    .anyMatch(p -> p.panel() != null && p.panel().members().contains(adjudicatorId)));
            repository.saveTournament(
                tournament.withAdjudicators(remove(tournament.adjudicators(), Adjudicator::id, adjudicatorId)));
            log.info("Deleted adjudicator {} from {}", adjudicatorId, tournamentId);
            return null;
        });
    }

    /**
     * Creates a tag; tag names are unique within a tournament, ignoring case.
     *
     * @throws DataIntegrityException if a tag with that name exists
     */
    public Tag createTag(String tournamentId, String name) {
        return locks.withTournament(tournamentId, () -> {
            Tournament tournament = repository.getTournament(tournamentId);
            requireFreeTagName(tournament, name, null);
            Tag tag = new Tag(uniqueId(name, tournament.tags(), Tag::id), name);
            repository.saveTournament(tournament.withTag(tag));
            log.info("Created tag {} in {}", tag.id(), tournamentId);
            return tag;
        });
    }

    public List<Tag> listTags(String tournamentId, ListQuery query) {
        return query.apply(repository.getTournament(tournamentId).tags());
    }

    public Tag renameTag(String tournamentId, String tagId, String name) {
        return locks.withTournament(tournamentId, () -> {
            Tournament tournament = repository.getTournament(tournamentId);
            requireTag(tournament, tagId);
            requireFreeTagName(tournament, name, tagId);
            Tag renamed = new Tag(tagId, name);
            repository.saveTournament(tournament.withTags(replace(tournament.tags(), Tag::id, renamed)));
            log.info("Renamed tag {} in {}", tagId, tournamentId);
            return renamed;
        });
    }

    /**
     * Deletes a tag and detaches it from every speaker and adjudicator.
     */
    public void deleteTag(String tournamentId, String tagId) {
        locks.withTournament(tournamentId, () -> {
            Tournament tournament = repository.getTournament(tournamentId);
            requireTag(tournament, tagId);
            List<Team> teams = tournament.teams().stream()
                .map(t -> t.withSpeakers(t.speakers().stream().map(s -> s.untagged(tagId)).toList()))
                .toList();
            List<Adjudicator> adjudicators = tournament.adjudicators().stream()
                .map(a -> a.untagged(tagId))
                .toList();
            repository.saveTournament(tournament.withTags(remove(tournament.tags(), Tag::id, tagId))
                .withTeams(teams)
                .withAdjudicators(adjudicators));
            log.info("Deleted tag {} from {}", tagId, tournamentId);
            return null;
        });
    }

    /**
     * Attaches a tag to speakers. Speakers already carrying it are left unchanged.
     *
     * @throws TournamentNotFoundException if the tag or any speaker is not registered; nothing is saved then
     */
    public List<Speaker> tagSpeakers(String tournamentId, String tagId, List<String> speakerIds) {
        return locks.withTournament(tournamentId, () -> {
            Tournament tournament = repository.getTournament(tournamentId);
            requireTag(tournament, tagId);
            List<Speaker> tagged = new ArrayList<>();
            for (String speakerId : speakerIds) {
                Team team = requireTeamOfSpeaker(tournament, speakerId);
                Speaker speaker = team.speaker(speakerId).orElseThrow().tagged(tagId);
                tournament = withSpeaker(tournament, team, speaker);
                tagged.add(speaker);
            }
            repository.saveTournament(tournament);
            log.info("Tagged {} speakers with {} in {}", tagged.size(), tagId, tournamentId);
            return tagged;
        });
    }

    /**
     * @throws TournamentNotFoundException if the speaker does not carry the tag
     */
    public Speaker untagSpeaker(String tournamentId, String tagId, String speakerId) {
        return locks.withTournament(tournamentId, () -> {
            Tournament tournament = repository.getTournament(tournamentId);
            Team team = requireTeamOfSpeaker(tournament, speakerId);
            Speaker speaker = team.speaker(speakerId).orElseThrow();
            if (!speaker.hasTag(tagId)) {
                throw new TournamentNotFoundException("Speaker " + speakerId + " has no tag " + tagId);
            }
            Speaker untagged = speaker.untagged(tagId);
            repository.saveTournament(withSpeaker(tournament, team, untagged));
            log.info("Removed tag {} from speaker {} in {}", tagId, speakerId, tournamentId);
            return untagged;
        });
    }

    /**
     * Attaches a tag to adjudicators. Adjudicators already carrying it are left unchanged.
     *
     * @throws TournamentNotFoundException if the tag or any adjudicator is not registered; nothing is saved then
     */
    public List<Adjudicator> tagAdjudicators(String tournamentId, String tagId, List<String> adjudicatorIds) {
        return locks.withTournament(tournamentId, () -> {
            Tournament tournament = repository.getTournament(tournamentId);
            requireTag(tournament, tagId);
            List<Adjudicator> tagged = new ArrayList<>();
            for (String adjudicatorId : adjudicatorIds) {
                Adjudicator adjudicator = requireAdjudicator(tournament, adjudicatorId).tagged(tagId);
                tournament = tournament.withAdjudicators(
                    replace(tournament.adjudicators(), Adjudicator::id, adjudicator));
                tagged.add(adjudicator);
            }
            repository.saveTournament(tournament);
            log.info("Tagged {} adjudicators with {} in {}", tagged.size(), tagId, tournamentId);
            return tagged;
        });
    }

    /**
     * @throws TournamentNotFoundException if the adjudicator does not carry the tag
     */
    public Adjudicator untagAdjudicator(String tournamentId, String tagId, String adjudicatorId) {
        return locks.withTournament(tournamentId, () -> {
            Tournament tournament = repository.getTournament(tournamentId);
            Adjudicator adjudicator = requireAdjudicator(tournament, adjudicatorId);
            if (!adjudicator.hasTag(tagId)) {
                throw new TournamentNotFoundException("Adjudicator " + adjudicatorId + " has no tag " + tagId);
            }
            Adjudicator untagged = adjudicator.untagged(tagId);
            repository.saveTournament(
                tournament.withAdjudicators(replace(tournament.adjudicators(), Adjudicator::id, untagged)));
            log.info("Removed tag {} from adjudicator {} in {}", tagId, adjudicatorId, tournamentId);
            return untagged;
        });
    }

    private void requireUnreferenced(String tournamentId, String what, Predicate<RoundRecord> uses) {
        for (RoundRecord round : repository.findRounds(tournamentId)) {
            if (uses.test(round)) {
                throw new DataIntegrityException(
                    what + " is referenced by round " + round.sequence() + " and cannot be deleted");
            }
        }
    }

    private static Team requireTeam(Tournament tournament, String teamId) {
        return tournament.team(teamId).orElseThrow(() -> new TournamentNotFoundException(
            "Team " + teamId + " not found in tournament " + tournament.id()));
    }

    private static Team requireTeamOfSpeaker(Tournament tournament, String speakerId) {
        return tournament.teamOfSpeaker(speakerId).orElseThrow(() -> new TournamentNotFoundException(
            "Speaker " + speakerId + " not found in tournament " + tournament.id()));
    }

    private static Adjudicator requireAdjudicator(Tournament tournament, String adjudicatorId) {
        return tournament.adjudicator(adjudicatorId).orElseThrow(() -> new TournamentNotFoundException(
            "Adjudicator " + adjudicatorId + " not found in tournament " + tournament.id()));
    }

    private static Tag requireTag(Tournament tournament, String tagId) {
        return tournament.tag(tagId).orElseThrow(() -> new TournamentNotFoundException(
            "Tag " + tagId + " not found in tournament " + tournament.id()));
    }

    private static void requireFreeTagName(Tournament tournament, String name, String exceptTagId) {
        for (Tag tag : tournament.tags()) {
            if (tag.name().equalsIgnoreCase(name) && !tag.id().equals(exceptTagId)) {
                throw new DataIntegrityException("Tag " + name + " already exists in " + tournament.id());
            }
        }
    }

    private static Tournament withSpeaker(Tournament tournament, Team team, Speaker speaker) {
        Team updated = team.withSpeakers(replace(team.speakers(), Speaker::id, speaker));
        return tournament.withTeams(replace(tournament.teams(), Team::id, updated));
    }

    private static <T> List<T> replace(List<T> items, Function<T, String> idOf, T replacement) {
        String id = idOf.apply(replacement);
        return items.stream().map(item -> idOf.apply(item).equals(id) ? replacement : item).toList();
    }

    private static <T> List<T> remove(List<T> items, Function<T, String> idOf, String id) {
        return items.stream().filter(item -> !idOf.apply(item).equals(id)).toList();
    }

    private static void requireInstitution(Tournament tournament, String institutionId) {
        if (institutionId != null && tournament.institution(institutionId).isEmpty()) {
            throw new DataIntegrityException("Unknown institution " + institutionId + " in " + tournament.id());
        }
    }

    private static <T> String uniqueId(String name, Collection<T> existing, Function<T, String> idOf) {
        Set<String> taken = existing.stream().map(idOf).collect(Collectors.toSet());
        return unique(slug(name), taken);
    }

    private static String unique(String base, Set<String> taken) {
        if (!taken.contains(base)) {
            return base;
        }
        int suffix = 2;
        while (taken.contains(base + "-" + suffix)) {
            suffix++;
        }
        return base + "-" + suffix;
    }

    static String slug(String name) {
        return name.toLowerCase().replaceAll("[^a-z0-9]", "-");
    }
}
