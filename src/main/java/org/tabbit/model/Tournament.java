package org.tabbit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A tournament with its configuration, registered participants and tags.
 * Rounds are stored separately as {@link RoundRecord}s.
 */
public record Tournament(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("abbreviation") String abbreviation,
    @JsonProperty("config") DrawConfig config,
    @JsonProperty("institutions") List<Institution> institutions,
    @JsonProperty("teams") List<Team> teams,
    @JsonProperty("adjudicators") List<Adjudicator> adjudicators,
    @JsonProperty("tags") List<Tag> tags
) {

    public Tournament {
        config = config == null ? DrawConfig.defaults() : config;
        institutions = institutions == null ? List.of() : List.copyOf(institutions);
        teams = teams == null ? List.of() : List.copyOf(teams);
        adjudicators = adjudicators == null ? List.of() : List.copyOf(adjudicators);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public Tournament(String id, String name, String abbreviation, DrawConfig config, List<Institution> institutions,
                      List<Team> teams, List<Adjudicator> adjudicators) {
        this(id, name, abbreviation, config, institutions, teams, adjudicators, List.of());
    }

    public Optional<Institution> institution(String institutionId) {
        return institutions.stream().filter(i -> i.id().equals(institutionId)).findFirst();
    }

    public Optional<Team> team(String teamId) {
        return teams.stream().filter(t -> t.id().equals(teamId)).findFirst();
    }

    public Optional<Adjudicator> adjudicator(String adjudicatorId) {
        return adjudicators.stream().filter(a -> a.id().equals(adjudicatorId)).findFirst();
    }

    public Optional<Tag> tag(String tagId) {
        return tags.stream().filter(t -> t.id().equals(tagId)).findFirst();
    }

    /**
     * The team a speaker belongs to.
     */
    public Optional<Team> teamOfSpeaker(String speakerId) {
        return teams.stream().filter(t -> t.hasSpeaker(speakerId)).findFirst();
    }

    public Tournament withDetails(String newName, String newAbbreviation) {
        return new Tournament(id, newName, newAbbreviation, config, institutions, teams, adjudicators, tags);
    }

    public Tournament withInstitution(Institution institution) {
        return withInstitutions(append(institutions, institution));
    }

    public Tournament withInstitutions(List<Institution> updated) {
        return new Tournament(id, name, abbreviation, config, updated, teams, adjudicators, tags);
    }

    public Tournament withTeam(Team team) {
        return withTeams(append(teams, team));
    }

    public Tournament withTeams(List<Team> updated) {
        return new Tournament(id, name, abbreviation, config, institutions, updated, adjudicators, tags);
    }

    public Tournament withAdjudicator(Adjudicator adjudicator) {
        return withAdjudicators(append(adjudicators, adjudicator));
    }

    public Tournament withAdjudicators(List<Adjudicator> updated) {
        return new Tournament(id, name, abbreviation, config, institutions, teams, updated, tags);
    }

    public Tournament withTag(Tag tag) {
        return withTags(append(tags, tag));
    }

    public Tournament withTags(List<Tag> updated) {
        return new Tournament(id, name, abbreviation, config, institutions, teams, adjudicators, updated);
    }

    private static <T> List<T> append(List<T> list, T item) {
        List<T> copy = new ArrayList<>(list);
        copy.add(item);
        return copy;
    }
}
