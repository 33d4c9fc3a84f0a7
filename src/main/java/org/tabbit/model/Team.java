package org.tabbit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * A team registered for a tournament.
 *
 * @param id            stable identifier, unique within the tournament
 * @param name          display name
 * @param abbreviation  optional short name
 * @param institutionId affiliated institution, or null for independent teams
 * @param speakers      members in speaking order
 */
public record Team(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("abbreviation") String abbreviation,
    @JsonProperty("institutionId") String institutionId,
    @JsonProperty("speakers") List<Speaker> speakers
) {

    public Team {
        speakers = speakers == null ? List.of() : List.copyOf(speakers);
    }

    /**
     * Convenience constructor for a team without abbreviation or speakers.
     */
    public Team(String id, String name, String institutionId) {
        this(id, name, null, institutionId, List.of());
    }

    public Optional<String> institution() {
        return Optional.ofNullable(institutionId);
    }

    public boolean hasSpeaker(String speakerId) {
        return speakers.stream().anyMatch(s -> s.id().equals(speakerId));
    }

    public Optional<Speaker> speaker(String speakerId) {
        return speakers.stream().filter(s -> s.id().equals(speakerId)).findFirst();
    }

    public Team withDetails(String newName, String newAbbreviation, String newInstitutionId) {
        return new Team(id, newName, newAbbreviation, newInstitutionId, speakers);
    }

    public Team withSpeakers(List<Speaker> updated) {
        return new Team(id, name, abbreviation, institutionId, updated);
    }
}
