package org.tabbit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An adjudicator available for panels.
 *
 * @param id            stable identifier
 * @param name          display name
 * @param institutionId affiliated institution, or null
 * @param experience    seniority rank; higher means more senior
 * @param independent   independent adjudicators are not conflicted by their institution
 * @param tagIds        ids of the tournament tags attached to this adjudicator
 */
public record Adjudicator(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("institutionId") String institutionId,
    @JsonProperty("experience") int experience,
    @JsonProperty("independent") boolean independent,
    @JsonProperty("tagIds") List<String> tagIds
) {

    public Adjudicator {
        tagIds = tagIds == null ? List.of() : List.copyOf(tagIds);
    }

    public Adjudicator(String id, String name, String institutionId, int experience, boolean independent) {
        this(id, name, institutionId, experience, independent, List.of());
    }

    public Optional<String> institution() {
        return Optional.ofNullable(institutionId);
    }

    /**
     * Institution this adjudicator is conflicted with, ignoring it for independents.
     */
    public Optional<String> conflictInstitution() {
        return independent ? Optional.empty() : institution();
    }

    public boolean hasTag(String tagId) {
        return tagIds.contains(tagId);
    }

    public Adjudicator withDetails(String newName, String newInstitutionId, int newExperience, boolean isIndependent) {
        return new Adjudicator(id, newName, newInstitutionId, newExperience, isIndependent, tagIds);
    }

    public Adjudicator tagged(String tagId) {
        if (hasTag(tagId)) {
            return this;
        }
        List<String> tags = new ArrayList<>(tagIds);
        tags.add(tagId);
        return new Adjudicator(id, name, institutionId, experience, independent, tags);
    }

    public Adjudicator untagged(String tagId) {
        return new Adjudicator(id, name, institutionId, experience, independent,
            tagIds.stream().filter(t -> !t.equals(tagId)).toList());
    }
}
