package org.tabbit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A debater on a team.
 *
 * @param tagIds ids of the tournament tags attached to this speaker
 */
public record Speaker(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("tagIds") List<String> tagIds
) {

    public Speaker {
        tagIds = tagIds == null ? List.of() : List.copyOf(tagIds);
    }

    public Speaker(String id, String name) {
        this(id, name, List.of());
    }

    public boolean hasTag(String tagId) {
        return tagIds.contains(tagId);
    }

    public Speaker withName(String newName) {
        return new Speaker(id, newName, tagIds);
    }

    public Speaker tagged(String tagId) {
        if (hasTag(tagId)) {
            return this;
        }
        List<String> tags = new ArrayList<>(tagIds);
        tags.add(tagId);
        return new Speaker(id, name, tags);
    }

    public Speaker untagged(String tagId) {
        return new Speaker(id, name, tagIds.stream().filter(t -> !t.equals(tagId)).toList());
    }
}
