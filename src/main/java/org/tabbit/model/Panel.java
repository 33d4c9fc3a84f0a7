package org.tabbit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Adjudicators assigned to one room.
 *
 * @param chairId      the chair, always the most experienced member
 * @param panellistIds the remaining members in descending experience
 */
public record Panel(
    @JsonProperty("chairId") String chairId,
    @JsonProperty("panellistIds") List<String> panellistIds
) {

    public Panel {
        panellistIds = panellistIds == null ? List.of() : List.copyOf(panellistIds);
    }

    /**
     * All members, chair first.
     */
    public List<String> members() {
        List<String> members = new ArrayList<>(panellistIds.size() + 1);
        members.add(chairId);
        members.addAll(panellistIds);
        return members;
    }

    public int size() {
        return panellistIds.size() + 1;
    }
}
