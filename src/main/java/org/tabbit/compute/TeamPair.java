package org.tabbit.compute;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Unordered pair of team ids, stored with the smaller id first.
 */
public record TeamPair(
    @JsonProperty("first") String first,
    @JsonProperty("second") String second
) {

    public TeamPair {
        if (first.compareTo(second) > 0) {
            String swap = first;
            first = second;
            second = swap;
        }
    }

    public static TeamPair of(String a, String b) {
        return new TeamPair(a, b);
    }
}
