package org.tabbit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A team's outcome in one debate.
 *
 * @param teamId        the team
 * @param placement     1 for first; in two-sided debates 1 is a win and 2 a loss
 * @param speakerScores individual speaker points; their sum is the team's speaker score
 */
public record TeamResult(
    @JsonProperty("teamId") String teamId,
    @JsonProperty("placement") int placement,
    @JsonProperty("speakerScores") List<SpeakerScore> speakerScores
) {

    public TeamResult {
        speakerScores = speakerScores == null ? List.of() : List.copyOf(speakerScores);
    }

    public double speakerTotal() {
        return speakerScores.stream().mapToDouble(SpeakerScore::score).sum();
    }
}
