package org.tabbit.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.tabbit.model.Ballot;
import org.tabbit.model.SpeakerScore;
import org.tabbit.model.TeamResult;

import java.util.List;

/**
 * DTO for submitting a room's result.
 */
public record BallotRequest(
    @JsonProperty("pairingId") @NotBlank String pairingId,
    @JsonProperty("results") @NotEmpty @Valid List<Result> results
) {

    public record Result(
        @JsonProperty("teamId") @NotBlank String teamId,
        @JsonProperty("placement") @Min(1) int placement,
        @JsonProperty("speakerScores") @Valid List<Score> speakerScores
    ) {}

    public record Score(
        @JsonProperty("speakerId") @NotBlank String speakerId,
        @JsonProperty("position") @Min(1) int position,
        @JsonProperty("score") @DecimalMin("0.0") double score
    ) {}

    public Ballot toBallot() {
        List<TeamResult> teamResults = results.stream()
            .map(r -> new TeamResult(r.teamId(), r.placement(),
                r.speakerScores() == null ? List.of() : r.speakerScores().stream()
                    .map(s -> new SpeakerScore(s.speakerId(), s.position(), s.score()))
                    .toList()))
            .toList();
        return new Ballot(pairingId, teamResults);
    }
}
