package org.tabbit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A round together with its motions, draw and submitted ballots.
 * This is the unit the store reads and writes, one file per round.
 */
public record RoundRecord(
    @JsonProperty("round") Round round,
    @JsonProperty("motions") List<Motion> motions,
    @JsonProperty("pairings") List<Pairing> pairings,
    @JsonProperty("ballots") List<Ballot> ballots
) {

    public RoundRecord {
        motions = motions == null ? List.of() : List.copyOf(motions);
        pairings = pairings == null ? List.of() : List.copyOf(pairings);
        ballots = ballots == null ? List.of() : List.copyOf(ballots);
    }

    public RoundRecord(Round round, List<Pairing> pairings, List<Ballot> ballots) {
        this(round, List.of(), pairings, ballots);
    }

    public static RoundRecord pending(Round round) {
        return new RoundRecord(round, List.of(), List.of(), List.of());
    }

    public int sequence() {
        return round.sequence();
    }

    public RoundStatus status() {
        return round.status();
    }

    public Optional<Pairing> pairing(String pairingId) {
        return pairings.stream().filter(p -> p.id().equals(pairingId)).findFirst();
    }

    public Optional<Ballot> ballotFor(String pairingId) {
        return ballots.stream().filter(b -> b.pairingId().equals(pairingId)).findFirst();
    }

    public Optional<Motion> motion(String motionId) {
        return motions.stream().filter(m -> m.id().equals(motionId)).findFirst();
    }

    public RoundRecord withStatus(RoundStatus next) {
        return new RoundRecord(round.withStatus(next), motions, pairings, ballots);
    }

    public RoundRecord withRound(Round updated) {
        return new RoundRecord(updated, motions, pairings, ballots);
    }

    public RoundRecord withDraw(RoundStatus next, List<Pairing> draw) {
        return new RoundRecord(round.withStatus(next), motions, draw, List.of());
    }

    public RoundRecord withMotions(List<Motion> updated) {
        return new RoundRecord(round, updated, pairings, ballots);
    }

    /**
     * Returns a copy holding {@code ballot}, replacing any earlier ballot for the same pairing.
     */
    public RoundRecord withBallot(Ballot ballot) {
        List<Ballot> updated = new ArrayList<>(ballots.size() + 1);
        for (Ballot existing : ballots) {
            if (!existing.pairingId().equals(ballot.pairingId())) {
                updated.add(existing);
            }
        }
        updated.add(ballot);
        return new RoundRecord(round, motions, pairings, updated);
    }
}
