package org.tabbit.store;

import org.tabbit.model.RoundRecord;
import org.tabbit.model.Tournament;

import java.util.List;
import java.util.Optional;

/**
 * Persistent storage of tournaments and their rounds, keyed by tournament id.
 * Each save replaces the stored value as a whole; readers never observe a partial write.
 */
public interface TournamentRepository {

    List<Tournament> listTournaments();

    Optional<Tournament> findTournament(String tournamentId);

    void saveTournament(Tournament tournament);

    /**
     * Rounds of a tournament in sequence order.
     */
    List<RoundRecord> findRounds(String tournamentId);

    Optional<RoundRecord> findRound(String tournamentId, int sequence);

    void saveRound(String tournamentId, RoundRecord round);

    /**
     * Removes a tournament together with all of its rounds.
     *
     * @throws TournamentNotFoundException if the tournament does not exist
     */
    void deleteTournament(String tournamentId);

    /**
     * @throws TournamentNotFoundException if the round does not exist
     */
    void deleteRound(String tournamentId, int sequence);

    default Tournament getTournament(String tournamentId) {
        return findTournament(tournamentId)
            .orElseThrow(() -> new TournamentNotFoundException("Tournament not found: " + tournamentId));
    }

    default RoundRecord getRound(String tournamentId, int sequence) {
        return findRound(tournamentId, sequence)
            .orElseThrow(() -> new TournamentNotFoundException(
                "Round " + sequence + " not found in tournament " + tournamentId));
    }
}
