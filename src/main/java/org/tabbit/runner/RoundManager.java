package org.tabbit.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tabbit.compute.ConfigurationException;
import org.tabbit.compute.DataIntegrityException;
import org.tabbit.compute.History;
import org.tabbit.compute.HistoryTracker;
import org.tabbit.compute.JudgeAllocator;
import org.tabbit.compute.PairingEngine;
import org.tabbit.compute.StandingsCalculator;
import org.tabbit.model.Ballot;
import org.tabbit.model.Draw;
import org.tabbit.model.Motion;
import org.tabbit.model.Pairing;
import org.tabbit.model.Round;
import org.tabbit.model.RoundRecord;
import org.tabbit.model.RoundStatus;
import org.tabbit.model.SpeakerScore;
import org.tabbit.model.SpeakerStanding;
import org.tabbit.model.Standing;
import org.tabbit.model.Team;
import org.tabbit.model.TeamResult;
import org.tabbit.model.Tournament;
import org.tabbit.store.TournamentNotFoundException;
import org.tabbit.store.TournamentRepository;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drives rounds through their lifecycle: create, draw, start, collect ballots, complete.
 * Also keeps each round's motions, name and abbreviation.
 *
 * <p>Every write holds the lock for its round, so concurrent requests against one round are
 * applied one at a time. Draws and ballots also hold the tournament lock, so the roster they
 * check against cannot change underneath them. Standings, history and draws are always computed from completed rounds.
 */
public class RoundManager {

    private static final Logger log = LoggerFactory.getLogger(RoundManager.class);

    private final TournamentRepository repository;
    private final TournamentLocks locks;
    private final RoundEventListener listener;

    public RoundManager(TournamentRepository repository, TournamentLocks locks, RoundEventListener listener) {
        this.repository = repository;
        this.locks = locks;
        this.listener = listener;
    }

    public List<RoundRecord> listRounds(String tournamentId) {
        repository.getTournament(tournamentId);
        return repository.findRounds(tournamentId);
    }

    /**
     * Rounds in sequence order, optionally only those in one status.
     */
    public List<RoundRecord> listRounds(String tournamentId, RoundStatus status, ListQuery query) {
        return query.apply(listRounds(tournamentId).stream()
            .filter(r -> status == null || r.status() == status)
            .toList());
    }

    public RoundRecord getRound(String tournamentId, int sequence) {
        return repository.getRound(tournamentId, sequence);
    }

    public RoundRecord createRound(String tournamentId, String name) {
        return createRound(tournamentId, name, null);
    }

    /**
     * Appends a PENDING round with the next sequence number.
     *
     * @param name         display name, or null for "Round n"
     * @param abbreviation short name, or null for "Rn"
     */
    public RoundRecord createRound(String tournamentId, String name, String abbreviation) {
        return locks.withTournament(tournamentId, () -> {
            repository.getTournament(tournamentId);
            List<RoundRecord> rounds = repository.findRounds(tournamentId);
            checkSequences(tournamentId, rounds);
            int sequence = rounds.size() + 1;
            String displayName = name == null || name.isBlank() ? "Round " + sequence : name;
            String shortName = abbreviation == null || abbreviation.isBlank() ? "R" + sequence : abbreviation;
            RoundRecord created = RoundRecord.pending(new Round(
                tournamentId + "-round-" + sequence, sequence, displayName, shortName, RoundStatus.PENDING));
            repository.saveRound(tournamentId, created);
            log.info("Created round {} of {}", sequence, tournamentId);
            publish(tournamentId, created);
            return created;
        });
    }

    /**
     * Computes the draw for a PENDING round without saving it.
     *
     * @throws RoundStateException if an earlier round is not completed
     */
    public Draw previewDraw(String tournamentId, int sequence) {
        Tournament tournament = repository.getTournament(tournamentId);
        List<RoundRecord> rounds = repository.findRounds(tournamentId);
        RoundRecord target = find(tournamentId, rounds, sequence);
        requireTransition(target, RoundStatus.DRAWN, "drawn");
        return computeDraw(tournament, rounds, sequence);
    }

    /**
     * Generates and saves the draw and panels for a PENDING round, moving it to DRAWN.
     * Nothing is saved if the draw is infeasible.
     */
    public RoundRecord drawRound(String tournamentId, int sequence) {
        return locks.withTournamentAndRound(tournamentId, sequence, () -> {
            Draw draw = previewDraw(tournamentId, sequence);
            RoundRecord drawn = repository.getRound(tournamentId, sequence)
                .withDraw(RoundStatus.DRAWN, draw.pairings());
            repository.saveRound(tournamentId, drawn);
            log.info("Drew round {} of {}: {} rooms, {} byes",
                sequence, tournamentId, draw.rooms().size(), draw.byes().size());
            publish(tournamentId, drawn);
            return drawn;
        });
    }

    /**
     * Discards a DRAWN round's draw, returning it to PENDING.
     */
    public RoundRecord redraw(String tournamentId, int sequence) {
        return locks.withRound(tournamentId, sequence, () -> {
            RoundRecord round = repository.getRound(tournamentId, sequence);
            requireTransition(round, RoundStatus.PENDING, "redrawn");
            RoundRecord reset = round.withDraw(RoundStatus.PENDING, List.of());
            repository.saveRound(tournamentId, reset);
            log.info("Discarded draw of round {} of {}", sequence, tournamentId);
            publish(tournamentId, reset);
            return reset;
        });
    }

    public RoundRecord startRound(String tournamentId, int sequence) {
        return transition(tournamentId, sequence, RoundStatus.IN_PROGRESS, "started");
    }

    /**
     * Records a ballot for a room of an IN_PROGRESS round. A later ballot for the same room
     * replaces the earlier one.
     *
     * @throws DataIntegrityException if the ballot does not match the room's teams, placements or speakers
     */
    public RoundRecord submitBallot(String tournamentId, int sequence, Ballot ballot) {
        return locks.withTournamentAndRound(tournamentId, sequence, () -> {
            Tournament tournament = repository.getTournament(tournamentId);
            RoundRecord round = repository.getRound(tournamentId, sequence);
            requireStatus(round, RoundStatus.IN_PROGRESS, "given ballots");
            checkBallot(tournament, round, ballot);
            RoundRecord updated = round.withBallot(ballot);
            repository.saveRound(tournamentId, updated);
            log.info("Ballot for {} in round {} of {}", ballot.pairingId(), sequence, tournamentId);
            publish(tournamentId, updated);
            return updated;
        });
    }

    /**
     * Completes an IN_PROGRESS round once every room has a ballot.
     */
    public RoundRecord completeRound(String tournamentId, int sequence) {
        return locks.withRound(tournamentId, sequence, () -> {
            RoundRecord round = repository.getRound(tournamentId, sequence);
            requireTransition(round, RoundStatus.COMPLETED, "completed");
            List<String> missing = round.pairings().stream()
                .filter(p -> !p.bye())
                .map(Pairing::id)
                .filter(id -> round.ballotFor(id).isEmpty())
                .toList();
            if (!missing.isEmpty()) {
                throw new RoundStateException(
                    "Round " + sequence + " cannot be completed; missing ballots for " + missing);
            }
            RoundRecord completed = round.withStatus(RoundStatus.COMPLETED);
            repository.saveRound(tournamentId, completed);
            log.info("Completed round {} of {}", sequence, tournamentId);
            publish(tournamentId, completed);
            return completed;
        });
    }

    /**
     * Renames a round. Null arguments keep the current value.
     */
    public RoundRecord updateRound(String tournamentId, int sequence, String name, String abbreviation) {
        return locks.withRound(tournamentId, sequence, () -> {
            RoundRecord record = repository.getRound(tournamentId, sequence);
            Round round = record.round();
            RoundRecord updated = record.withRound(round.withDetails(
                name != null ? name : round.name(),
                abbreviation != null ? abbreviation : round.abbreviation()));
            repository.saveRound(tournamentId, updated);
            log.info("Updated round {} of {}", sequence, tournamentId);
            publish(tournamentId, updated);
            return updated;
        });
    }

    /**
     * Deletes the last round of a tournament while it is PENDING or DRAWN.
     *
     * @throws RoundStateException if a later round exists or the round has started
     */
    public void deleteRound(String tournamentId, int sequence) {
        locks.withTournamentAndRound(tournamentId, sequence, () -> {
            repository.getTournament(tournamentId);
            List<RoundRecord> rounds = repository.findRounds(tournamentId);
            RoundRecord round = find(tournamentId, rounds, sequence);
            if (sequence != rounds.size()) {
                throw new RoundStateException(String.format(
                    "Round %d cannot be deleted while round %d exists", sequence, rounds.size()));
            }
            if (round.status() != RoundStatus.PENDING && round.status() != RoundStatus.DRAWN) {
                throw new RoundStateException(String.format(
                    "Round %d is %s and cannot be deleted", sequence, round.status()));
            }
            repository.deleteRound(tournamentId, sequence);
            log.info("Deleted round {} of {}", sequence, tournamentId);
            return null;
        });
    }

    public List<Motion> listMotions(String tournamentId, int sequence) {
        return repository.getRound(tournamentId, sequence).motions();
    }

    /**
     * Adds a motion to a round that is not yet completed. Motion ids are {@code r<sequence>-m<n>}.
     */
    public Motion addMotion(String tournamentId, int sequence, String text, String infoslide) {
        return locks.withRound(tournamentId, sequence, () -> {
            RoundRecord round = repository.getRound(tournamentId, sequence);
            requireOpenForMotions(round);
            int n = round.motions().size() + 1;
            while (round.motion("r" + sequence + "-m" + n).isPresent()) {
                n++;
            }
            Motion motion = new Motion("r" + sequence + "-m" + n, text, infoslide);
            List<Motion> motions = new ArrayList<>(round.motions());
            motions.add(motion);
            RoundRecord updated = round.withMotions(motions);
            repository.saveRound(tournamentId, updated);
            log.info("Added motion {} to round {} of {}", motion.id(), sequence, tournamentId);
            publish(tournamentId, updated);
            return motion;
        });
    }

    /**
     * Edits a motion's text or infoslide. Null arguments keep the current value.
     */
    public Motion updateMotion(String tournamentId, int sequence, String motionId, String text, String infoslide) {
        return locks.withRound(tournamentId, sequence, () -> {
            RoundRecord round = repository.getRound(tournamentId, sequence);
            requireOpenForMotions(round);
            Motion motion = requireMotion(round, motionId);
            Motion updated = motion.withContent(
                text != null ? text : motion.text(),
                infoslide != null ? infoslide : motion.infoslide());
            RoundRecord saved = round.withMotions(round.motions().stream()
                .map(m -> m.id().equals(motionId) ? updated : m)
                .toList());
            repository.saveRound(tournamentId, saved);
            log.info("Updated motion {} of round {} of {}", motionId, sequence, tournamentId);
            publish(tournamentId, saved);
            return updated;
        });
    }

    public void deleteMotion(String tournamentId, int sequence, String motionId) {
        locks.withRound(tournamentId, sequence, () -> {
            RoundRecord round = repository.getRound(tournamentId, sequence);
            requireOpenForMotions(round);
            requireMotion(round, motionId);
            RoundRecord saved = round.withMotions(round.motions().stream()
                .filter(m -> !m.id().equals(motionId))
                .toList());
            repository.saveRound(tournamentId, saved);
            log.info("Deleted motion {} of round {} of {}", motionId, sequence, tournamentId);
            publish(tournamentId, saved);
            return null;
        });
    }

    public List<Standing> standings(String tournamentId) {
        Tournament tournament = repository.getTournament(tournamentId);
        return StandingsCalculator.computeStandings(
            tournament.teams(), repository.findRounds(tournamentId), tournament.config());
    }

    public List<SpeakerStanding> speakerStandings(String tournamentId) {
        Tournament tournament = repository.getTournament(tournamentId);
        return StandingsCalculator.computeSpeakerStandings(tournament.teams(), repository.findRounds(tournamentId));
    }

    public History history(String tournamentId) {
        Tournament tournament = repository.getTournament(tournamentId);
        return HistoryTracker.computeHistory(
            tournament.teams(), tournament.adjudicators(), repository.findRounds(tournamentId));
    }

    private RoundRecord transition(String tournamentId, int sequence, RoundStatus to, String verb) {
        return locks.withRound(tournamentId, sequence, () -> {
            RoundRecord round = repository.getRound(tournamentId, sequence);
            requireTransition(round, to, verb);
            RoundRecord moved = round.withStatus(to);
            repository.saveRound(tournamentId, moved);
            log.info("Round {} of {} is now {}", sequence, tournamentId, to);
            publish(tournamentId, moved);
            return moved;
        });
    }

    static Draw computeDraw(Tournament tournament, List<RoundRecord> rounds, int sequence) {
        ConfigurationException.requireValid(tournament.config());
        for (RoundRecord earlier : rounds) {
            if (earlier.sequence() < sequence && earlier.status() != RoundStatus.COMPLETED) {
                throw new RoundStateException("Round " + sequence + " cannot be drawn while round "
                    + earlier.sequence() + " is " + earlier.status());
            }
        }
        List<RoundRecord> prior = rounds.stream().filter(r -> r.sequence() < sequence).toList();
        List<Standing> standings = StandingsCalculator.computeStandings(tournament.teams(), prior, tournament.config());
        History history = HistoryTracker.computeHistory(tournament.teams(), tournament.adjudicators(), prior);
        Draw draw = PairingEngine.generateDraw(sequence, standings, history, tournament.teams(), tournament.config());
        return JudgeAllocator.allocatePanels(draw, tournament.adjudicators(), history, tournament.teams(),
            tournament.config());
    }

    static void checkBallot(Tournament tournament, RoundRecord round, Ballot ballot) {
        Pairing pairing = round.pairing(ballot.pairingId())
            .orElseThrow(() -> new DataIntegrityException(
                "Round " + round.sequence() + " has no room " + ballot.pairingId()));
        if (pairing.bye()) {
            throw new DataIntegrityException(ballot.pairingId() + " is a bye and takes no ballot");
        }
        int roomSize = pairing.teamIds().size();
        if (ballot.results().size() != roomSize) {
            throw new DataIntegrityException(String.format("Ballot for %s has %d results for %d teams",
                ballot.pairingId(), ballot.results().size(), roomSize));
        }
        Set<String> teams = new HashSet<>();
        Set<Integer> placements = new HashSet<>();
        for (TeamResult result : ballot.results()) {
            if (!pairing.teamIds().contains(result.teamId()) || !teams.add(result.teamId())) {
                throw new DataIntegrityException(
                    "Ballot for " + ballot.pairingId() + " has unexpected team " + result.teamId());
            }
            if (result.placement() < 1 || result.placement() > roomSize || !placements.add(result.placement())) {
                throw new DataIntegrityException(String.format("Ballot for %s gives %s invalid placement %d",
                    ballot.pairingId(), result.teamId(), result.placement()));
            }
            Team team = tournament.team(result.teamId())
                .orElseThrow(() -> new DataIntegrityException("Unknown team " + result.teamId()));
            for (SpeakerScore score : result.speakerScores()) {
                if (!team.hasSpeaker(score.speakerId())) {
                    throw new DataIntegrityException(
                        "Speaker " + score.speakerId() + " does not belong to team " + team.id());
                }
            }
        }
    }

    private static RoundRecord find(String tournamentId, List<RoundRecord> rounds, int sequence) {
        checkSequences(tournamentId, rounds);
        if (sequence < 1 || sequence > rounds.size()) {
            throw new TournamentNotFoundException(
                "Round " + sequence + " not found in tournament " + tournamentId);
        }
        return rounds.get(sequence - 1);
    }

    private static void checkSequences(String tournamentId, List<RoundRecord> rounds) {
        for (int i = 0; i < rounds.size(); i++) {
            if (rounds.get(i).sequence() != i + 1) {
                throw new DataIntegrityException(
                    "Rounds of " + tournamentId + " skip sequence " + (i + 1));
            }
        }
    }

    private static void requireTransition(RoundRecord round, RoundStatus next, String verb) {
        if (!round.status().canTransitionTo(next)) {
            throw new RoundStateException(String.format("Round %d is %s and cannot be %s",
                round.sequence(), round.status(), verb));
        }
    }

    private static void requireOpenForMotions(RoundRecord round) {
        if (round.status() == RoundStatus.COMPLETED) {
            throw new RoundStateException("Round " + round.sequence() + " is COMPLETED and its motions are final");
        }
    }

    private static Motion requireMotion(RoundRecord round, String motionId) {
        return round.motion(motionId).orElseThrow(() -> new TournamentNotFoundException(
            "Motion " + motionId + " not found in round " + round.sequence()));
    }

    private static void requireStatus(RoundRecord round, RoundStatus expected, String verb) {
        if (round.status() != expected) {
            throw new RoundStateException(String.format("Round %d is %s and cannot be %s",
                round.sequence(), round.status(), verb));
        }
    }

    private void publish(String tournamentId, RoundRecord round) {
        listener.onRoundChanged(RoundEvent.of(tournamentId, round));
    }
}
