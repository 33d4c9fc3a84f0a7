package org.tabbit.server;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.tabbit.model.Motion;
import org.tabbit.model.RoundRecord;
import org.tabbit.model.RoundStatus;
import org.tabbit.runner.RoundEvent;
import org.tabbit.runner.RoundManager;
import org.tabbit.runner.RoundStateException;
import org.tabbit.runner.TournamentLocks;
import org.tabbit.server.dto.BallotRequest;
import org.tabbit.server.dto.CreateRoundRequest;
import org.tabbit.server.dto.MotionRequest;
import org.tabbit.server.dto.UpdateMotionRequest;
import org.tabbit.server.dto.UpdateRoundRequest;
import org.tabbit.store.JsonFileTournamentRepository;
import org.tabbit.store.ObjectMapperFactory;
import org.tabbit.store.SampleTournament;
import org.tabbit.store.TournamentNotFoundException;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class RoundControllerTest {

    private static final String ID = SampleTournament.ID;

    @TempDir
    Path tempDir;

    private SimpMessagingTemplate messagingTemplate;
    private RoundController controller;

    @BeforeEach
    void setUp() throws Exception {
        SampleTournament.copyTo(tempDir);
        messagingTemplate = mock(SimpMessagingTemplate.class);
        RoundManager roundManager = new RoundManager(
            new JsonFileTournamentRepository(tempDir, ObjectMapperFactory.create()),
            new TournamentLocks(),
            new RoundEventPublisher(messagingTemplate));
        controller = new RoundController(roundManager);
    }

    private static BallotRequest ballot(String pairingId, String winner, String loser) {
        return new BallotRequest(pairingId, List.of(
            new BallotRequest.Result(winner, 1, List.of(
                new BallotRequest.Score(winner + "-1", 1, 76), new BallotRequest.Score(winner + "-2", 2, 75))),
            new BallotRequest.Result(loser, 2, List.of(
                new BallotRequest.Score(loser + "-1", 1, 72), new BallotRequest.Score(loser + "-2", 2, 71)))));
    }

    @Test
    void listRounds_fromSample() {
        List<RoundRecord> rounds = controller.listRounds(ID, null, 0, 100);

        assertEquals(1, rounds.size());
        assertEquals(RoundStatus.COMPLETED, rounds.get(0).status());
    }

    @Test
    void createRound_withoutBody() {
        RoundRecord created = controller.createRound(ID, null);

        assertEquals(2, created.sequence());
        assertEquals("Round 2", created.round().name());
    }

    @Test
    void fullRoundLifecycle_broadcastsEachChange() {
        controller.createRound(ID, new CreateRoundRequest("Round Two", "R2"));
        RoundRecord drawn = controller.drawRound(ID, 2);
        controller.startRound(ID, 2);
        for (var pairing : drawn.pairings()) {
            controller.submitBallot(ID, 2,
                ballot(pairing.id(), pairing.teamIds().get(0), pairing.teamIds().get(1)));
        }
        RoundRecord completed = controller.completeRound(ID, 2);

        assertEquals(RoundStatus.COMPLETED, completed.status());
        assertEquals(2, completed.ballots().size());
        assertEquals(completed, controller.getRound(ID, 2));
        verify(messagingTemplate).convertAndSend(eq("/topic/tournaments/sample/rounds"),
            eq(new RoundEvent(ID, 2, RoundStatus.COMPLETED, 2, 2)));
    }

    @Test
    void redraw_resetsDraw() {
        controller.createRound(ID, null);
        controller.drawRound(ID, 2);

        RoundRecord reset = controller.redraw(ID, 2);

        assertEquals(RoundStatus.PENDING, reset.status());
        assertTrue(reset.pairings().isEmpty());
    }

    @Test
    void completeRound_beforeStart() {
        controller.createRound(ID, null);
        controller.drawRound(ID, 2);

        assertThrows(RoundStateException.class, () -> controller.completeRound(ID, 2));
    }

    @Test
    void listRounds_filtersByStatus() {
        controller.createRound(ID, null);

        assertEquals(List.of(2), controller.listRounds(ID, RoundStatus.PENDING, 0, 100).stream()
            .map(RoundRecord::sequence).toList());
        assertEquals(List.of(1), controller.listRounds(ID, null, 0, 1).stream()
            .map(RoundRecord::sequence).toList());
    }

    @Test
    void createRound_defaultsAbbreviation() {
        assertEquals("R2", controller.createRound(ID, null).round().abbreviation());
        assertEquals("QF", controller.createRound(ID, new CreateRoundRequest("Quarter-final", "QF")).round()
            .abbreviation());
    }

    @Test
    void updateRound_renamesWithoutTouchingDraw() {
        controller.createRound(ID, null);
        RoundRecord drawn = controller.drawRound(ID, 2);

        RoundRecord renamed = controller.updateRound(ID, 2, new UpdateRoundRequest(null, "Rd2"));

        assertEquals("Round 2", renamed.round().name());
        assertEquals("Rd2", renamed.round().abbreviation());
        assertEquals(RoundStatus.DRAWN, renamed.status());
        assertEquals(drawn.pairings(), renamed.pairings());
    }

    @Test
    void deleteRound_onlyLastUnstartedRound() {
        controller.createRound(ID, null);
        controller.createRound(ID, null);

        assertThrows(RoundStateException.class, () -> controller.deleteRound(ID, 2));
        assertThrows(RoundStateException.class, () -> controller.deleteRound(ID, 1));

        controller.deleteRound(ID, 3);
        controller.deleteRound(ID, 2);

        assertEquals(1, controller.listRounds(ID, null, 0, 100).size());
        assertThrows(RoundStateException.class, () -> controller.deleteRound(ID, 1));
    }

    @Test
    void motions_addEditDelete() {
        controller.createRound(ID, null);

        Motion motion = controller.addMotion(ID, 2, new MotionRequest("This house would ban zoos", null));
        Motion second = controller.addMotion(ID, 2, new MotionRequest("This house regrets zoos", "Zoos are..."));
        Motion edited = controller.updateMotion(ID, 2, motion.id(), new UpdateMotionRequest(null, "Context"));
        controller.deleteMotion(ID, 2, second.id());

        assertEquals("r2-m1", motion.id());
        assertEquals("r2-m2", second.id());
        assertEquals("This house would ban zoos", edited.text());
        assertEquals(List.of(edited), controller.listMotions(ID, 2));
        assertEquals(List.of(edited), controller.getRound(ID, 2).motions());
    }

    @Test
    void motions_survivesRedraw() {
        controller.createRound(ID, null);
        controller.addMotion(ID, 2, new MotionRequest("This house would ban zoos", null));
        controller.drawRound(ID, 2);

        RoundRecord reset = controller.redraw(ID, 2);

        assertEquals(1, reset.motions().size());
    }

    @Test
    void motions_frozenOnceCompleted() {
        assertThrows(RoundStateException.class,
            () -> controller.addMotion(ID, 1, new MotionRequest("Too late", null)));
    }

    @Test
    void deleteMotion_unknown() {
        controller.createRound(ID, null);

        assertThrows(TournamentNotFoundException.class, () -> controller.deleteMotion(ID, 2, "r2-m9"));
    }
}
