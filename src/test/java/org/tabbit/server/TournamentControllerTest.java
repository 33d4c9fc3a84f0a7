package org.tabbit.server;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.tabbit.compute.ConfigurationException;
import org.tabbit.model.ByePolicy;
import org.tabbit.model.Tournament;
import org.tabbit.runner.RoundManager;
import org.tabbit.runner.TournamentLocks;
import org.tabbit.runner.TournamentRegistry;
import org.tabbit.server.dto.CreateTournamentRequest;
import org.tabbit.server.dto.DrawConfigRequest;
import org.tabbit.server.dto.UpdateTournamentRequest;
import org.tabbit.store.JsonFileTournamentRepository;
import org.tabbit.store.ObjectMapperFactory;
import org.tabbit.store.SampleTournament;
import org.tabbit.store.TournamentNotFoundException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for TournamentController over a file-backed repository.
 */
class TournamentControllerTest {

    @TempDir
    Path tempDir;

    private TournamentController controller;

    @BeforeEach
    void setUp() {
        JsonFileTournamentRepository repository =
            new JsonFileTournamentRepository(tempDir, ObjectMapperFactory.create());
        TournamentLocks locks = new TournamentLocks();
        RoundManager roundManager = new RoundManager(repository, locks,
            new RoundEventPublisher(mock(SimpMessagingTemplate.class)));
        controller = new TournamentController(new TournamentRegistry(repository, locks), roundManager);
    }

    @Test
    void listTournaments_emptyDir() {
        assertTrue(controller.listTournaments(null, 0, 100).isEmpty());
    }

    @Test
    void createTournament_withDefaults() {
        Tournament created = controller.createTournament(new CreateTournamentRequest("Winter Cup", "WC", null));

        assertEquals("winter-cup", created.id());
        assertEquals(2, created.config().sidesPerRoom());
        assertEquals(List.of(created), controller.listTournaments(null, 0, 100));
    }

    @Test
    void createTournament_partialConfig() {
        DrawConfigRequest config = new DrawConfigRequest(4, 3, null, ByePolicy.NO_BYE, null, null, null, null, null);

        Tournament created = controller.createTournament(new CreateTournamentRequest("BP Open", null, config));

        assertEquals(4, created.config().sidesPerRoom());
        assertEquals(3, created.config().panelSize());
        assertEquals(ByePolicy.NO_BYE, created.config().byePolicy());
        assertTrue(created.config().avoidInstitutionClash());
        assertEquals(8, created.config().maxSwapDistance());
    }

    @Test
    void createTournament_invalidConfig() {
        DrawConfigRequest config = new DrawConfigRequest(0, null, null, null, null, null, null, null, null);

        assertThrows(ConfigurationException.class,
            () -> controller.createTournament(new CreateTournamentRequest("Bad", null, config)));
    }

    @Test
    void getTournament_notFound() {
        assertThrows(TournamentNotFoundException.class, () -> controller.getTournament("nonexistent"));
    }

    @Test
    void listTournaments_filtersByNameAndPages() {
        controller.createTournament(new CreateTournamentRequest("Winter Cup", null, null));
        controller.createTournament(new CreateTournamentRequest("Spring Cup", null, null));
        controller.createTournament(new CreateTournamentRequest("Summer Open", null, null));

        assertEquals(List.of("spring-cup", "winter-cup"),
            controller.listTournaments("cup", 0, 100).stream().map(Tournament::id).toList());
        assertEquals(List.of("summer-open"),
            controller.listTournaments(null, 1, 1).stream().map(Tournament::id).toList());
        assertTrue(controller.listTournaments(null, 5, 10).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> controller.listTournaments(null, -1, 10));
        assertThrows(IllegalArgumentException.class, () -> controller.listTournaments(null, 0, 0));
    }

    @Test
    void updateTournament_keepsOmittedFields() {
        controller.createTournament(new CreateTournamentRequest("Winter Cup", "WC", null));

        Tournament renamed = controller.updateTournament("winter-cup", new UpdateTournamentRequest("Winter Open", null));

        assertEquals("winter-cup", renamed.id());
        assertEquals("Winter Open", renamed.name());
        assertEquals("WC", renamed.abbreviation());
        assertEquals(renamed, controller.getTournament("winter-cup"));
    }

    @Test
    void deleteTournament_removesItsRounds() throws Exception {
        SampleTournament.copyTo(tempDir);

        controller.deleteTournament(SampleTournament.ID);

        assertThrows(TournamentNotFoundException.class, () -> controller.getTournament(SampleTournament.ID));
        assertFalse(Files.exists(tempDir.resolve(SampleTournament.ID)));
        assertThrows(TournamentNotFoundException.class, () -> controller.deleteTournament(SampleTournament.ID));
    }

    @Test
    void standingsAndHistory_fromSample() throws Exception {
        SampleTournament.copyTo(tempDir);

        assertEquals("alpha", controller.getStandings(SampleTournament.ID).get(0).teamId());
        assertEquals("alpha-1", controller.getSpeakerStandings(SampleTournament.ID).get(0).speakerId());
        assertTrue(controller.getHistory(SampleTournament.ID).haveMet("charlie", "delta"));
    }
}
