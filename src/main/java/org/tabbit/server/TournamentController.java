package org.tabbit.server;

import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.tabbit.compute.History;
import org.tabbit.model.SpeakerStanding;
import org.tabbit.model.Standing;
import org.tabbit.model.Tournament;
import org.tabbit.runner.ListQuery;
import org.tabbit.runner.RoundManager;
import org.tabbit.runner.TournamentRegistry;
import org.tabbit.server.dto.CreateTournamentRequest;
import org.tabbit.server.dto.UpdateTournamentRequest;

import java.util.List;

/**
 * REST controller for tournaments and their tab results.
 */
@RestController
@RequestMapping("/api/tournaments")
public class TournamentController {

    private final TournamentRegistry registry;
    private final RoundManager roundManager;

    public TournamentController(TournamentRegistry registry, RoundManager roundManager) {
        this.registry = registry;
        this.roundManager = roundManager;
    }

    @GetMapping
    public List<Tournament> listTournaments(@RequestParam(required = false) String name,
                                            @RequestParam(defaultValue = "0") int offset,
                                            @RequestParam(defaultValue = "100") int limit) {
        return registry.listTournaments(name, new ListQuery(offset, limit));
    }

    /**
     * Creates a tournament; its id is derived from the name.
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Tournament createTournament(@Valid @RequestBody CreateTournamentRequest request) {
        return registry.createTournament(request.name(), request.abbreviation(), request.drawConfig());
    }

    @GetMapping("/{id}")
    public Tournament getTournament(@PathVariable String id) {
        return registry.getTournament(id);
    }

    @PatchMapping("/{id}")
    public Tournament updateTournament(@PathVariable String id, @Valid @RequestBody UpdateTournamentRequest request) {
        return registry.updateTournament(id, request.name(), request.abbreviation());
    }

    /**
     * Deletes the tournament and every round stored for it.
     */
    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteTournament(@PathVariable String id) {
        registry.deleteTournament(id);
    }

    /**
     * Team standings over completed rounds.
     */
    @GetMapping("/{id}/standings")
    public List<Standing> getStandings(@PathVariable String id) {
        return roundManager.standings(id);
    }

    @GetMapping("/{id}/speaker-standings")
    public List<SpeakerStanding> getSpeakerStandings(@PathVariable String id) {
        return roundManager.speakerStandings(id);
    }

    @GetMapping("/{id}/history")
    public History getHistory(@PathVariable String id) {
        return roundManager.history(id);
    }
}
