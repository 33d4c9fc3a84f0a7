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
import org.tabbit.model.Adjudicator;
import org.tabbit.model.Institution;
import org.tabbit.model.Speaker;
import org.tabbit.model.Team;
import org.tabbit.runner.ListQuery;
import org.tabbit.runner.TournamentRegistry;
import org.tabbit.server.dto.AdjudicatorRequest;
import org.tabbit.server.dto.InstitutionRequest;
import org.tabbit.server.dto.SpeakerRequest;
import org.tabbit.server.dto.TeamRequest;
import org.tabbit.server.dto.UpdateAdjudicatorRequest;
import org.tabbit.server.dto.UpdateTeamRequest;

import java.util.List;

/**
 * REST controller for the institutions, teams, speakers and adjudicators of a tournament.
 * Deleting a participant that a round already references fails with 422.
 */
@RestController
@RequestMapping("/api/tournaments/{id}")
public class ParticipantController {

    private final TournamentRegistry registry;

    public ParticipantController(TournamentRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/institutions")
    public List<Institution> listInstitutions(@PathVariable String id,
                                              @RequestParam(defaultValue = "0") int offset,
                                              @RequestParam(defaultValue = "100") int limit) {
        return registry.listInstitutions(id, new ListQuery(offset, limit));
    }

    @PostMapping("/institutions")
    @ResponseStatus(HttpStatus.CREATED)
    public Institution addInstitution(@PathVariable String id, @Valid @RequestBody InstitutionRequest request) {
        return registry.addInstitution(id, request.name());
    }

    @GetMapping("/teams")
    public List<Team> listTeams(@PathVariable String id,
                                @RequestParam(required = false) String institutionId,
                                @RequestParam(defaultValue = "0") int offset,
                                @RequestParam(defaultValue = "100") int limit) {
        return registry.listTeams(id, institutionId, new ListQuery(offset, limit));
    }

    @PostMapping("/teams")
    @ResponseStatus(HttpStatus.CREATED)
    public Team addTeam(@PathVariable String id, @Valid @RequestBody TeamRequest request) {
        return registry.addTeam(id, request.name(), request.abbreviation(), request.institutionId(),
            request.speakers());
    }

    @GetMapping("/teams/{teamId}")
    public Team getTeam(@PathVariable String id, @PathVariable String teamId) {
        return registry.getTeam(id, teamId);
    }

    @PatchMapping("/teams/{teamId}")
    public Team updateTeam(@PathVariable String id, @PathVariable String teamId,
                           @Valid @RequestBody UpdateTeamRequest request) {
        return registry.updateTeam(id, teamId, request.name(), request.abbreviation(), request.institutionId());
    }

    @DeleteMapping("/teams/{teamId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteTeam(@PathVariable String id, @PathVariable String teamId) {
        registry.deleteTeam(id, teamId);
    }

    @PostMapping("/teams/{teamId}/speakers")
    @ResponseStatus(HttpStatus.CREATED)
    public Speaker addSpeaker(@PathVariable String id, @PathVariable String teamId,
                              @Valid @RequestBody SpeakerRequest request) {
        return registry.addSpeaker(id, teamId, request.name());
    }

    /**
     * Speakers across all teams, optionally filtered by team or tag.
     */
    @GetMapping("/speakers")
    public List<Speaker> listSpeakers(@PathVariable String id,
                                      @RequestParam(required = false) String teamId,
                                      @RequestParam(required = false) String tagId,
                                      @RequestParam(defaultValue = "0") int offset,
                                      @RequestParam(defaultValue = "100") int limit) {
        return registry.listSpeakers(id, teamId, tagId, new ListQuery(offset, limit));
    }

    @PatchMapping("/speakers/{speakerId}")
    public Speaker updateSpeaker(@PathVariable String id, @PathVariable String speakerId,
                                 @Valid @RequestBody SpeakerRequest request) {
        return registry.updateSpeaker(id, speakerId, request.name());
    }

    @DeleteMapping("/speakers/{speakerId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteSpeaker(@PathVariable String id, @PathVariable String speakerId) {
        registry.deleteSpeaker(id, speakerId);
    }

    @GetMapping("/adjudicators")
    public List<Adjudicator> listAdjudicators(@PathVariable String id,
                                              @RequestParam(required = false) String institutionId,
                                              @RequestParam(required = false) String tagId,
                                              @RequestParam(defaultValue = "0") int offset,
                                              @RequestParam(defaultValue = "100") int limit) {
        return registry.listAdjudicators(id, institutionId, tagId, new ListQuery(offset, limit));
    }

    @PostMapping("/adjudicators")
    @ResponseStatus(HttpStatus.CREATED)
    public Adjudicator addAdjudicator(@PathVariable String id, @Valid @RequestBody AdjudicatorRequest request) {
        return registry.addAdjudicator(id, request.name(), request.institutionId(), request.experience(),
            request.independent());
    }

    @GetMapping("/adjudicators/{adjudicatorId}")
    public Adjudicator getAdjudicator(@PathVariable String id, @PathVariable String adjudicatorId) {
        return registry.getAdjudicator(id, adjudicatorId);
    }

    @PatchMapping("/adjudicators/{adjudicatorId}")
    public Adjudicator updateAdjudicator(@PathVariable String id, @PathVariable String adjudicatorId,
                                         @Valid @RequestBody UpdateAdjudicatorRequest request) {
        return registry.updateAdjudicator(id, adjudicatorId, request.name(), request.institutionId(),
            request.experience(), request.independent());
    }

    @DeleteMapping("/adjudicators/{adjudicatorId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteAdjudicator(@PathVariable String id, @PathVariable String adjudicatorId) {
        registry.deleteAdjudicator(id, adjudicatorId);
    }
}
