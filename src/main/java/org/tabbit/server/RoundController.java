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
import org.tabbit.model.Motion;
import org.tabbit.model.RoundRecord;
import org.tabbit.model.RoundStatus;
import org.tabbit.runner.ListQuery;
import org.tabbit.runner.RoundManager;
import org.tabbit.server.dto.BallotRequest;
import org.tabbit.server.dto.CreateRoundRequest;
import org.tabbit.server.dto.MotionRequest;
import org.tabbit.server.dto.UpdateMotionRequest;
import org.tabbit.server.dto.UpdateRoundRequest;

import java.util.List;

/**
 * REST controller for the round lifecycle of a tournament and the motions of each round.
 */
@RestController
@RequestMapping("/api/tournaments/{id}/rounds")
public class RoundController {

    private final RoundManager roundManager;

    public RoundController(RoundManager roundManager) {
        this.roundManager = roundManager;
    }

    @GetMapping
    public List<RoundRecord> listRounds(@PathVariable String id,
                                        @RequestParam(required = false) RoundStatus status,
                                        @RequestParam(defaultValue = "0") int offset,
                                        @RequestParam(defaultValue = "100") int limit) {
        return roundManager.listRounds(id, status, new ListQuery(offset, limit));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public RoundRecord createRound(@PathVariable String id,
                                   @Valid @RequestBody(required = false) CreateRoundRequest request) {
        return request == null
            ? roundManager.createRound(id, null)
            : roundManager.createRound(id, request.name(), request.abbreviation());
    }

    @GetMapping("/{seq}")
    public RoundRecord getRound(@PathVariable String id, @PathVariable int seq) {
        return roundManager.getRound(id, seq);
    }

    @PatchMapping("/{seq}")
    public RoundRecord updateRound(@PathVariable String id, @PathVariable int seq,
                                   @Valid @RequestBody UpdateRoundRequest request) {
        return roundManager.updateRound(id, seq, request.name(), request.abbreviation());
    }

    /**
     * Deletes the last round while it is PENDING or DRAWN; otherwise 409.
     */
    @DeleteMapping("/{seq}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteRound(@PathVariable String id, @PathVariable int seq) {
        roundManager.deleteRound(id, seq);
    }

    @GetMapping("/{seq}/motions")
    public List<Motion> listMotions(@PathVariable String id, @PathVariable int seq) {
        return roundManager.listMotions(id, seq);
    }

    @PostMapping("/{seq}/motions")
    @ResponseStatus(HttpStatus.CREATED)
    public Motion addMotion(@PathVariable String id, @PathVariable int seq,
                            @Valid @RequestBody MotionRequest request) {
        return roundManager.addMotion(id, seq, request.text(), request.infoslide());
    }

    @PatchMapping("/{seq}/motions/{motionId}")
    public Motion updateMotion(@PathVariable String id, @PathVariable int seq, @PathVariable String motionId,
                               @Valid @RequestBody UpdateMotionRequest request) {
        return roundManager.updateMotion(id, seq, motionId, request.text(), request.infoslide());
    }

    @DeleteMapping("/{seq}/motions/{motionId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteMotion(@PathVariable String id, @PathVariable int seq, @PathVariable String motionId) {
        roundManager.deleteMotion(id, seq, motionId);
    }

    /**
     * Draws the round and allocates its panels. Fails with 409 if no legal draw exists.
     */
    @PostMapping("/{seq}/draw")
    public RoundRecord drawRound(@PathVariable String id, @PathVariable int seq) {
        return roundManager.drawRound(id, seq);
    }

    @PostMapping("/{seq}/redraw")
    public RoundRecord redraw(@PathVariable String id, @PathVariable int seq) {
        return roundManager.redraw(id, seq);
    }

    @PostMapping("/{seq}/start")
    public RoundRecord startRound(@PathVariable String id, @PathVariable int seq) {
        return roundManager.startRound(id, seq);
    }

    @PostMapping("/{seq}/ballots")
    public RoundRecord submitBallot(@PathVariable String id, @PathVariable int seq,
                                    @Valid @RequestBody BallotRequest request) {
        return roundManager.submitBallot(id, seq, request.toBallot());
    }

    @PostMapping("/{seq}/complete")
    public RoundRecord completeRound(@PathVariable String id, @PathVariable int seq) {
        return roundManager.completeRound(id, seq);
    }
}
