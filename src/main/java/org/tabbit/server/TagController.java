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
import org.tabbit.model.Speaker;
import org.tabbit.model.Tag;
import org.tabbit.runner.ListQuery;
import org.tabbit.runner.TournamentRegistry;
import org.tabbit.server.dto.TagMembersRequest;
import org.tabbit.server.dto.TagRequest;

import java.util.List;

/**
 * REST controller for tournament tags and their speaker and adjudicator members.
 */
@RestController
@RequestMapping("/api/tournaments/{id}/tags")
public class TagController {

    private final TournamentRegistry registry;

    public TagController(TournamentRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public List<Tag> listTags(@PathVariable String id,
                              @RequestParam(defaultValue = "0") int offset,
                              @RequestParam(defaultValue = "100") int limit) {
        return registry.listTags(id, new ListQuery(offset, limit));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Tag createTag(@PathVariable String id, @Valid @RequestBody TagRequest request) {
        return registry.createTag(id, request.name());
    }

    @PatchMapping("/{tagId}")
    public Tag renameTag(@PathVariable String id, @PathVariable String tagId, @Valid @RequestBody TagRequest request) {
        return registry.renameTag(id, tagId, request.name());
    }

    @DeleteMapping("/{tagId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteTag(@PathVariable String id, @PathVariable String tagId) {
        registry.deleteTag(id, tagId);
    }

    @GetMapping("/{tagId}/speakers")
    public List<Speaker> listSpeakers(@PathVariable String id, @PathVariable String tagId) {
        return registry.listSpeakers(id, null, tagId, ListQuery.ALL);
    }

    @PostMapping("/{tagId}/speakers")
    public List<Speaker> tagSpeakers(@PathVariable String id, @PathVariable String tagId,
                                     @Valid @RequestBody TagMembersRequest request) {
        return registry.tagSpeakers(id, tagId, request.ids());
    }

    @DeleteMapping("/{tagId}/speakers/{speakerId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void untagSpeaker(@PathVariable String id, @PathVariable String tagId, @PathVariable String speakerId) {
        registry.untagSpeaker(id, tagId, speakerId);
    }

    @GetMapping("/{tagId}/adjudicators")
    public List<Adjudicator> listAdjudicators(@PathVariable String id, @PathVariable String tagId) {
        return registry.listAdjudicators(id, null, tagId, ListQuery.ALL);
    }

    @PostMapping("/{tagId}/adjudicators")
    public List<Adjudicator> tagAdjudicators(@PathVariable String id, @PathVariable String tagId,
                                             @Valid @RequestBody TagMembersRequest request) {
        return registry.tagAdjudicators(id, tagId, request.ids());
    }

    @DeleteMapping("/{tagId}/adjudicators/{adjudicatorId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void untagAdjudicator(@PathVariable String id, @PathVariable String tagId,
                                 @PathVariable String adjudicatorId) {
        registry.untagAdjudicator(id, tagId, adjudicatorId);
    }
}
