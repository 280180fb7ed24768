package com.aiinpocket.parkfinder.controller;

import com.aiinpocket.parkfinder.model.dto.TagDetail;
import com.aiinpocket.parkfinder.model.dto.TagRequest;
import com.aiinpocket.parkfinder.model.entity.ParkTag;
import com.aiinpocket.parkfinder.security.Caller;
import com.aiinpocket.parkfinder.service.ParkTagService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 公園標籤 REST API。
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ParkTagController {

    private final ParkTagService tagService;

    @GetMapping("/parks/{parkId}/tags")
    public List<TagDetail> listTags(Caller caller, @PathVariable Long parkId) {
        return tagService.listTags(caller, parkId).stream()
                .map(ParkTagController::toDetail)
                .toList();
    }

    @PostMapping("/parks/{parkId}/tags")
    public ResponseEntity<TagDetail> addTag(Caller caller, @PathVariable Long parkId,
                                            @Valid @RequestBody TagRequest request) {
        ParkTag tag = tagService.addTag(caller, parkId, request.tag());
        return ResponseEntity.status(HttpStatus.CREATED).body(toDetail(tag));
    }

    @GetMapping("/tags/{id}")
    public TagDetail getTag(Caller caller, @PathVariable Long id) {
        return toDetail(tagService.getTag(caller, id));
    }

    @DeleteMapping("/tags/{id}")
    public ResponseEntity<Void> deleteTag(Caller caller, @PathVariable Long id) {
        tagService.deleteTag(caller, id);
        return ResponseEntity.noContent().build();
    }

    private static TagDetail toDetail(ParkTag t) {
        return new TagDetail(t.getId(), t.getPark().getId(), t.getTag());
    }
}
