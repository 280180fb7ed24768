package com.aiinpocket.parkfinder.controller;

import com.aiinpocket.parkfinder.model.dto.CommentDetail;
import com.aiinpocket.parkfinder.model.dto.CommentRequest;
import com.aiinpocket.parkfinder.model.dto.FlagRequest;
import com.aiinpocket.parkfinder.model.entity.ParkComment;
import com.aiinpocket.parkfinder.security.Caller;
import com.aiinpocket.parkfinder.service.ParkCommentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 公園留言 REST API。
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ParkCommentController {

    private final ParkCommentService commentService;

    @GetMapping("/parks/{parkId}/comments")
    public List<CommentDetail> listComments(Caller caller, @PathVariable Long parkId) {
        return commentService.listComments(caller, parkId).stream()
                .map(ParkCommentController::toDetail)
                .toList();
    }

    @PostMapping("/parks/{parkId}/comments")
    public ResponseEntity<CommentDetail> addComment(Caller caller, @PathVariable Long parkId,
                                                    @Valid @RequestBody CommentRequest request) {
        ParkComment comment = commentService.addComment(caller, parkId, request.content());
        return ResponseEntity.status(HttpStatus.CREATED).body(toDetail(comment));
    }

    @GetMapping("/comments/{id}")
    public CommentDetail getComment(Caller caller, @PathVariable Long id) {
        return toDetail(commentService.getComment(caller, id));
    }

    /** 管理員標記 / 取消標記檢舉 */
    @PutMapping("/comments/{id}/reported")
    public CommentDetail setReported(Caller caller, @PathVariable Long id,
                                     @Valid @RequestBody FlagRequest request) {
        return toDetail(commentService.setReported(caller, id, request.value()));
    }

    @DeleteMapping("/comments/{id}")
    public ResponseEntity<Void> deleteComment(Caller caller, @PathVariable Long id) {
        commentService.deleteComment(caller, id);
        return ResponseEntity.noContent().build();
    }

    private static CommentDetail toDetail(ParkComment c) {
        return new CommentDetail(c.getId(), c.getPark().getId(), c.getAuthorId(),
                c.getContent(), c.isReported(), c.getCreatedAt());
    }
}
