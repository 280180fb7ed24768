package com.aiinpocket.parkfinder.controller;

import com.aiinpocket.parkfinder.model.dto.VoteDetail;
import com.aiinpocket.parkfinder.model.dto.VoteRequest;
import com.aiinpocket.parkfinder.model.dto.VoteResult;
import com.aiinpocket.parkfinder.model.dto.VoteTally;
import com.aiinpocket.parkfinder.model.entity.ParkVote;
import com.aiinpocket.parkfinder.security.Caller;
import com.aiinpocket.parkfinder.service.ParkVoteService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 公園投票 REST API。
 */
@RestController
@RequestMapping("/api/parks/{parkId}")
@RequiredArgsConstructor
public class ParkVoteController {

    private final ParkVoteService voteService;

    /**
     * 投票（讚/噓）。重複投票回 409。
     */
    @PostMapping("/votes")
    public ResponseEntity<VoteResult> castVote(Caller caller, @PathVariable Long parkId,
                                               @Valid @RequestBody VoteRequest request) {
        VoteResult result = voteService.castVote(caller, parkId, request.upvote());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    /** 查詢我對此公園的投票，尚未投票回 204 */
    @GetMapping("/votes/mine")
    public ResponseEntity<VoteDetail> getMyVote(Caller caller, @PathVariable Long parkId) {
        return voteService.getMyVote(caller, parkId)
                .map(v -> ResponseEntity.ok(toDetail(v, parkId)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/votes")
    public List<VoteDetail> listVotes(Caller caller, @PathVariable Long parkId) {
        return voteService.listVotes(caller, parkId).stream()
                .map(v -> toDetail(v, parkId))
                .toList();
    }

    /** 管理員對帳：從投票帳本重算計數 */
    @PostMapping("/tally")
    public VoteTally recomputeTally(Caller caller, @PathVariable Long parkId) {
        return voteService.recomputeTally(caller, parkId);
    }

    private static VoteDetail toDetail(ParkVote v, Long parkId) {
        return new VoteDetail(v.getId(), parkId, v.getVoterId(), v.isUpvote(), v.getCreatedAt());
    }
}
