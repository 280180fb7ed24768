package com.aiinpocket.parkfinder.service;

import com.aiinpocket.parkfinder.model.dto.VoteTally;
import com.aiinpocket.parkfinder.repository.ParkVoteRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 從投票帳本重新統計讚/噓數。
 * 必須在與投票寫入相同的交易內呼叫，統計結果才會包含剛寫入的那一票。
 */
@Component
@RequiredArgsConstructor
public class TallyAggregator {

    private final ParkVoteRepository voteRepo;

    public VoteTally recompute(Long parkId) {
        long up = voteRepo.countByParkIdAndUpvote(parkId, true);
        long down = voteRepo.countByParkIdAndUpvote(parkId, false);
        return new VoteTally(Math.toIntExact(up), Math.toIntExact(down));
    }
}
