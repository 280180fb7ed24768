package com.aiinpocket.parkfinder.model.dto;

import com.aiinpocket.parkfinder.model.enums.ParkStatus;

/**
 * 投票結果：新投票的 ID 以及投票後公園的最新計數與狀態。
 */
public record VoteResult(
        Long voteId,
        Long parkId,
        int upvotes,
        int downvotes,
        ParkStatus status
) {}
