package com.aiinpocket.parkfinder.model.dto;

import java.time.Instant;

public record VoteDetail(
        Long id,
        Long parkId,
        String voterId,
        boolean upvote,
        Instant createdAt
) {}
