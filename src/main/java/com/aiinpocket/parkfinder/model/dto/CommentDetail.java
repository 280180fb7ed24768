package com.aiinpocket.parkfinder.model.dto;

import java.time.Instant;

public record CommentDetail(
        Long id,
        Long parkId,
        String authorId,
        String content,
        boolean reported,
        Instant createdAt
) {}
