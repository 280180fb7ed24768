package com.aiinpocket.parkfinder.model.dto;

import java.time.Instant;

public record PhotoDetail(
        Long id,
        Long parkId,
        String url,
        String uploadedBy,
        boolean approved,
        Instant createdAt
) {}
