package com.aiinpocket.parkfinder.model.dto;

import com.aiinpocket.parkfinder.model.enums.ParkStatus;

import java.time.Instant;

/**
 * 公園詳情 DTO。
 */
public record ParkDetail(
        Long id,
        String name,
        String description,
        double latitude,
        double longitude,
        String address,
        ParkStatus status,
        int upvotes,
        int downvotes,
        boolean mine,
        Instant createdAt,
        Instant decidedAt
) {}
