package com.aiinpocket.parkfinder.model.dto;

public record TagDetail(Long id, Long parkId, String tag) {}
