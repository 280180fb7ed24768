package com.aiinpocket.parkfinder.model.dto;

import jakarta.validation.constraints.NotNull;

/**
 * 管理員切換審核旗標用（照片 approved、留言 reported）。
 */
public record FlagRequest(@NotNull Boolean value) {}
