package com.aiinpocket.parkfinder.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record PhotoRequest(@NotBlank @Size(max = 1000) String url) {}
