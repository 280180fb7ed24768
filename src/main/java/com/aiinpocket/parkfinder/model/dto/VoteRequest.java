package com.aiinpocket.parkfinder.model.dto;

import jakarta.validation.constraints.NotNull;

/** {@code upvote}: true=讚, false=噓 */
public record VoteRequest(@NotNull Boolean upvote) {}
