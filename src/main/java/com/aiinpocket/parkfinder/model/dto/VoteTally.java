package com.aiinpocket.parkfinder.model.dto;

/**
 * 某公園的讚/噓統計。
 */
public record VoteTally(int upvotes, int downvotes) {

    public int total() {
        return upvotes + downvotes;
    }
}
