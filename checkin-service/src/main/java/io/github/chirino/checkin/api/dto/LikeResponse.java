package io.github.chirino.checkin.api.dto;

import io.github.chirino.checkin.model.LikeResult;

public record LikeResponse(boolean liked, boolean alreadyLiked, int likes) {

    public static LikeResponse from(LikeResult result) {
        return new LikeResponse(result.liked(), result.alreadyLiked(), result.likes());
    }
}
