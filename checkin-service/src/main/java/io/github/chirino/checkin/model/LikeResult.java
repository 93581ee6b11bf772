package io.github.chirino.checkin.model;

public record LikeResult(boolean liked, int likes) {

    public boolean alreadyLiked() {
        return !liked;
    }
}
