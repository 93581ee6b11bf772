package io.github.chirino.checkin.model;

import java.util.List;

public record Page<T>(List<T> items, long total, int page, int limit) {

    public Page {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public int totalPages() {
        return total > 0 ? (int) ((total + limit - 1) / limit) : 0;
    }
}
