package io.github.chirino.checkin.api.dto;

import io.github.chirino.checkin.model.Page;
import java.util.List;
import java.util.function.Function;

public record PageView<T>(List<T> items, long total, int page, int limit, int totalPages) {

    public static <S, T> PageView<T> from(Page<S> page, Function<S, T> mapper) {
        return new PageView<>(
                page.items().stream().map(mapper).toList(),
                page.total(),
                page.page(),
                page.limit(),
                page.totalPages());
    }
}
