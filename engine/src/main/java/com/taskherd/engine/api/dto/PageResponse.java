package com.taskherd.engine.api.dto;

import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

/** One page of a listing, newest first. */
public record PageResponse<T>(List<T> items, int page, int size, long total) {

    public static <E, T> PageResponse<T> from(Page<E> page, Function<E, T> mapper) {
        return new PageResponse<>(page.getContent().stream().map(mapper).toList(),
                page.getNumber(), page.getSize(), page.getTotalElements());
    }
}
