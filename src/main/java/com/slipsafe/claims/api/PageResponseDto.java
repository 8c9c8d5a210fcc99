package com.slipsafe.claims.api;

import lombok.Builder;
import lombok.Value;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

/**
 * Stable JSON shape for paged results.
 */
@Value
@Builder
public class PageResponseDto<T> {

    List<T> content;
    int page;
    int size;
    long totalElements;
    int totalPages;

    public static <S, T> PageResponseDto<T> from(Page<S> page, Function<S, T> mapper) {
        return PageResponseDto.<T>builder()
                .content(page.getContent().stream().map(mapper).toList())
                .page(page.getNumber())
                .size(page.getSize())
                .totalElements(page.getTotalElements())
                .totalPages(page.getTotalPages())
                .build();
    }
}
