package com.github.dimitryivaniuta.cmdb.resource;

import com.github.dimitryivaniuta.cmdb.web.PageMeta;

import java.util.List;

public record PageResult<T>(
        List<T> data,
        long totalCount,
        int page,
        int limit,
        int totalPages,
        boolean hasNextPage,
        boolean hasPrevPage
) {

    public static <T> PageResult<T> of(List<T> data, long totalCount, int page, int limit) {
        PageMeta meta = PageMeta.of(page, limit, totalCount);
        return new PageResult<>(data, totalCount, page, limit, meta.totalPages(), meta.hasNextPage(), meta.hasPrevPage());
    }

    public PageMeta toMeta() {
        return new PageMeta(page, limit, totalCount, totalPages, hasNextPage, hasPrevPage);
    }
}
