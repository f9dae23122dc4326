package com.github.dimitryivaniuta.cmdb.web;

public record PageMeta(
        int page,
        int limit,
        long totalCount,
        int totalPages,
        boolean hasNextPage,
        boolean hasPrevPage
) {

    public static PageMeta of(int page, int limit, long totalCount) {
        int totalPages = limit <= 0 ? 0 : (int) ((totalCount + limit - 1) / limit);
        return new PageMeta(
                page,
                limit,
                totalCount,
                totalPages,
                (long) page * limit < totalCount,
                page > 1
        );
    }
}
