package com.github.dimitryivaniuta.cmdb.support;

public final class PagingSupport {
    private PagingSupport() {}

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    public static int page(Integer page) {
        return clampInt(page, DEFAULT_PAGE, 1, Integer.MAX_VALUE);
    }

    public static int limit(Integer limit) {
        return clampInt(limit, DEFAULT_LIMIT, 1, MAX_LIMIT);
    }

    public static long offset(int page, int limit) {
        return (long) (page - 1) * limit;
    }

    public static int clampInt(Integer v, int def, int min, int max) {
        if (v == null) return def;
        return Math.max(min, Math.min(max, v));
    }
}
