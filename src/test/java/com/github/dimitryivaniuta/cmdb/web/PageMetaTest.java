package com.github.dimitryivaniuta.cmdb.web;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PageMetaTest {

    @Test
    void middlePageHasBothNeighbours() {
        PageMeta meta = PageMeta.of(2, 10, 25);

        assertThat(meta.totalPages()).isEqualTo(3);
        assertThat(meta.hasNextPage()).isTrue();
        assertThat(meta.hasPrevPage()).isTrue();
    }

    @Test
    void lastPageHasNoNext() {
        PageMeta meta = PageMeta.of(3, 10, 25);

        assertThat(meta.hasNextPage()).isFalse();
        assertThat(meta.hasPrevPage()).isTrue();
    }

    @Test
    void exactMultipleDoesNotAddAPage() {
        PageMeta meta = PageMeta.of(2, 10, 20);

        assertThat(meta.totalPages()).isEqualTo(2);
        assertThat(meta.hasNextPage()).isFalse();
    }

    @Test
    void emptyResult() {
        PageMeta meta = PageMeta.of(1, 20, 0);

        assertThat(meta.totalPages()).isZero();
        assertThat(meta.hasNextPage()).isFalse();
        assertThat(meta.hasPrevPage()).isFalse();
    }
}
