package com.datapipe.orchestrator.repository;

import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Sort;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OffsetPageRequestTest {

    @Test
    void offsetNeedNotAlignWithPages() {
        OffsetPageRequest page = new OffsetPageRequest(7, 5, Sort.unsorted());

        assertThat(page.getOffset()).isEqualTo(7);
        assertThat(page.getPageSize()).isEqualTo(5);
        assertThat(page.next().getOffset()).isEqualTo(12);
        assertThat(page.previousOrFirst().getOffset()).isEqualTo(2);
        assertThat(page.first().getOffset()).isZero();
    }

    @Test
    void invalidArguments_rejected() {
        assertThatThrownBy(() -> new OffsetPageRequest(-1, 5, Sort.unsorted()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OffsetPageRequest(0, 0, Sort.unsorted()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
