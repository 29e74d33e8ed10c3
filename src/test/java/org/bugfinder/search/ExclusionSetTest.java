package org.bugfinder.search;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExclusionSetTest {

    @Test
    void mark_shiftsFootprintByColumn() {
        ExclusionSet exclusions = new ExclusionSet();
        exclusions.mark(3, 5, List.of(0, 2));

        assertThat(exclusions.isConsumed(3, 5)).isTrue();
        assertThat(exclusions.isConsumed(3, 6)).isFalse();
        assertThat(exclusions.isConsumed(3, 7)).isTrue();
        assertThat(exclusions.isConsumed(4, 5)).isFalse();
        assertThat(exclusions.consumedCount()).isEqualTo(2);
    }

    @Test
    void mark_isIdempotent() {
        ExclusionSet exclusions = new ExclusionSet();
        exclusions.mark(1, 1, List.of(0, 1));
        exclusions.mark(1, 2, List.of(0, 1));

        assertThat(exclusions.consumedCount()).isEqualTo(3);
    }

    @Test
    void isBlocked_whenAnyShiftedPositionIsConsumed() {
        ExclusionSet exclusions = new ExclusionSet();
        exclusions.mark(2, 4, List.of(0));

        assertThat(exclusions.isBlocked(2, 1, List.of(0, 3))).isTrue();
        assertThat(exclusions.isBlocked(2, 1, List.of(0, 1, 2))).isFalse();
        // 通配位置不参与判断
        assertThat(exclusions.isBlocked(2, 2, List.of(0, 3))).isFalse();
        assertThat(exclusions.isBlocked(1, 4, List.of(0))).isFalse();
    }

    @Test
    void emptyFootprint_neverMarksOrBlocks() {
        ExclusionSet exclusions = new ExclusionSet();
        exclusions.mark(1, 1, List.of());

        assertThat(exclusions.isEmpty()).isTrue();
        assertThat(exclusions.isBlocked(1, 1, List.of())).isFalse();
    }
}
