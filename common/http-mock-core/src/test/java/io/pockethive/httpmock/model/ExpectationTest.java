package io.pockethive.httpmock.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ExpectationTest {

    @Test
    void anyAcceptsEveryCount() {
        assertThat(Expectation.any().contains(0)).isTrue();
        assertThat(Expectation.any().contains(Long.MAX_VALUE)).isTrue();
        assertThat(Expectation.any().isUnbounded()).isTrue();
    }

    @Test
    void factoriesBuildInclusiveRanges() {
        assertThat(Expectation.exactly(2)).isEqualTo(new Expectation(2, 2));
        assertThat(Expectation.once()).isEqualTo(new Expectation(1, 1));
        assertThat(Expectation.never().contains(1)).isFalse();
        assertThat(Expectation.atLeast(3).contains(2)).isFalse();
        assertThat(Expectation.atLeast(3).contains(3)).isTrue();
        assertThat(Expectation.atMost(1).contains(2)).isFalse();
        assertThat(Expectation.between(1, 3).contains(1)).isTrue();
        assertThat(Expectation.between(1, 3).contains(3)).isTrue();
        assertThat(Expectation.between(1, 3).contains(4)).isFalse();
    }

    @Test
    void rendersRange() {
        assertThat(Expectation.exactly(1)).hasToString("[1, 1]");
        assertThat(Expectation.atLeast(2)).hasToString("[2, unbounded]");
    }

    @Test
    void rejectsInvalidRanges() {
        assertThatThrownBy(() -> Expectation.between(3, 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("max");
        assertThatThrownBy(() -> Expectation.atLeast(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("min");
    }
}
