package ru.nsu.fanout.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BatchStateTest {

    @Test
    void receivedEitherRejectsOrProceedsToProbing() {
        assertThat(BatchState.RECEIVED.successors()).containsExactlyInAnyOrder(BatchState.REJECTED, BatchState.PROBED);
    }

    @Test
    void happyPathIsLinear() {
        assertThat(BatchState.PROBED.successors()).containsExactly(BatchState.PARTITIONED);
        assertThat(BatchState.PARTITIONED.successors()).containsExactly(BatchState.DISPATCHING);
        assertThat(BatchState.DISPATCHING.successors()).containsExactly(BatchState.AGGREGATED);
    }

    @Test
    void rejectedAndAggregatedAreTerminal() {
        assertThat(BatchState.REJECTED.isTerminal()).isTrue();
        assertThat(BatchState.AGGREGATED.isTerminal()).isTrue();
        assertThat(BatchState.DISPATCHING.isTerminal()).isFalse();
    }
}
