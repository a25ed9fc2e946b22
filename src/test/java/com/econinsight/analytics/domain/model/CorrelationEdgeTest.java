package com.econinsight.analytics.domain.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CorrelationEdgeTest {

    private static final AlignedWindow WINDOW = new AlignedWindow(12, LocalDate.of(2020, 1, 1), LocalDate.of(2020, 12, 1));

    @Test
    void pairIsUnordered() {
        CorrelationEdge edge = new CorrelationEdge("RSAFS", "PCEC96", 0.9, WINDOW);

        assertThat(edge.seriesA()).isEqualTo("PCEC96");
        assertThat(edge.seriesB()).isEqualTo("RSAFS");
        assertThat(edge.other("RSAFS")).isEqualTo("PCEC96");
        assertThat(edge).isEqualTo(new CorrelationEdge("PCEC96", "RSAFS", 0.9, WINDOW));
    }

    @Test
    void nanMeansUndefinedAndOutOfRangeIsRejected() {
        assertThat(new CorrelationEdge("A", "B", Double.NaN, WINDOW).isDefined()).isFalse();
        assertThatThrownBy(() -> new CorrelationEdge("A", "B", 1.01, WINDOW))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CorrelationEdge("A", "A", 0.5, WINDOW))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
