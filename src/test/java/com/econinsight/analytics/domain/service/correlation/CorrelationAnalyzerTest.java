package com.econinsight.analytics.domain.service.correlation;

import com.econinsight.analytics.domain.model.CorrelationEdge;
import com.econinsight.analytics.domain.model.Series;
import com.econinsight.analytics.domain.service.AnalyticsProperties;
import com.econinsight.analytics.support.TestSeries;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CorrelationAnalyzerTest {

    private final CorrelationAnalyzer analyzer = new CorrelationAnalyzer(new AnalyticsProperties());

    @Test
    void durableGoodsAndRetailSalesMoveTogether() {
        Series durable = TestSeries.generate("DGDSRC1A027NBEA", 60, i -> 1500 + 12.0 * i + 20 * Math.sin(i / 3.0));
        Series retail = TestSeries.generate("RSAFS", 60, i -> 480 + 3.5 * i + 4 * Math.sin(i / 3.0) + Math.cos(1.3 * i));

        CorrelationEdge edge = analyzer.correlate(durable, retail).orElseThrow();

        assertThat(edge.coefficient()).isGreaterThan(0.95);
        assertThat(edge.window().size()).isEqualTo(60);
    }

    @Test
    void coefficientIsUndefinedNotZeroWhenOneSideIsFlat() {
        Series flat = TestSeries.constant("FLAT", 24, 7.0);
        Series moving = TestSeries.generate("MOVING", 24, i -> i * 1.5);

        CorrelationEdge edge = analyzer.correlate(flat, moving).orElseThrow();

        assertThat(edge.isDefined()).isFalse();
        assertThat(edge.coefficient()).isNaN();
    }

    @Test
    void joinsOnSharedMonthsOnly() {
        Series a = TestSeries.atOffsets("A", new int[]{0, 1, 2, 3, 4, 5, 6, 7, 8, 9}, i -> i);
        Series b = TestSeries.atOffsets("B", new int[]{2, 3, 5, 6, 7, 8, 9, 10, 11}, i -> -2.0 * i);

        CorrelationEdge edge = analyzer.correlate(a, b).orElseThrow();

        assertThat(edge.window().size()).isEqualTo(7);
        assertThat(edge.window().start()).isEqualTo(LocalDate.of(2017, 3, 1));
        assertThat(edge.window().end()).isEqualTo(LocalDate.of(2017, 10, 1));
        assertThat(edge.coefficient()).isCloseTo(-1.0, within(1e-12));
    }

    @Test
    void pairsBelowMinimumOverlapAreLeftOut() {
        Series a = TestSeries.atOffsets("A", new int[]{0, 1, 2, 3, 4, 5, 6, 7}, i -> i);
        Series b = TestSeries.atOffsets("B", new int[]{3, 4, 5, 6, 7, 20}, i -> i * i);

        assertThat(analyzer.correlate(a, b)).isEmpty();
        assertThat(analyzer.analyze(List.of(a, b))).isEmpty();
    }

    @Test
    void everyUnorderedPairOnceSortedByStrengthWithUndefinedLast() {
        Series up = TestSeries.generate("UP", 24, i -> i);
        Series down = TestSeries.generate("DOWN", 24, i -> 100 - 2.0 * i);
        Series noisy = TestSeries.generate("NOISY", 24, i -> i + 8 * Math.sin(2.1 * i));
        Series flat = TestSeries.constant("FLAT", 24, 1.0);

        List<CorrelationEdge> edges = analyzer.analyze(List.of(noisy, flat, up, down));

        assertThat(edges).hasSize(6);
        assertThat(edges.get(0).coefficient()).isCloseTo(-1.0, within(1e-12));
        assertThat(edges.get(0).involves("UP")).isTrue();
        assertThat(edges.get(0).involves("DOWN")).isTrue();
        for (int i = 1; i < 3; i++) {
            assertThat(Math.abs(edges.get(i).coefficient()))
                    .isLessThanOrEqualTo(Math.abs(edges.get(i - 1).coefficient()));
        }
        assertThat(edges.subList(3, 6)).allSatisfy(e -> {
            assertThat(e.isDefined()).isFalse();
            assertThat(e.involves("FLAT")).isTrue();
        });
        edges.stream().filter(CorrelationEdge::isDefined)
                .forEach(e -> assertThat(e.coefficient()).isBetween(-1.0, 1.0));
    }

    @Test
    void strongestForPicksTheSeriesOwnEdges() {
        Series up = TestSeries.generate("UP", 24, i -> i);
        Series down = TestSeries.generate("DOWN", 24, i -> 100 - 2.0 * i);
        Series noisy = TestSeries.generate("NOISY", 24, i -> i + 8 * Math.sin(2.1 * i));

        List<CorrelationEdge> related = CorrelationAnalyzer.strongestFor("NOISY",
                analyzer.analyze(List.of(up, down, noisy)), 1);

        assertThat(related).hasSize(1);
        assertThat(related.get(0).involves("NOISY")).isTrue();
    }
}
