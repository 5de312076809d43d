/* (C)2026 */
package com.ammann.dashboard.service;

import static com.ammann.dashboard.support.TestTables.numeric;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.dashboard.model.Column;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StatisticsServiceTest {

    private final StatisticsService service = new StatisticsService();

    @Test
    void describeComputesQuartilesAndSampleStd() {
        StatisticsService.NumericStatistics stats = service.describe(new double[] {4, 1, 3, 2});

        assertThat(stats.count()).isEqualTo(4);
        assertThat(stats.mean()).isEqualTo(2.5);
        assertThat(stats.standardDeviation()).isCloseTo(Math.sqrt(5.0 / 3.0), within(1e-12));
        assertThat(stats.min()).isEqualTo(1.0);
        assertThat(stats.q1()).isCloseTo(1.75, within(1e-12));
        assertThat(stats.median()).isCloseTo(2.5, within(1e-12));
        assertThat(stats.q3()).isCloseTo(3.25, within(1e-12));
        assertThat(stats.max()).isEqualTo(4.0);
    }

    @Test
    void describeOfEmptyInputIsAllZero() {
        StatisticsService.NumericStatistics stats = service.describe(new double[0]);

        assertThat(stats.count()).isZero();
        assertThat(stats.mean()).isZero();
        assertThat(stats.standardDeviation()).isZero();
        assertThat(stats.max()).isZero();
    }

    @Test
    void standardDeviationOfSingleValueIsZero() {
        assertThat(service.sampleStandardDeviation(new double[] {7.0})).isZero();
        assertThat(service.describe(new double[] {7.0}).median()).isEqualTo(7.0);
    }

    @Test
    void medianOfOddAndEvenInputs() {
        assertThat(service.median(new double[] {10, 20, 40})).isEqualTo(20.0);
        assertThat(service.median(new double[] {1, 2, 3, 4})).isEqualTo(2.5);
    }

    @Test
    void percentileDoesNotModifyInput() {
        double[] values = {3, 1, 2};
        service.percentile(values, 0.5);

        assertThat(values).containsExactly(3, 1, 2);
    }

    @Test
    void percentileRejectsFractionOutsideUnitInterval() {
        assertThatThrownBy(() -> service.percentile(new double[] {1}, 1.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("within [0, 1]");
    }

    @Test
    void pearsonDetectsPerfectLinearRelations() {
        assertThat(service.pearson(new double[] {1, 2, 3}, new double[] {2, 4, 6})).isCloseTo(1.0, within(1e-12));
        assertThat(service.pearson(new double[] {1, 2, 3}, new double[] {3, 2, 1})).isCloseTo(-1.0, within(1e-12));
    }

    @Test
    void pearsonIsZeroForConstantSeriesOrSinglePair() {
        assertThat(service.pearson(new double[] {1, 2, 3}, new double[] {5, 5, 5})).isZero();
        assertThat(service.pearson(new double[] {1}, new double[] {2})).isZero();
    }

    @Test
    void pearsonRejectsSeriesOfDifferentLength() {
        assertThatThrownBy(() -> service.pearson(new double[] {1, 2}, new double[] {1}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void correlationMatrixHasUnitDiagonalAndColumnOrder() {
        List<Column> columns = List.of(
                numeric("a", 1, 2, 3, 4),
                numeric("b", 4, 3, 2, 1),
                numeric("c", 7, 7, 7, 7));

        Map<String, Map<String, Double>> matrix = service.correlationMatrix(columns);

        assertThat(matrix.keySet()).containsExactly("a", "b", "c");
        assertThat(matrix.get("a").keySet()).containsExactly("a", "b", "c");
        for (String name : List.of("a", "b", "c")) {
            assertThat(matrix.get(name).get(name)).isEqualTo(1.0);
        }
        assertThat(matrix.get("a").get("b")).isCloseTo(-1.0, within(1e-12));
        assertThat(matrix.get("a").get("c")).isZero();
        assertThat(matrix.get("b").get("a")).isEqualTo(matrix.get("a").get("b"));
    }

    @Test
    void modeBreaksTiesByFirstSeenValue() {
        assertThat(service.mode(List.of("B", "A", "B", "A"))).contains("B");
        assertThat(service.mode(List.of("A", "B", "B", "A"))).contains("A");
    }

    @Test
    void modeOfOnlyNullsIsEmpty() {
        assertThat(service.mode(Arrays.asList(null, null))).isEmpty();
    }

    @Test
    void valueCountsOrderByCountThenFirstSeen() {
        LinkedHashMap<Object, Long> counts = service.valueCounts(Arrays.asList("x", "y", null, "z", "y", "z"));

        assertThat(counts.keySet()).containsExactly("y", "z", "x");
        assertThat(counts.values()).containsExactly(2L, 2L, 1L);
    }

    @Test
    void histogramClosesLastBinOnTheRight() {
        StatisticsService.Histogram histogram = service.histogram(new double[] {0, 10, 5, 2}, 2);

        assertThat(histogram.edges()).containsExactly(0.0, 5.0, 10.0);
        assertThat(histogram.counts()).containsExactly(2, 2);
        assertThat(histogram.total()).isEqualTo(4);
    }

    @Test
    void histogramWidensZeroRange() {
        StatisticsService.Histogram histogram = service.histogram(new double[] {3, 3, 3}, 2);

        assertThat(histogram.edges()).containsExactly(2.5, 3.0, 3.5);
        assertThat(histogram.total()).isEqualTo(3);
    }

    @Test
    void histogramRejectsNonPositiveBinCount() {
        assertThatThrownBy(() -> service.histogram(new double[] {1}, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
