/* (C)2026 */
package com.ammann.dashboard.service;

import com.ammann.dashboard.model.Column;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Descriptive statistics shared by the cleaning, profiling and chart planning stages.
 *
 * <p>Provides:
 * <ul>
 *   <li>mean, sample standard deviation (n-1 denominator) and linearly interpolated percentiles</li>
 *   <li>Pearson correlation for column pairs and full correlation matrices</li>
 *   <li>frequency tables and modes with first-seen tie-breaking</li>
 *   <li>fixed-width histograms</li>
 * </ul>
 *
 * <p>All methods are pure. Degenerate inputs (no values, a single value, zero variance)
 * yield well-defined results instead of exceptions or NaN.
 */
@ApplicationScoped
public class StatisticsService
{

    private static final Logger LOG = Logger.getLogger(StatisticsService.class);

    /**
     * Computes count, mean, sample standard deviation, minimum, quartiles and maximum.
     *
     * <p>All fields are 0.0 for an empty input; the standard deviation of a single value is 0.0.
     *
     * @param values observed values (not modified)
     * @return descriptive statistics
     */
    public NumericStatistics describe(double[] values)
    {
        if (values.length == 0) {
            return new NumericStatistics(0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0);
        }

        double[] sorted = sortedCopy(values);

        return new NumericStatistics(
                values.length,
                mean(values),
                sampleStandardDeviation(values),
                sorted[0],
                percentileOfSorted(sorted, 0.25),
                percentileOfSorted(sorted, 0.50),
                percentileOfSorted(sorted, 0.75),
                sorted[sorted.length - 1]
        );
    }

    /** Arithmetic mean, 0.0 for an empty input. */
    public double mean(double[] values)
    {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /** Sample standard deviation with n-1 denominator, 0.0 for fewer than two values. */
    public double sampleStandardDeviation(double[] values)
    {
        if (values.length < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double squares = 0.0;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        return Math.sqrt(squares / (values.length - 1));
    }

    /**
     * Percentile using linear interpolation between the closest order statistics.
     *
     * @param values   observed values (not modified)
     * @param fraction percentile as a fraction in [0, 1]
     * @return interpolated percentile, 0.0 for an empty input
     * @throws IllegalArgumentException if the fraction lies outside [0, 1]
     */
    public double percentile(double[] values, double fraction)
    {
        if (fraction < 0.0 || fraction > 1.0) {
            throw new IllegalArgumentException(
                    String.format("Percentile fraction must be within [0, 1], got %.3f", fraction));
        }
        if (values.length == 0) {
            return 0.0;
        }
        return percentileOfSorted(sortedCopy(values), fraction);
    }

    /** Median of the observed values, 0.0 for an empty input. */
    public double median(double[] values)
    {
        return percentile(values, 0.5);
    }

    /**
     * Pearson correlation coefficient of two equally long series.
     *
     * <p>Returns 0.0 when fewer than two pairs exist or either series has zero variance.
     *
     * @throws IllegalArgumentException if the series differ in length
     */
    public double pearson(double[] x, double[] y)
    {
        if (x.length != y.length) {
            throw new IllegalArgumentException(
                    String.format("Series lengths differ: %d vs %d", x.length, y.length));
        }
        if (x.length < 2) {
            return 0.0;
        }

        double meanX = mean(x);
        double meanY = mean(y);
        double covariance = 0.0;
        double varianceX = 0.0;
        double varianceY = 0.0;

        for (int i = 0; i < x.length; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            covariance += dx * dy;
            varianceX += dx * dx;
            varianceY += dy * dy;
        }

        if (varianceX == 0.0 || varianceY == 0.0) {
            return 0.0;
        }

        double r = covariance / Math.sqrt(varianceX * varianceY);
        // rounding can push |r| slightly above 1
        return Math.max(-1.0, Math.min(1.0, r));
    }

    /**
     * Pairwise Pearson correlation over the given numeric columns, keyed by column name in
     * column order. The diagonal is always exactly 1.0.
     *
     * @param numericColumns numeric columns of equal length
     * @return nested map {@code row column -> (column -> coefficient)}
     */
    public Map<String, Map<String, Double>> correlationMatrix(List<Column> numericColumns)
    {
        List<double[]> series = new ArrayList<>(numericColumns.size());
        for (Column column : numericColumns) {
            series.add(column.numericValues());
        }

        Map<String, Map<String, Double>> matrix = new LinkedHashMap<>();
        for (int i = 0; i < numericColumns.size(); i++) {
            Map<String, Double> row = new LinkedHashMap<>();
            for (int j = 0; j < numericColumns.size(); j++) {
                double r = i == j ? 1.0 : pearson(series.get(i), series.get(j));
                row.put(numericColumns.get(j).name(), r);
            }
            matrix.put(numericColumns.get(i).name(), row);
        }

        LOG.debugf("Correlation matrix computed over %d numeric columns", numericColumns.size());
        return matrix;
    }

    /**
     * Counts occurrences of each value, ordered by descending count. Values with equal
     * counts keep the order in which they were first seen.
     *
     * @param values observed values; {@code null} entries are ignored
     * @return ordered frequency table
     */
    public LinkedHashMap<Object, Long> valueCounts(List<?> values)
    {
        Map<Object, Long> firstSeenOrder = new LinkedHashMap<>();
        for (Object value : values) {
            if (value != null) {
                firstSeenOrder.merge(value, 1L, Long::sum);
            }
        }

        List<Map.Entry<Object, Long>> entries = new ArrayList<>(firstSeenOrder.entrySet());
        // List.sort is stable, so ties stay in first-seen order
        entries.sort((a, b) -> Long.compare(b.getValue(), a.getValue()));

        LinkedHashMap<Object, Long> ordered = new LinkedHashMap<>();
        for (Map.Entry<Object, Long> entry : entries) {
            ordered.put(entry.getKey(), entry.getValue());
        }
        return ordered;
    }

    /**
     * Returns the most frequent value; among values sharing the maximum count the one seen
     * first wins.
     *
     * @param values observed values; {@code null} entries are ignored
     * @return the mode, or empty if no value was observed
     */
    public Optional<Object> mode(List<?> values)
    {
        return valueCounts(values).keySet().stream().findFirst();
    }

    /**
     * Bins values into {@code binCount} equal-width buckets spanning [min, max]. The last
     * bucket is closed on the right. A zero-range input is spread over a unit-wide range
     * centred on its value.
     *
     * @param values   observed values (not modified)
     * @param binCount number of buckets
     * @return bucket edges ({@code binCount + 1}) and counts ({@code binCount})
     * @throws IllegalArgumentException if {@code binCount} is not positive
     */
    public Histogram histogram(double[] values, int binCount)
    {
        if (binCount <= 0) {
            throw new IllegalArgumentException("Bin count must be positive, got " + binCount);
        }

        long[] counts = new long[binCount];
        double[] edges = new double[binCount + 1];
        if (values.length == 0) {
            return new Histogram(edges, counts);
        }

        double[] sorted = sortedCopy(values);
        double min = sorted[0];
        double max = sorted[sorted.length - 1];
        if (max == min) {
            min -= 0.5;
            max += 0.5;
        }

        double width = (max - min) / binCount;
        for (int i = 0; i < binCount; i++) {
            edges[i] = min + i * width;
        }
        edges[binCount] = max;

        for (double value : values) {
            int bucket = (int) ((value - min) / width);
            counts[Math.max(0, Math.min(bucket, binCount - 1))]++;
        }

        return new Histogram(edges, counts);
    }

    private static double[] sortedCopy(double[] values)
    {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        return sorted;
    }

    private static double percentileOfSorted(double[] sorted, double fraction)
    {
        double position = fraction * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }

    /**
     * Standard descriptive statistics of one numeric series.
     */
    public record NumericStatistics(
            long count,
            double mean,
            double standardDeviation,
            double min,
            double q1,
            double median,
            double q3,
            double max
    )
    {
    }

    /**
     * Equal-width histogram: {@code edges.length == counts.length + 1}.
     */
    public record Histogram(double[] edges, long[] counts)
    {
        public long total()
        {
            return Arrays.stream(counts).sum();
        }
    }
}
