package io.github.yok.sentilink.report;

import com.google.common.collect.ImmutableMap;
import io.github.yok.sentilink.model.RunSummary;
import io.github.yok.sentilink.model.ScoreOutcome;
import io.github.yok.sentilink.model.SentimentLabel;
import io.github.yok.sentilink.model.SentimentResult;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Computes {@link RunSummary} statistics.
 *
 * <p>
 * Standard deviations are sample standard deviations ({@code n - 1} denominator). Statistics that
 * are undefined for the input are {@link Double#NaN}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class RunSummaryCalculator {

    private RunSummaryCalculator() {
        // Utility class; do not instantiate.
    }

    /**
     * Summarizes the outcomes of one scoring run.
     *
     * @param outcomes one outcome per row
     * @return run statistics including empty-text and fallback counts
     */
    public static RunSummary fromOutcomes(List<ScoreOutcome> outcomes) {
        List<SentimentResult> results = new ArrayList<>(outcomes.size());
        int empty = 0;
        int fallback = 0;
        for (ScoreOutcome outcome : outcomes) {
            results.add(outcome.getResult());
            if (outcome.getStatus() == ScoreOutcome.Status.EMPTY) {
                empty++;
            } else if (outcome.isFallback()) {
                fallback++;
            }
        }
        return summarize(results, empty, fallback);
    }

    private static RunSummary summarize(List<SentimentResult> results, int empty, int fallback) {
        Map<SentimentLabel, Integer> counts = new EnumMap<>(SentimentLabel.class);
        for (SentimentLabel label : SentimentLabel.values()) {
            counts.put(label, 0);
        }
        double[] polarity = new double[results.size()];
        double[] subjectivity = new double[results.size()];
        for (int i = 0; i < results.size(); i++) {
            SentimentResult r = results.get(i);
            counts.merge(r.getLabel(), 1, Integer::sum);
            polarity[i] = r.getPolarity();
            subjectivity[i] = r.getSubjectivity();
        }
        return RunSummary.builder().totalRows(results.size())
                .labelCounts(ImmutableMap.copyOf(counts)).polarityMean(mean(polarity))
                .polarityMedian(median(polarity)).polarityStdDev(sampleStdDev(polarity))
                .polarityMin(min(polarity)).polarityMax(max(polarity))
                .subjectivityMean(mean(subjectivity)).subjectivityMedian(median(subjectivity))
                .subjectivityStdDev(sampleStdDev(subjectivity)).emptyTextCount(empty)
                .fallbackCount(fallback).build();
    }

    static double mean(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    static double median(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    static double sampleStdDev(double[] values) {
        if (values.length < 2) {
            return Double.NaN;
        }
        double mean = mean(values);
        double squares = 0.0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return Math.sqrt(squares / (values.length - 1));
    }

    private static double min(double[] values) {
        return values.length == 0 ? Double.NaN : Arrays.stream(values).min().getAsDouble();
    }

    private static double max(double[] values) {
        return values.length == 0 ? Double.NaN : Arrays.stream(values).max().getAsDouble();
    }
}
