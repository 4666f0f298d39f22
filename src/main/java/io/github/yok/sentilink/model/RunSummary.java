package io.github.yok.sentilink.model;

import com.google.common.collect.ImmutableMap;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Aggregate statistics of one pipeline run.
 *
 * <p>
 * Statistics that are undefined for the data (for example the standard deviation of fewer than two
 * values) are {@link Double#NaN}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@Builder
@ToString
public class RunSummary {

    private final int totalRows;

    // Label → row count; contains every label, zero counts included
    private final ImmutableMap<SentimentLabel, Integer> labelCounts;

    private final double polarityMean;
    private final double polarityMedian;
    private final double polarityStdDev;
    private final double polarityMin;
    private final double polarityMax;

    private final double subjectivityMean;
    private final double subjectivityMedian;
    private final double subjectivityStdDev;

    // Rows whose text was null or blank
    private final int emptyTextCount;

    // Rows scored through the fallback path
    private final int fallbackCount;

    /**
     * @param label label to look up
     * @return number of rows with the label
     */
    public int count(SentimentLabel label) {
        Integer count = labelCounts.get(label);
        return count == null ? 0 : count;
    }

    /**
     * @param label label to look up
     * @return share of rows with the label in percent, {@code 0} when there are no rows
     */
    public double percentage(SentimentLabel label) {
        if (totalRows == 0) {
            return 0.0;
        }
        return count(label) * 100.0 / totalRows;
    }
}
