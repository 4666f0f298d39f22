package io.github.yok.sentilink.report;

import io.github.yok.sentilink.exception.ReportException;
import io.github.yok.sentilink.model.RunSummary;
import io.github.yok.sentilink.model.SentimentLabel;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Writes the plain-text statistics report of a run.
 *
 * <pre>
 * Sentiment Analysis Summary
 * ==================================================
 *
 * Sentiment Distribution:
 *   Positive: 2 (66.7%)
 *   Negative: 1 (33.3%)
 *
 * Polarity Statistics:
 *   Mean: 0.1234
 *   ...
 * ==================================================
 * Total Records Processed: 3
 * Empty Texts: 0
 * Fallback Results: 0
 * </pre>
 *
 * <p>
 * Labels are listed by descending count and omitted when their count is zero. Undefined
 * statistics are printed as {@code n/a}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SummaryReportWriter {

    private static final String RULE = StringUtils.repeat('=', 50);

    /**
     * Writes the report for precomputed statistics. Missing parent directories are created and
     * an existing file is overwritten.
     *
     * @param summary run statistics
     * @param file report file
     * @throws ReportException if the file cannot be written
     */
    public void write(RunSummary summary, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, render(summary), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ReportException("Failed to write summary report: " + file, e);
        }
        log.info("Summary report written: {}", file);
    }

    /**
     * Renders the report text.
     *
     * @param summary run statistics
     * @return report text
     */
    public String render(RunSummary summary) {
        StringWriter buffer = new StringWriter();
        PrintWriter out = new PrintWriter(buffer);
        out.println("Sentiment Analysis Summary");
        out.println(RULE);
        out.println();

        out.println("Sentiment Distribution:");
        List<SentimentLabel> labels = new ArrayList<>(List.of(SentimentLabel.values()));
        labels.sort(Comparator.<SentimentLabel>comparingInt(summary::count).reversed()
                .thenComparingInt(SentimentLabel::ordinal));
        for (SentimentLabel label : labels) {
            int count = summary.count(label);
            if (count > 0) {
                out.println("  " + label.displayName() + ": " + count + " ("
                        + String.format(Locale.ROOT, "%.1f", summary.percentage(label)) + "%)");
            }
        }
        out.println();

        out.println("Polarity Statistics:");
        out.println("  Mean: " + format(summary.getPolarityMean()));
        out.println("  Median: " + format(summary.getPolarityMedian()));
        out.println("  Std Dev: " + format(summary.getPolarityStdDev()));
        out.println("  Min: " + format(summary.getPolarityMin()));
        out.println("  Max: " + format(summary.getPolarityMax()));
        out.println();

        out.println("Subjectivity Statistics:");
        out.println("  Mean: " + format(summary.getSubjectivityMean()));
        out.println("  Median: " + format(summary.getSubjectivityMedian()));
        out.println("  Std Dev: " + format(summary.getSubjectivityStdDev()));
        out.println();

        out.println(RULE);
        out.println("Total Records Processed: " + summary.getTotalRows());
        out.println("Empty Texts: " + summary.getEmptyTextCount());
        out.println("Fallback Results: " + summary.getFallbackCount());
        out.flush();
        return buffer.toString();
    }

    private static String format(double value) {
        return Double.isNaN(value) ? "n/a" : String.format(Locale.ROOT, "%.4f", value);
    }
}
