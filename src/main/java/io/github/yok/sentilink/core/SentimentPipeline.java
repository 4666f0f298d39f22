package io.github.yok.sentilink.core;

import io.github.yok.sentilink.config.DestinationConfig;
import io.github.yok.sentilink.config.PipelineConfig;
import io.github.yok.sentilink.config.SourceConfig;
import io.github.yok.sentilink.exception.ConfigurationException;
import io.github.yok.sentilink.exception.ReportException;
import io.github.yok.sentilink.model.ProcessedColumns;
import io.github.yok.sentilink.model.RunSummary;
import io.github.yok.sentilink.model.ScoreOutcome;
import io.github.yok.sentilink.model.SentimentLabel;
import io.github.yok.sentilink.model.SentimentResult;
import io.github.yok.sentilink.model.Tabular;
import io.github.yok.sentilink.nlp.SentimentScorer;
import io.github.yok.sentilink.report.RunSummaryCalculator;
import io.github.yok.sentilink.report.SummaryReportWriter;
import io.github.yok.sentilink.store.DataStoreFactory;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;

/**
 * Runs the sentiment enrichment pipeline: load, score, save.
 *
 * <p>
 * <strong>Processing flow:</strong>
 * </p>
 * <ol>
 * <li>Validate the source and destination settings before any I/O.</li>
 * <li>Load the dataset through the {@link io.github.yok.sentilink.store.DataSource} selected for
 * the source kind and check that the text column exists.</li>
 * <li>Score the text column in chunks of {@code pipeline.progress-interval} rows and append
 * {@code processed_at}, {@code sentiment}, {@code polarity} and {@code subjectivity} to every
 * row.</li>
 * <li>Save the processed dataset through the {@link io.github.yok.sentilink.store.DataSink}
 * selected for the destination kind.</li>
 * <li>Optionally write the statistics report; a report failure is logged and does not fail the
 * run.</li>
 * </ol>
 *
 * <p>
 * A row that cannot be scored never aborts the run. Failures while loading or saving end the run
 * with {@link PipelineFailedException}; nothing is written when loading fails.
 * </p>
 *
 * <p>
 * Instances hold only immutable collaborators and can run several pipelines one after another.
 * Each run is tagged with a run id in the SLF4J MDC key {@value RunContext#MDC_KEY}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class SentimentPipeline {

    private final DataStoreFactory storeFactory;
    private final SentimentScorer scorer;
    private final SummaryReportWriter reportWriter;
    private final PipelineConfig pipelineConfig;
    private final Clock clock;

    /**
     * Loads, scores and saves one dataset.
     *
     * @param source source settings
     * @param destination destination settings
     * @return processed dataset and run statistics
     * @throws ConfigurationException if the settings are incomplete
     * @throws PipelineFailedException if loading or saving fails
     */
    public PipelineResult run(SourceConfig source, DestinationConfig destination) {
        source.validate();
        destination.validate();

        RunContext ctx = RunContext.start(clock);
        try (MDC.MDCCloseable mdc = MDC.putCloseable(RunContext.MDC_KEY, ctx.getRunId())) {
            log.info("Pipeline started: runId={}, source={} ({}), destination={} ({})",
                    ctx.getRunId(), source.describe(), source.getKind(), destination.describe(),
                    destination.getKind());

            ctx.moveTo(PipelineState.LOADING);
            Tabular input;
            try {
                input = storeFactory.createSource(source.getKind()).load(source);
            } catch (RuntimeException e) {
                throw fail(ctx, e, null);
            }
            return scoreAndSave(ctx, input, source.getTextColumn(), destination);
        }
    }

    /**
     * Scores an in-memory dataset and optionally saves it.
     *
     * @param dataset dataset to score
     * @param textColumn column holding the text
     * @param destination destination settings, or {@code null} to skip saving
     * @return processed dataset and run statistics
     * @throws ConfigurationException if the settings are incomplete
     * @throws PipelineFailedException if the text column is missing or saving fails
     */
    public PipelineResult run(Tabular dataset, String textColumn, DestinationConfig destination) {
        if (StringUtils.isBlank(textColumn)) {
            throw new ConfigurationException("Text column is not specified");
        }
        if (destination != null) {
            destination.validate();
        }

        RunContext ctx = RunContext.start(clock);
        try (MDC.MDCCloseable mdc = MDC.putCloseable(RunContext.MDC_KEY, ctx.getRunId())) {
            log.info("Pipeline started: runId={}, source=in-memory ({} rows), destination={}",
                    ctx.getRunId(), dataset.size(),
                    destination == null ? "none" : destination.describe());

            ctx.moveTo(PipelineState.LOADING);
            try {
                dataset.requireColumn(textColumn);
            } catch (RuntimeException e) {
                throw fail(ctx, e, null);
            }
            return scoreAndSave(ctx, dataset, textColumn, destination);
        }
    }

    private PipelineResult scoreAndSave(RunContext ctx, Tabular input, String textColumn,
            DestinationConfig destination) {
        ctx.moveTo(PipelineState.SCORING);
        List<ScoreOutcome> outcomes = score(input, textColumn);
        Tabular processed = enrich(input, outcomes, ctx.processedAt());
        RunSummary summary = RunSummaryCalculator.fromOutcomes(outcomes);
        log.info("Processed {} rows: positive={}, negative={}, neutral={}, empty={}, fallback={}",
                summary.getTotalRows(), summary.count(SentimentLabel.POSITIVE),
                summary.count(SentimentLabel.NEGATIVE), summary.count(SentimentLabel.NEUTRAL),
                summary.getEmptyTextCount(), summary.getFallbackCount());

        if (destination != null) {
            ctx.moveTo(PipelineState.SAVING);
            try {
                storeFactory.createSink(destination.getKind()).save(processed, destination);
            } catch (RuntimeException e) {
                throw fail(ctx, e, processed);
            }
            if (destination.isSummary()) {
                writeReport(summary, destination);
            }
        }

        ctx.moveTo(PipelineState.DONE);
        log.info("Pipeline completed: runId={}", ctx.getRunId());
        return new PipelineResult(ctx.getRunId(), processed, summary);
    }

    private List<ScoreOutcome> score(Tabular input, String textColumn) {
        List<Object> values = input.columnValues(textColumn);
        List<String> texts = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            Object value = values.get(i);
            String text = value == null ? "" : String.valueOf(value);
            if (text.isBlank()) {
                log.warn("Row {}: column '{}' is empty; scored as neutral", i, textColumn);
            }
            texts.add(text);
        }

        int total = texts.size();
        int interval = Math.max(1, pipelineConfig.getProgressInterval());
        List<ScoreOutcome> outcomes = new ArrayList<>(total);
        for (int start = 0; start < total; start += interval) {
            int end = Math.min(start + interval, total);
            outcomes.addAll(scorer.scoreBatch(texts.subList(start, end)));
            log.info("Progress: {}/{} rows scored", end, total);
        }
        return outcomes;
    }

    private static Tabular enrich(Tabular input, List<ScoreOutcome> outcomes,
            String processedAt) {
        Tabular.Builder builder = Tabular.builder(ProcessedColumns.extend(input.getColumns()));
        for (int i = 0; i < input.size(); i++) {
            SentimentResult result = outcomes.get(i).getResult();
            Map<String, Object> row = new LinkedHashMap<>(input.getRows().get(i));
            row.put(ProcessedColumns.PROCESSED_AT, processedAt);
            row.put(ProcessedColumns.SENTIMENT, result.getLabel().value());
            row.put(ProcessedColumns.POLARITY, result.getPolarity());
            row.put(ProcessedColumns.SUBJECTIVITY, result.getSubjectivity());
            builder.addRow(row);
        }
        return builder.build();
    }

    private void writeReport(RunSummary summary, DestinationConfig destination) {
        try {
            Optional<Path> path =
                    destination.resolveSummaryPath(pipelineConfig.getSummarySuffix());
            if (path.isEmpty()) {
                log.warn("Summary report skipped: no summary path for destination {}",
                        destination.describe());
                return;
            }
            reportWriter.write(summary, path.get());
        } catch (ReportException e) {
            log.warn("Summary report could not be written: {}", e.getMessage(), e);
        }
    }

    private static PipelineFailedException fail(RunContext ctx, RuntimeException cause,
            Tabular processed) {
        PipelineState failedState = ctx.getState();
        ctx.moveTo(PipelineState.FAILED);
        log.error("Pipeline failed while {}: {}", failedState, cause.getMessage());
        return new PipelineFailedException(failedState, cause, processed);
    }
}
