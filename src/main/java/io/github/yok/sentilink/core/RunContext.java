package io.github.yok.sentilink.core;

import io.github.yok.sentilink.model.ProcessedColumns;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-run state of {@link SentimentPipeline}: run id, start time and current state.
 *
 * <p>
 * Created for each call and never shared between runs.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Getter
public final class RunContext {

    /**
     * MDC key holding the run id while a run is in progress.
     */
    public static final String MDC_KEY = "runId";

    private final String runId;

    // Run start; stamped on every processed row
    private final LocalDateTime startedAt;

    private PipelineState state = PipelineState.IDLE;

    private RunContext(String runId, LocalDateTime startedAt) {
        this.runId = runId;
        this.startedAt = startedAt;
    }

    /**
     * Starts a new run.
     *
     * @param clock clock providing the start time
     * @return context in state {@link PipelineState#IDLE}
     */
    public static RunContext start(Clock clock) {
        return new RunContext(UUID.randomUUID().toString(), LocalDateTime.now(clock));
    }

    /**
     * Moves to the next state.
     *
     * @param next next state
     * @throws IllegalStateException if the run has already ended
     */
    void moveTo(PipelineState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Run " + runId + " already ended in state " + state);
        }
        log.debug("State {} -> {}", state, next);
        state = next;
    }

    /**
     * @return start time formatted for the {@code processed_at} column
     */
    public String processedAt() {
        return ProcessedColumns.PROCESSED_AT_FORMAT.format(startedAt);
    }
}
