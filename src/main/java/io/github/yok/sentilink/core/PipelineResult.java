package io.github.yok.sentilink.core;

import io.github.yok.sentilink.model.RunSummary;
import io.github.yok.sentilink.model.Tabular;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of a successful pipeline run.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
public class PipelineResult {

    private final String runId;

    // Input rows with the processed columns
    private final Tabular processed;

    private final RunSummary summary;
}
