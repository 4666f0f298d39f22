package io.github.yok.sentilink.core;

/**
 * States of one pipeline run.
 *
 * <pre>
 * IDLE → LOADING → SCORING → SAVING → DONE
 *   any non-terminal state → FAILED
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
public enum PipelineState {

    IDLE,

    LOADING,

    SCORING,

    SAVING,

    DONE,

    FAILED;

    /**
     * @return {@code true} for {@link #DONE} and {@link #FAILED}
     */
    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
