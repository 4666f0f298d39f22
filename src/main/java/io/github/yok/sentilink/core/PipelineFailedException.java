package io.github.yok.sentilink.core;

import io.github.yok.sentilink.exception.ErrorKind;
import io.github.yok.sentilink.exception.SentiLinkException;
import io.github.yok.sentilink.model.Tabular;
import java.util.Optional;
import lombok.Getter;

/**
 * Thrown when a run ends in {@link PipelineState#FAILED}.
 *
 * <p>
 * Carries the state the run failed in and, for failures while saving, the processed dataset so
 * that callers can retry the write or persist it elsewhere. The {@link ErrorKind} is taken from
 * the cause.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class PipelineFailedException extends SentiLinkException {

    private static final long serialVersionUID = 1L;

    @Getter
    private final PipelineState failedState;

    private final transient Tabular processed;

    /**
     * @param failedState state the run was in when it failed
     * @param cause failure
     * @param processed processed dataset, or {@code null} if scoring had not finished
     */
    public PipelineFailedException(PipelineState failedState, Throwable cause,
            Tabular processed) {
        super(kindOf(failedState, cause),
                "Pipeline failed while " + failedState + ": " + cause.getMessage(), cause);
        this.failedState = failedState;
        this.processed = processed;
    }

    /**
     * @return processed dataset if the run failed after scoring
     */
    public Optional<Tabular> getProcessed() {
        return Optional.ofNullable(processed);
    }

    private static ErrorKind kindOf(PipelineState state, Throwable cause) {
        if (cause instanceof SentiLinkException) {
            return ((SentiLinkException) cause).getKind();
        }
        return state == PipelineState.SAVING ? ErrorKind.SINK : ErrorKind.SOURCE;
    }
}
