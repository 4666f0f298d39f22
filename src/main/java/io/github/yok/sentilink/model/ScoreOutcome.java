package io.github.yok.sentilink.model;

import java.util.Objects;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of scoring one item of a batch together with how it was obtained.
 *
 * <p>
 * A batch never fails as a whole: an item that cannot be scored yields a {@link Status#FALLBACK}
 * outcome carrying {@link SentimentResult#EMPTY} and the failure message, so the number of
 * recovered failures stays observable.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class ScoreOutcome {

    /**
     * How the result was produced.
     */
    public enum Status {
        // Scored by the lexical model
        SCORED,
        // Text was null, empty or blank after normalization
        EMPTY,
        // Scoring failed; the empty result was substituted
        FALLBACK
    }

    private final Status status;

    private final SentimentResult result;

    // Failure message, only for FALLBACK
    @Getter(AccessLevel.NONE)
    private final String failure;

    private ScoreOutcome(Status status, SentimentResult result, String failure) {
        this.status = status;
        this.result = result;
        this.failure = failure;
    }

    /**
     * @param result result computed by the model
     * @return scored outcome
     */
    public static ScoreOutcome scored(SentimentResult result) {
        return new ScoreOutcome(Status.SCORED, Objects.requireNonNull(result, "result"), null);
    }

    /**
     * @return outcome for empty text
     */
    public static ScoreOutcome empty() {
        return new ScoreOutcome(Status.EMPTY, SentimentResult.EMPTY, null);
    }

    /**
     * @param failure description of the scoring failure
     * @return fallback outcome carrying {@link SentimentResult#EMPTY}
     */
    public static ScoreOutcome fallback(String failure) {
        return new ScoreOutcome(Status.FALLBACK, SentimentResult.EMPTY, failure);
    }

    /**
     * @return failure message if this is a fallback outcome
     */
    public Optional<String> failureMessage() {
        return Optional.ofNullable(failure);
    }

    public boolean isFallback() {
        return status == Status.FALLBACK;
    }
}
