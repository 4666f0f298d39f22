package io.github.yok.sentilink.model;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Sentiment score of one text.
 *
 * <p>
 * Instances are immutable. The label is always derived from the polarity through
 * {@link SentimentLabel#fromPolarity(double)}, so it cannot disagree with it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class SentimentResult {

    /**
     * Result used for empty text and as fallback for unscoreable text.
     */
    public static final SentimentResult EMPTY = new SentimentResult(0.0, 0.0);

    // -1 (most negative) .. +1 (most positive)
    private final double polarity;

    // 0 (objective) .. 1 (subjective)
    private final double subjectivity;

    private final SentimentLabel label;

    /**
     * Creates a result and derives its label.
     *
     * @param polarity polarity in {@code [-1, 1]}
     * @param subjectivity subjectivity in {@code [0, 1]}
     * @throws IllegalArgumentException if a value is outside its range or not a number
     */
    public SentimentResult(double polarity, double subjectivity) {
        Preconditions.checkArgument(polarity >= -1.0 && polarity <= 1.0,
                "polarity out of range: %s", polarity);
        Preconditions.checkArgument(subjectivity >= 0.0 && subjectivity <= 1.0,
                "subjectivity out of range: %s", subjectivity);
        // normalize -0.0
        this.polarity = polarity == 0.0 ? 0.0 : polarity;
        this.subjectivity = subjectivity == 0.0 ? 0.0 : subjectivity;
        this.label = SentimentLabel.fromPolarity(this.polarity);
    }
}
