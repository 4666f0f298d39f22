package io.github.yok.sentilink.model;

import java.util.Locale;

/**
 * Categorical sentiment derived from polarity.
 *
 * <p>
 * The label depends on the sign of the polarity only: strictly positive values map to
 * {@link #POSITIVE}, strictly negative values to {@link #NEGATIVE}, and exactly zero to
 * {@link #NEUTRAL}. Subjectivity never influences the label.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum SentimentLabel {

    POSITIVE,

    NEGATIVE,

    NEUTRAL;

    /**
     * Derives the label for the given polarity.
     *
     * @param polarity polarity in {@code [-1, 1]}
     * @return derived label
     */
    public static SentimentLabel fromPolarity(double polarity) {
        if (polarity > 0) {
            return POSITIVE;
        }
        if (polarity < 0) {
            return NEGATIVE;
        }
        return NEUTRAL;
    }

    /**
     * Returns the serialized form written to output datasets.
     *
     * @return lower-case label name
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the capitalized form used in reports.
     *
     * @return label name with only the first letter in upper case
     */
    public String displayName() {
        String lower = value();
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
