package io.github.yok.sentilink.nlp;

import io.github.yok.sentilink.model.ScoreOutcome;
import io.github.yok.sentilink.model.SentimentResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Lexicon-based sentiment scorer.
 *
 * <p>
 * The text is normalized by {@link TextPreprocessor} and split into tokens. Each token found in
 * the {@link SentimentLexicon} contributes its polarity and subjectivity:
 * </p>
 * <ul>
 * <li>an intensifier immediately before the word multiplies both values (then clamped)</li>
 * <li>a negation within the {@value #NEGATION_WINDOW} preceding tokens multiplies the polarity
 * by {@value #NEGATION_FACTOR}</li>
 * </ul>
 * <p>
 * The result is the mean over contributing words. An exclamation mark in the text multiplies a
 * non-zero polarity by {@value #EXCLAMATION_FACTOR}. Text without sentiment words scores
 * {@code 0.0 / 0.0}.
 * </p>
 *
 * <p>
 * Stateless after construction; instances can be shared.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SentimentScorer {

    static final int NEGATION_WINDOW = 3;
    static final double NEGATION_FACTOR = -0.5;
    static final double EXCLAMATION_FACTOR = 1.1;

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[\\s.,!?]+");

    private final TextPreprocessor preprocessor;
    private final SentimentLexicon lexicon;

    /**
     * @param preprocessor text normalizer
     * @param lexicon word list
     */
    public SentimentScorer(TextPreprocessor preprocessor, SentimentLexicon lexicon) {
        this.preprocessor = preprocessor;
        this.lexicon = lexicon;
    }

    /**
     * Scores one text.
     *
     * @param text raw text, may be {@code null}
     * @return sentiment result; {@link SentimentResult#EMPTY} for empty normalized text
     */
    public SentimentResult score(String text) {
        String normalized = preprocessor.normalize(text);
        if (normalized.isEmpty()) {
            return SentimentResult.EMPTY;
        }

        String[] tokens = TOKEN_SEPARATOR.split(normalized);
        double polaritySum = 0.0;
        double subjectivitySum = 0.0;
        int matched = 0;
        for (int i = 0; i < tokens.length; i++) {
            Optional<SentimentLexicon.WordEntry> entry = lexicon.lookup(tokens[i]);
            if (entry.isEmpty()) {
                continue;
            }
            double polarity = entry.get().getPolarity();
            double subjectivity = entry.get().getSubjectivity();
            if (i > 0) {
                Optional<Double> multiplier = lexicon.intensifier(tokens[i - 1]);
                if (multiplier.isPresent()) {
                    polarity = clamp(polarity * multiplier.get(), -1.0, 1.0);
                    subjectivity = clamp(subjectivity * multiplier.get(), 0.0, 1.0);
                }
            }
            if (negated(tokens, i)) {
                polarity *= NEGATION_FACTOR;
            }
            polaritySum += polarity;
            subjectivitySum += subjectivity;
            matched++;
        }
        if (matched == 0) {
            return SentimentResult.EMPTY;
        }

        double polarity = polaritySum / matched;
        if (polarity != 0.0 && normalized.indexOf('!') >= 0) {
            polarity *= EXCLAMATION_FACTOR;
        }
        return new SentimentResult(clamp(polarity, -1.0, 1.0),
                clamp(subjectivitySum / matched, 0.0, 1.0));
    }

    /**
     * Scores many texts. The result has the same length and order as the input; an item that
     * cannot be scored yields a {@link ScoreOutcome.Status#FALLBACK} outcome instead of failing
     * the batch.
     *
     * @param texts raw texts, elements may be {@code null}
     * @return one outcome per text
     */
    public List<ScoreOutcome> scoreBatch(List<String> texts) {
        if (texts.isEmpty()) {
            return Collections.emptyList();
        }
        List<ScoreOutcome> outcomes = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            String text = texts.get(i);
            if (preprocessor.normalize(text).isEmpty()) {
                outcomes.add(ScoreOutcome.empty());
                continue;
            }
            try {
                outcomes.add(ScoreOutcome.scored(score(text)));
            } catch (RuntimeException e) {
                log.warn("Scoring failed for item {}; using fallback result: {}", i,
                        e.getMessage());
                log.debug("Scoring failure detail", e);
                outcomes.add(ScoreOutcome.fallback(e.getClass().getSimpleName() + ": "
                        + e.getMessage()));
            }
        }
        return outcomes;
    }

    private boolean negated(String[] tokens, int index) {
        for (int j = Math.max(0, index - NEGATION_WINDOW); j < index; j++) {
            if (lexicon.isNegation(tokens[j])) {
                return true;
            }
        }
        return false;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
