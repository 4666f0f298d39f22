/**
 * Text normalization and lexicon-based sentiment scoring.
 *
 * <p>
 * {@link io.github.yok.sentilink.nlp.SentimentScorer} is the entry point;
 * {@link io.github.yok.sentilink.nlp.SentimentLexicon} holds the word list it consults.
 * </p>
 */
package io.github.yok.sentilink.nlp;
