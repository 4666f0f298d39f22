/**
 * SentiLink: batch pipeline that enriches CSV, JSON and database records with sentiment scores.
 *
 * <p>
 * {@link io.github.yok.sentilink.Main} is the command-line entry point;
 * {@link io.github.yok.sentilink.core.SentimentPipeline} can also be used directly as a library.
 * </p>
 */
package io.github.yok.sentilink;
