/**
 * Core package for SentiLink.
 *
 * <p>
 * {@link io.github.yok.sentilink.core.SentimentPipeline} sequences loading, scoring and saving of
 * one dataset and returns a {@link io.github.yok.sentilink.core.PipelineResult}.
 * </p>
 */
package io.github.yok.sentilink.core;
