/**
 * Configuration model package for SentiLink.
 *
 * <p>
 * Holds values bound from {@code application.yml} ({@code connections}, {@code pipeline}) and the
 * per-run source and destination settings assembled by the command-line layer or by library
 * callers.
 * </p>
 *
 * <p>
 * This package holds configuration data and its validation only; execution logic is implemented in
 * {@code core} and {@code store}.
 * </p>
 */
package io.github.yok.sentilink.config;
