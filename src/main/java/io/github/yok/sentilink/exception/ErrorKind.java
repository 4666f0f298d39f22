package io.github.yok.sentilink.exception;

/**
 * Categories of failures raised by the pipeline.
 *
 * <p>
 * {@link #CONFIGURATION}, {@link #SOURCE} and {@link #SINK} are fatal to a run. {@link #ROW} and
 * {@link #REPORT} are recovered locally and only logged as warnings.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum ErrorKind {

    // Invalid or incomplete configuration (column, path, table, policy)
    CONFIGURATION,

    // Failure while loading the input dataset
    SOURCE,

    // Failure while scoring a single row
    ROW,

    // Failure while persisting the processed dataset
    SINK,

    // Failure while generating the statistics report
    REPORT
}
