package io.github.yok.sentilink.config;

import io.github.yok.sentilink.exception.ConfigurationException;
import io.github.yok.sentilink.exception.ReportException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Settings of the output side of one run.
 *
 * <ul>
 * <li>{@link StoreKind#DELIMITED_FILE} / {@link StoreKind#STRUCTURED_FILE}: {@code path} is
 * required; an existing file is overwritten.</li>
 * <li>{@link StoreKind#RELATIONAL}: {@code connection} and {@code table} are required;
 * {@code policy} selects what happens when the table exists.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class DestinationConfig {

    private final StoreKind kind;

    // Output file path (file kinds)
    private final String path;

    // Connection descriptor (relational kind)
    private final ConnectionConfig.Entry connection;

    // Target table (relational kind)
    private final String table;

    @Builder.Default
    private final ExistsPolicy policy = ExistsPolicy.APPEND;

    // Write the statistics report next to the output
    private final boolean summary;

    // Explicit report location; derived from path for file kinds when absent
    private final String summaryPath;

    // Field delimiter for delimited files
    @Builder.Default
    private final char delimiter = ',';

    /**
     * Checks that every setting required by {@link #kind} is present.
     *
     * @throws ConfigurationException naming the missing setting
     */
    public void validate() {
        if (kind == null) {
            throw new ConfigurationException("Output type is not specified");
        }
        if (policy == null) {
            throw new ConfigurationException("if-exists policy is not specified");
        }
        if (kind.isFile()) {
            if (StringUtils.isBlank(path)) {
                throw new ConfigurationException("Output path is required for " + kind);
            }
            return;
        }
        if (connection == null || StringUtils.isBlank(connection.getUrl())) {
            throw new ConfigurationException("Output connection (JDBC url) is required for "
                    + kind);
        }
        if (StringUtils.isBlank(table)) {
            throw new ConfigurationException(
                    "Table name is required for output connection '" + connection.getId() + "'");
        }
    }

    /**
     * Resolves where the statistics report is written.
     *
     * <p>
     * An explicit {@code summaryPath} wins. For file kinds the output extension is replaced by
     * {@code suffix} (e.g. {@code out/results.csv} becomes {@code out/results_summary.txt}).
     * Relational destinations without an explicit path have no report location.
     * </p>
     *
     * @param suffix suffix replacing the output extension
     * @return report location, or empty if none can be derived
     * @throws ReportException if the location is not a valid path
     */
    public Optional<Path> resolveSummaryPath(String suffix) {
        if (StringUtils.isNotBlank(summaryPath)) {
            return Optional.of(toPath(summaryPath));
        }
        if (kind != null && kind.isFile() && StringUtils.isNotBlank(path)) {
            return Optional.of(toPath(FilenameUtils.removeExtension(path) + suffix));
        }
        return Optional.empty();
    }

    private static Path toPath(String location) {
        try {
            return Path.of(location);
        } catch (InvalidPathException e) {
            throw new ReportException("Invalid summary report path: " + location, e);
        }
    }

    /**
     * @return short description of the destination for log messages
     */
    public String describe() {
        return kind != null && kind.isFile() ? path
                : "db:" + (connection == null ? "?" : connection.getId()) + "/" + table;
    }
}
