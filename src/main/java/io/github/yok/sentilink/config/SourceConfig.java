package io.github.yok.sentilink.config;

import io.github.yok.sentilink.exception.ConfigurationException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Settings of the input side of one run.
 *
 * <ul>
 * <li>{@link StoreKind#DELIMITED_FILE} / {@link StoreKind#STRUCTURED_FILE}: {@code path} is
 * required.</li>
 * <li>{@link StoreKind#RELATIONAL}: {@code connection} and {@code query} are required.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class SourceConfig {

    private final StoreKind kind;

    // Input file path (file kinds)
    private final String path;

    // Connection descriptor (relational kind)
    private final ConnectionConfig.Entry connection;

    // Read-only query (relational kind)
    private final String query;

    // Column holding the text to score
    private final String textColumn;

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
            throw new ConfigurationException("Source type is not specified");
        }
        if (StringUtils.isBlank(textColumn)) {
            throw new ConfigurationException("Text column is not specified");
        }
        if (kind.isFile()) {
            if (StringUtils.isBlank(path)) {
                throw new ConfigurationException("Source path is required for " + kind);
            }
            return;
        }
        if (connection == null || StringUtils.isBlank(connection.getUrl())) {
            throw new ConfigurationException("Source connection (JDBC url) is required for "
                    + kind);
        }
        if (StringUtils.isBlank(query)) {
            throw new ConfigurationException(
                    "Source query is required for connection '" + connection.getId() + "'");
        }
    }

    /**
     * @return short description of the source for log messages
     */
    public String describe() {
        return kind != null && kind.isFile() ? path
                : "db:" + (connection == null ? "?" : connection.getId());
    }
}
