package io.github.yok.sentilink.exception;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;

/**
 * Thrown when the configured text column does not exist in the loaded dataset.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class MissingColumnException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    // Column requested by the configuration
    private final String requestedColumn;

    // Columns actually present in the dataset, in dataset order
    private final ImmutableList<String> availableColumns;

    /**
     * @param requestedColumn column requested by the configuration
     * @param availableColumns columns present in the dataset
     */
    public MissingColumnException(String requestedColumn, List<String> availableColumns) {
        super("Column '" + requestedColumn + "' not found. Available: " + availableColumns);
        this.requestedColumn = requestedColumn;
        this.availableColumns = ImmutableList.copyOf(availableColumns);
    }
}
