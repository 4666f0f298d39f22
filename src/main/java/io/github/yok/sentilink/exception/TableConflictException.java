package io.github.yok.sentilink.exception;

import lombok.Getter;

/**
 * Thrown when the destination table already exists and the {@code fail} policy is selected. The
 * existing table is left untouched.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class TableConflictException extends SinkException {

    private static final long serialVersionUID = 1L;

    private final String table;

    /**
     * @param table destination table name
     */
    public TableConflictException(String table) {
        super("Table '" + table + "' already exists (if-exists=fail)");
        this.table = table;
    }
}
