package io.github.yok.sentilink.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.sentilink.exception.MissingColumnException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * In-memory tabular dataset: an ordered list of rows sharing one ordered column set.
 *
 * <p>
 * Each row maps every column name to a value, which may be {@code null}. Row order is significant
 * and preserved by every operation. Instances are immutable; derived datasets are built through
 * {@link Builder}.
 * </p>
 *
 * <p>
 * Values loaded from files or databases are one of {@link String}, {@link Long}, {@link Double},
 * {@link java.math.BigDecimal}, {@link Boolean} or {@code null}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@EqualsAndHashCode
@ToString
public final class Tabular {

    private final ImmutableList<String> columns;

    // Unmodifiable row maps keyed in column order
    private final List<Map<String, Object>> rows;

    private Tabular(ImmutableList<String> columns, List<Map<String, Object>> rows) {
        this.columns = columns;
        this.rows = Collections.unmodifiableList(rows);
    }

    /**
     * Creates a dataset from columns and rows. Columns missing from a row map are set to
     * {@code null}.
     *
     * @param columns ordered, distinct column names
     * @param rows row maps
     * @return new dataset
     * @throws IllegalArgumentException if column names repeat or a row holds an unknown column
     */
    public static Tabular of(List<String> columns, List<? extends Map<String, ?>> rows) {
        Builder builder = builder(columns);
        for (Map<String, ?> row : rows) {
            builder.addRow(row);
        }
        return builder.build();
    }

    /**
     * Creates a single-column dataset named {@code text} from plain strings.
     *
     * @param texts text values in order
     * @return new dataset with one row per text
     */
    public static Tabular ofTexts(List<String> texts) {
        Builder builder = builder(List.of("text"));
        for (String text : texts) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("text", text);
            builder.addRow(row);
        }
        return builder.build();
    }

    /**
     * Starts a dataset with the given column set.
     *
     * @param columns ordered, distinct column names
     * @return builder
     */
    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    /**
     * @return number of rows
     */
    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * @param column column name
     * @return {@code true} if the dataset has the column
     */
    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /**
     * Verifies that a column exists.
     *
     * @param column required column name
     * @throws MissingColumnException naming the column and the available columns
     */
    public void requireColumn(String column) {
        if (!hasColumn(column)) {
            throw new MissingColumnException(column, columns);
        }
    }

    /**
     * Returns the values of one column in row order.
     *
     * @param column column name
     * @return values, possibly containing {@code null}
     * @throws MissingColumnException if the column does not exist
     */
    public List<Object> columnValues(String column) {
        requireColumn(column);
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    /**
     * Incremental builder; every added row is copied.
     */
    public static final class Builder {

        private final ImmutableList<String> columns;
        private final Set<String> columnSet;
        private final List<Map<String, Object>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            Preconditions.checkNotNull(columns, "columns must not be null");
            this.columnSet = new LinkedHashSet<>(columns);
            Preconditions.checkArgument(columnSet.size() == columns.size(),
                    "Duplicate column names: %s", columns);
            this.columns = ImmutableList.copyOf(columns);
        }

        /**
         * Appends a row.
         *
         * @param row values keyed by column name
         * @return this builder
         * @throws IllegalArgumentException if the row holds a column not in the column set
         */
        public Builder addRow(Map<String, ?> row) {
            for (String key : row.keySet()) {
                Preconditions.checkArgument(columnSet.contains(key),
                        "Unknown column '%s'; columns are %s", key, columns);
            }
            Map<String, Object> copy = new LinkedHashMap<>();
            for (String column : columns) {
                copy.put(column, row.get(column));
            }
            rows.add(Collections.unmodifiableMap(copy));
            return this;
        }

        public Tabular build() {
            return new Tabular(columns, new ArrayList<>(rows));
        }
    }
}
