package io.github.yok.sentilink.store;

import io.github.yok.sentilink.config.ConnectionConfig;
import io.github.yok.sentilink.config.DestinationConfig;
import io.github.yok.sentilink.config.ExistsPolicy;
import io.github.yok.sentilink.config.PipelineConfig;
import io.github.yok.sentilink.exception.SinkException;
import io.github.yok.sentilink.exception.TableConflictException;
import io.github.yok.sentilink.model.Tabular;
import io.github.yok.sentilink.util.JdbcValues;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes a dataset into a database table.
 *
 * <p>
 * Behavior by {@link ExistsPolicy} when the table already exists:
 * </p>
 * <ul>
 * <li>{@code APPEND}: rows are added to the existing table.</li>
 * <li>{@code REPLACE}: the table is dropped, recreated and filled.</li>
 * <li>{@code FAIL}: {@link TableConflictException} is thrown before anything is written.</li>
 * </ul>
 * <p>
 * A missing table is created in every mode. Column types are inferred from the non-null values
 * of each column. When rows are appended to an existing table, values are bound with the
 * column types the table declares, so ISO timestamps and numeric strings reach typed columns as
 * timestamps and numbers. DDL and inserts run in one transaction that is rolled back on failure;
 * on databases that auto-commit DDL (e.g. MySQL) a failed {@code REPLACE} can leave the table
 * recreated but empty.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcDataSink implements DataSink {

    private final JdbcConnector connector;
    private final PipelineConfig pipelineConfig;

    @Override
    public void save(Tabular dataset, DestinationConfig config) {
        ConnectionConfig.Entry entry = config.getConnection();
        String table = config.getTable();
        if (dataset.getColumns().isEmpty()) {
            throw new SinkException("Cannot write a dataset without columns to table '" + table
                    + "'");
        }

        try (Connection conn = connector.open(entry)) {
            Optional<String> existing = findTable(conn, table);
            if (existing.isPresent() && config.getPolicy() == ExistsPolicy.FAIL) {
                throw new TableConflictException(table);
            }
            String quote = quoteString(conn.getMetaData());
            String target = quote(existing.orElse(table), quote);

            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                boolean create = existing.isEmpty();
                if (existing.isPresent() && config.getPolicy() == ExistsPolicy.REPLACE) {
                    execute(conn, "DROP TABLE " + target);
                    log.info("Dropped table: {}", target);
                    create = true;
                }
                List<String> sqlTypes = inferSqlTypes(dataset);
                if (create) {
                    execute(conn, createTableSql(target, dataset.getColumns(), sqlTypes, quote));
                    log.info("Created table: {}", target);
                }
                int[] jdbcTypes = create
                        ? sqlTypes.stream().mapToInt(JdbcValues::jdbcTypeOf).toArray()
                        : columnTypes(conn, existing.get(), dataset.getColumns(), sqlTypes);
                int inserted = insertRows(conn, target, dataset, jdbcTypes, quote);
                conn.commit();
                log.info("Saved {} records to table {} (connection={}, policy={})", inserted,
                        target, entry.getId(), config.getPolicy());
            } catch (SQLException | RuntimeException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackError) {
                    e.addSuppressed(rollbackError);
                }
                throw e;
            } finally {
                restoreAutoCommit(conn, autoCommit);
            }
        } catch (ClassNotFoundException e) {
            throw new SinkException("JDBC driver not found for connection '" + entry.getId()
                    + "': " + e.getMessage(), e);
        } catch (SQLException e) {
            throw new SinkException("Failed to write table '" + table + "' on connection '"
                    + entry.getId() + "': " + e.getMessage(), e);
        }
    }

    /**
     * Looks up a table by name, ignoring case, in the connection's current catalog and schema.
     *
     * @param conn JDBC connection
     * @param table table name
     * @return table name as stored in the database, if the table exists
     * @throws SQLException on metadata access error
     */
    Optional<String> findTable(Connection conn, String table) throws SQLException {
        DatabaseMetaData meta = conn.getMetaData();
        try (ResultSet rs = meta.getTables(conn.getCatalog(), conn.getSchema(), "%", null)) {
            while (rs.next()) {
                String name = rs.getString("TABLE_NAME");
                if (table.equalsIgnoreCase(name)) {
                    return Optional.of(name);
                }
            }
        }
        return Optional.empty();
    }

    private List<String> inferSqlTypes(Tabular dataset) {
        String textType = pipelineConfig.getJdbcTextType();
        List<String> types = new ArrayList<>(dataset.getColumns().size());
        for (String column : dataset.getColumns()) {
            String type = null;
            for (Map<String, Object> row : dataset.getRows()) {
                Object value = row.get(column);
                if (value != null) {
                    type = widen(type, JdbcValues.sqlTypeFor(value, textType), textType);
                }
            }
            types.add(type == null ? textType : type);
        }
        return types;
    }

    // Mixed integral and decimal values become decimal; any other mix falls back to text
    private static String widen(String current, String next, String textType) {
        if (current == null || current.equals(next)) {
            return next;
        }
        if (isNumeric(current) && isNumeric(next)) {
            return JdbcValues.DECIMAL_TYPE;
        }
        return textType;
    }

    private static boolean isNumeric(String sqlType) {
        return JdbcValues.INTEGRAL_TYPE.equals(sqlType) || JdbcValues.DECIMAL_TYPE.equals(sqlType);
    }

    private static String createTableSql(String target, List<String> columns,
            List<String> sqlTypes, String quote) {
        List<String> defs = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            defs.add(quote(columns.get(i), quote) + " " + sqlTypes.get(i));
        }
        return "CREATE TABLE " + target + " (" + String.join(", ", defs) + ")";
    }

    /**
     * Reads the JDBC types of an existing table's columns, in dataset column order.
     *
     * <p>
     * Columns the table does not declare keep the type inferred from the data; the insert then
     * fails on the database side with its own message.
     * </p>
     *
     * @param conn JDBC connection
     * @param table table name as stored in the database
     * @param columns dataset columns
     * @param inferred inferred SQL types, used for undeclared columns
     * @return {@link java.sql.Types} code per dataset column
     * @throws SQLException on metadata access error
     */
    int[] columnTypes(Connection conn, String table, List<String> columns,
            List<String> inferred) throws SQLException {
        Map<String, Integer> declared = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        DatabaseMetaData meta = conn.getMetaData();
        try (ResultSet rs = meta.getColumns(conn.getCatalog(), conn.getSchema(), table, null)) {
            while (rs.next()) {
                // the name is a LIKE pattern; skip tables matched through '_' or '%'
                if (!table.equals(rs.getString("TABLE_NAME"))) {
                    continue;
                }
                declared.putIfAbsent(rs.getString("COLUMN_NAME"), rs.getInt("DATA_TYPE"));
            }
        }
        int[] types = new int[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            Integer type = declared.get(columns.get(i));
            types[i] = type != null ? type : JdbcValues.jdbcTypeOf(inferred.get(i));
        }
        log.debug("Target column types of {}: {}", table, declared);
        return types;
    }

    private int insertRows(Connection conn, String target, Tabular dataset, int[] jdbcTypes,
            String quote) throws SQLException {
        List<String> columns = dataset.getColumns();
        String sql = "INSERT INTO " + target + " ("
                + columns.stream().map(c -> quote(c, quote)).collect(Collectors.joining(", "))
                + ") VALUES ("
                + columns.stream().map(c -> "?").collect(Collectors.joining(", ")) + ")";
        int batchSize = Math.max(1, pipelineConfig.getJdbcBatchSize());

        int pending = 0;
        int inserted = 0;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (Map<String, Object> row : dataset.getRows()) {
                for (int i = 0; i < columns.size(); i++) {
                    JdbcValues.bind(ps, i + 1, row.get(columns.get(i)), jdbcTypes[i]);
                }
                ps.addBatch();
                pending++;
                if (pending == batchSize) {
                    ps.executeBatch();
                    inserted += pending;
                    pending = 0;
                    log.debug("Inserted {} rows into {}", inserted, target);
                }
            }
            if (pending > 0) {
                ps.executeBatch();
                inserted += pending;
            }
        }
        return inserted;
    }

    private static void execute(Connection conn, String sql) throws SQLException {
        log.debug("Executing: {}", sql);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }

    private static String quoteString(DatabaseMetaData meta) throws SQLException {
        String quote = meta.getIdentifierQuoteString();
        return quote == null || quote.isBlank() ? "" : quote;
    }

    private static String quote(String identifier, String quote) {
        if (quote.isEmpty()) {
            return identifier;
        }
        return quote + identifier.replace(quote, quote + quote) + quote;
    }

    private static void restoreAutoCommit(Connection conn, boolean autoCommit) {
        try {
            conn.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            log.warn("Failed to restore auto-commit: {}", e.getMessage());
        }
    }
}
