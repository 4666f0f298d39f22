package io.github.yok.sentilink.store;

import io.github.yok.sentilink.config.ConnectionConfig;
import io.github.yok.sentilink.config.SourceConfig;
import io.github.yok.sentilink.exception.SourceException;
import io.github.yok.sentilink.model.Tabular;
import io.github.yok.sentilink.util.JdbcValues;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads the result of a read-only query.
 *
 * <p>
 * Columns are the result set column labels in order. The connection is opened for this call only
 * and closed on every exit path.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcDataSource implements DataSource {

    private final JdbcConnector connector;

    @Override
    public Tabular read(SourceConfig config) {
        ConnectionConfig.Entry entry = config.getConnection();
        try (Connection conn = open(entry)) {
            conn.setReadOnly(true);
            try (Statement stmt = conn.createStatement();
                    ResultSet rs = stmt.executeQuery(config.getQuery())) {
                Tabular dataset = toTabular(rs);
                log.info("Loaded {} records from database: id={}", dataset.size(),
                        entry.getId());
                return dataset;
            }
        } catch (SQLException | IllegalArgumentException e) {
            throw new SourceException(SourceException.Reason.QUERY_ERROR,
                    "Query failed on connection '" + entry.getId() + "': " + e.getMessage(), e);
        }
    }

    private Connection open(ConnectionConfig.Entry entry) {
        try {
            return connector.open(entry);
        } catch (ClassNotFoundException e) {
            throw new SourceException(SourceException.Reason.CONNECTION_ERROR,
                    "JDBC driver not found for connection '" + entry.getId() + "': "
                            + e.getMessage(),
                    e);
        } catch (SQLException e) {
            throw new SourceException(SourceException.Reason.CONNECTION_ERROR,
                    "Failed to connect to '" + entry.getId() + "' (" + entry.getUrl() + "): "
                            + e.getMessage(),
                    e);
        }
    }

    private static Tabular toTabular(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int count = md.getColumnCount();
        List<String> columns = new ArrayList<>(count);
        int[] types = new int[count];
        for (int i = 1; i <= count; i++) {
            columns.add(md.getColumnLabel(i));
            types[i - 1] = md.getColumnType(i);
        }
        Tabular.Builder builder = Tabular.builder(columns);
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= count; i++) {
                row.put(columns.get(i - 1), JdbcValues.read(rs, i, types[i - 1]));
            }
            builder.addRow(row);
        }
        return builder.build();
    }
}
