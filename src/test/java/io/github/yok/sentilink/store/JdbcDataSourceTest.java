package io.github.yok.sentilink.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.sentilink.config.ConnectionConfig;
import io.github.yok.sentilink.config.SourceConfig;
import io.github.yok.sentilink.config.StoreKind;
import io.github.yok.sentilink.exception.MissingColumnException;
import io.github.yok.sentilink.exception.SourceException;
import io.github.yok.sentilink.model.Tabular;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link JdbcDataSource} against an in-memory H2 database.
 */
class JdbcDataSourceTest {

    private ConnectionConfig.Entry entry;
    private final JdbcDataSource source = new JdbcDataSource(new JdbcConnector());

    @BeforeEach
    void setup() throws SQLException {
        entry = new ConnectionConfig.Entry();
        entry.setId("h2");
        entry.setUrl("jdbc:h2:mem:source_" + UUID.randomUUID().toString().replace("-", "")
                + ";DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE");
        entry.setUser("sa");
        entry.setPassword("");

        try (Connection conn = DriverManager.getConnection(entry.getUrl(), "sa", "");
                Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE reviews (id INT, review VARCHAR(200), rating INT, "
                    + "product_id VARCHAR(10), user_id VARCHAR(10), created DATE, "
                    + "payload VARBINARY(4), score DECIMAL(5,2))");
            stmt.execute("INSERT INTO reviews VALUES (1, 'Great service!', 5, 'p1', 'u1', "
                    + "DATE '2024-01-02', X'CAFE', 4.50)");
            stmt.execute("INSERT INTO reviews VALUES (2, 'Terrible experience.', 1, 'p2', "
                    + "'u2', NULL, NULL, NULL)");
        }
    }

    private SourceConfig config(String query, String textColumn) {
        return SourceConfig.builder().kind(StoreKind.RELATIONAL).connection(entry).query(query)
                .textColumn(textColumn).build();
    }

    @Test
    void load_正常ケース_クエリ結果が列ラベル順に読み込まれること() {
        Tabular t = source.load(
                config("SELECT id, review AS text, created, payload, score FROM reviews "
                        + "ORDER BY id", "text"));

        assertEquals(List.of("id", "text", "created", "payload", "score"), t.getColumns());
        assertEquals(2, t.size());
        assertEquals(1L, t.getRows().get(0).get("id"));
        assertEquals("Great service!", t.getRows().get(0).get("text"));
        assertEquals("2024-01-02", t.getRows().get(0).get("created"));
        assertEquals("CAFE", t.getRows().get(0).get("payload"));
        assertEquals(0, new java.math.BigDecimal("4.50")
                .compareTo((java.math.BigDecimal) t.getRows().get(0).get("score")));
        assertNull(t.getRows().get(1).get("created"));
    }

    @Test
    void load_異常ケース_テキスト列がない_全列名を含むMissingColumnExceptionが送出されること() {
        MissingColumnException ex = assertThrows(MissingColumnException.class,
                () -> source.load(config(
                        "SELECT id, review, rating, product_id, user_id FROM reviews", "text")));

        assertEquals(List.of("id", "review", "rating", "product_id", "user_id"),
                ex.getAvailableColumns());
    }

    @Test
    void load_異常ケース_不正なSQL_QUERY_ERRORのSourceExceptionが送出されること() {
        SourceException ex = assertThrows(SourceException.class,
                () -> source.load(config("SELECT * FROM no_such_table", "text")));

        assertEquals(SourceException.Reason.QUERY_ERROR, ex.getReason());
    }

    @Test
    void load_異常ケース_ドライバが存在しない_CONNECTION_ERRORのSourceExceptionが送出されること() {
        entry.setDriverClass("com.example.DoesNotExistDriver");

        SourceException ex = assertThrows(SourceException.class,
                () -> source.load(config("SELECT 1", "text")));

        assertEquals(SourceException.Reason.CONNECTION_ERROR, ex.getReason());
    }

    @Test
    void load_異常ケース_接続拒否_CONNECTION_ERRORのSourceExceptionが送出されること() {
        entry.setUrl("jdbc:unknown://localhost/none");

        SourceException ex = assertThrows(SourceException.class,
                () -> source.load(config("SELECT 1", "text")));

        assertEquals(SourceException.Reason.CONNECTION_ERROR, ex.getReason());
    }

    @Test
    void load_異常ケース_クエリ失敗時も接続がクローズされ読み取り専用に設定されること()
            throws Exception {
        JdbcConnector connector = mock(JdbcConnector.class);
        Connection conn = mock(Connection.class);
        when(connector.open(any())).thenReturn(conn);
        when(conn.createStatement()).thenThrow(new SQLException("statement failed"));
        JdbcDataSource mocked = new JdbcDataSource(connector);

        SourceException ex = assertThrows(SourceException.class,
                () -> mocked.load(config("SELECT 1", "text")));

        assertEquals(SourceException.Reason.QUERY_ERROR, ex.getReason());
        verify(conn).setReadOnly(true);
        verify(conn).close();
    }

    @Test
    void loadDriverIfConfigured_異常ケース_未知クラス名_ClassNotFoundExceptionが送出されること() {
        assertThrows(ClassNotFoundException.class,
                () -> JdbcConnector.loadDriverIfConfigured("com.example.DoesNotExistDriver"));
    }
}
