package io.github.yok.sentilink.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.sentilink.exception.ConfigurationException;
import io.github.yok.sentilink.exception.ReportException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link DestinationConfig}, {@link SourceConfig} and {@link ConnectionConfig}.
 */
class DestinationConfigTest {

    private static ConnectionConfig.Entry entry(String id) {
        ConnectionConfig.Entry entry = new ConnectionConfig.Entry();
        entry.setId(id);
        entry.setUrl("jdbc:h2:mem:" + id);
        return entry;
    }

    @Test
    void resolveSummaryPath_正常ケース_拡張子がサフィックスに置換されること() {
        DestinationConfig config = DestinationConfig.builder().kind(StoreKind.DELIMITED_FILE)
                .path("out/results.csv").summary(true).build();

        assertEquals(Path.of("out/results_summary.txt"),
                config.resolveSummaryPath("_summary.txt").orElseThrow());
    }

    @Test
    void resolveSummaryPath_正常ケース_明示パスが優先されること() {
        DestinationConfig config = DestinationConfig.builder().kind(StoreKind.RELATIONAL)
                .connection(entry("db1")).table("t").summaryPath("reports/s.txt").build();

        assertEquals(Path.of("reports/s.txt"),
                config.resolveSummaryPath("_summary.txt").orElseThrow());
    }

    @Test
    void resolveSummaryPath_正常ケース_DB出力で明示パスなしは空となること() {
        DestinationConfig config = DestinationConfig.builder().kind(StoreKind.RELATIONAL)
                .connection(entry("db1")).table("t").build();

        assertTrue(config.resolveSummaryPath("_summary.txt").isEmpty());
    }

    @Test
    void resolveSummaryPath_異常ケース_不正なパス_ReportExceptionが送出されること() {
        DestinationConfig config = DestinationConfig.builder().kind(StoreKind.DELIMITED_FILE)
                .path("out/results.csv").summaryPath("reports/s\u0000.txt").build();

        ReportException ex = assertThrows(ReportException.class,
                () -> config.resolveSummaryPath("_summary.txt"));
        assertTrue(ex.getMessage().contains("Invalid summary report path"));
        assertTrue(ex.getCause() instanceof InvalidPathException);
    }

    @Test
    void validate_異常ケース_DB出力でテーブル名なし_ConfigurationExceptionが送出されること() {
        DestinationConfig config = DestinationConfig.builder().kind(StoreKind.RELATIONAL)
                .connection(entry("db1")).build();

        ConfigurationException ex = assertThrows(ConfigurationException.class, config::validate);
        assertTrue(ex.getMessage().contains("db1"));
    }

    @Test
    void validate_異常ケース_ファイル出力でパスなし_ConfigurationExceptionが送出されること() {
        DestinationConfig config =
                DestinationConfig.builder().kind(StoreKind.STRUCTURED_FILE).build();
        assertThrows(ConfigurationException.class, config::validate);
    }

    @Test
    void validate_正常ケース_既定ポリシーはAPPENDであること() {
        DestinationConfig config = DestinationConfig.builder().kind(StoreKind.RELATIONAL)
                .connection(entry("db1")).table("t").build();

        assertDoesNotThrow(config::validate);
        assertEquals(ExistsPolicy.APPEND, config.getPolicy());
    }

    @Test
    void validate_異常ケース_DB入力でクエリなし_ConfigurationExceptionが送出されること() {
        SourceConfig config = SourceConfig.builder().kind(StoreKind.RELATIONAL)
                .connection(entry("src")).textColumn("text").build();

        ConfigurationException ex = assertThrows(ConfigurationException.class, config::validate);
        assertTrue(ex.getMessage().contains("src"));
    }

    @Test
    void validate_異常ケース_テキスト列未指定_ConfigurationExceptionが送出されること() {
        SourceConfig config =
                SourceConfig.builder().kind(StoreKind.DELIMITED_FILE).path("in.csv").build();
        assertThrows(ConfigurationException.class, config::validate);
    }

    @Test
    void find_正常ケース_IDで接続設定が検索されること() {
        ConnectionConfig connections = new ConnectionConfig();
        connections.setConnections(List.of(entry("a"), entry("b")));

        assertEquals("jdbc:h2:mem:b", connections.find("b").orElseThrow().getUrl());
        assertTrue(connections.find("c").isEmpty());
        assertTrue(connections.find(null).isEmpty());
    }

    @Test
    void toString_正常ケース_パスワードが出力されないこと() {
        ConnectionConfig.Entry e = entry("a");
        e.setPassword("secret");
        assertTrue(!e.toString().contains("secret"));
    }
}
