package io.github.yok.sentilink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mockConstruction;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.sentilink.config.ConnectionConfig;
import io.github.yok.sentilink.config.DestinationConfig;
import io.github.yok.sentilink.config.ExistsPolicy;
import io.github.yok.sentilink.config.PipelineConfig;
import io.github.yok.sentilink.config.SourceConfig;
import io.github.yok.sentilink.config.StoreKind;
import io.github.yok.sentilink.core.PipelineResult;
import io.github.yok.sentilink.core.SentimentPipeline;
import io.github.yok.sentilink.exception.ConfigurationException;
import io.github.yok.sentilink.exception.SourceException;
import io.github.yok.sentilink.model.Tabular;
import io.github.yok.sentilink.report.RunSummaryCalculator;
import io.github.yok.sentilink.store.DataStoreFactory;
import io.github.yok.sentilink.store.JdbcConnector;
import io.github.yok.sentilink.util.ErrorHandler;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.MockedConstruction;
import org.mockito.MockedStatic;
import org.springframework.boot.SpringApplication;

/**
 * Unit tests for {@link Main}.
 */
class MainTest {

    @TempDir
    Path tempDir;

    private ConnectionConfig connectionConfig;
    private PipelineConfig pipelineConfig;
    private Main main;

    @BeforeEach
    void setup() {
        connectionConfig = new ConnectionConfig();
        ConnectionConfig.Entry entry = new ConnectionConfig.Entry();
        entry.setId("reviews");
        entry.setUrl("jdbc:h2:mem:main");
        entry.setUser("sa");
        connectionConfig.setConnections(List.of(entry));
        pipelineConfig = new PipelineConfig();
        main = new Main(connectionConfig, pipelineConfig,
                new DataStoreFactory(pipelineConfig, new JdbcConnector()));
    }

    @Test
    void main_正常ケース_SpringApplicationが起動されること() {
        try (MockedConstruction<SpringApplication> mocked =
                mockConstruction(SpringApplication.class, (mock, ctx) -> {
                    // run(String...) をスタブ
                    when(mock.run(any(String[].class))).thenReturn(null);

                    // コンストラクタ引数を検証
                    Class<?>[] sources = (Class<?>[]) ctx.arguments().get(0);
                    assertEquals(1, sources.length);
                    assertEquals(Main.class, sources[0]);
                })) {

            Main.main(new String[] {"--source-type", "csv"});

            SpringApplication app = mocked.constructed().get(0);
            verify(app).setAddCommandLineProperties(false);
            verify(app).run(eq("--source-type"), eq("csv"));
        }
    }

    @Test
    void run_正常ケース_CSV入力から結果とサマリが出力されること() throws Exception {
        Path input = tempDir.resolve("reviews.csv");
        Files.writeString(input, "id,review\n1,Great service!\n2,Terrible experience.\n",
                StandardCharsets.UTF_8);
        Path output = tempDir.resolve("results.csv");

        main.run("--source-type", "csv", "--source", input.toString(), "--text-column",
                "review", "--output", output.toString());

        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertEquals(3, lines.size());
        assertTrue(lines.get(0).startsWith("id,review,processed_at,sentiment"));
        assertTrue(lines.get(1).contains(",positive,"));
        assertTrue(Files.exists(tempDir.resolve("results_summary.txt")));
    }

    @Test
    void run_正常ケース_DB指定時に接続IDから設定が組み立てられること() {
        try (MockedConstruction<SentimentPipeline> mocked =
                mockConstruction(SentimentPipeline.class, (mock, ctx) -> when(
                        mock.run(any(SourceConfig.class), any(DestinationConfig.class)))
                                .thenReturn(new PipelineResult("run-1",
                                        Tabular.ofTexts(List.of()),
                                        RunSummaryCalculator.fromOutcomes(List.of()))))) {

            main.run("--source-type", "db", "--source", "reviews", "--query",
                    "SELECT * FROM reviews", "--output", "reviews", "--table", "scored",
                    "--if-exists", "replace", "--summary-path", "out/s.txt");

            ArgumentCaptor<SourceConfig> source = ArgumentCaptor.forClass(SourceConfig.class);
            ArgumentCaptor<DestinationConfig> dest =
                    ArgumentCaptor.forClass(DestinationConfig.class);
            verify(mocked.constructed().get(0)).run(source.capture(), dest.capture());

            assertEquals(StoreKind.RELATIONAL, source.getValue().getKind());
            assertEquals("jdbc:h2:mem:main", source.getValue().getConnection().getUrl());
            assertEquals("SELECT * FROM reviews", source.getValue().getQuery());
            assertEquals("text", source.getValue().getTextColumn());
            assertEquals(StoreKind.RELATIONAL, dest.getValue().getKind());
            assertEquals("scored", dest.getValue().getTable());
            assertEquals(ExistsPolicy.REPLACE, dest.getValue().getPolicy());
            assertTrue(dest.getValue().isSummary());
            assertEquals("out/s.txt", dest.getValue().getSummaryPath());
        }
    }

    @Test
    void run_異常ケース_未定義の接続ID_ErrorHandlerが呼ばれること() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            mocked.when(() -> ErrorHandler.errorAndExit(anyString(), any())).thenAnswer(inv -> {
                throw new IllegalStateException("exit");
            });

            assertThrows(IllegalStateException.class,
                    () -> main.run("--source-type", "db", "--source", "unknown", "--query",
                            "SELECT 1", "--output", "reviews", "--table", "t"));

            mocked.verify(() -> ErrorHandler.errorAndExit(
                    eq("Fatal error: Unknown connection id 'unknown' (not declared under "
                            + "connections)"),
                    any(ConfigurationException.class)));
        }
    }

    @Test
    void run_異常ケース_必須引数なし_ErrorHandlerが呼ばれること() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            main.run("--source", "in.csv");

            mocked.verify(() -> ErrorHandler.errorAndExit(
                    eq("Fatal error: --source-type is required (csv, json or db)"),
                    any(ConfigurationException.class)));
        }
    }

    @Test
    void run_異常ケース_入力ファイルなし_パイプライン失敗がErrorHandlerに渡されること() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            main.run("--source-type", "csv", "--source",
                    tempDir.resolve("none.csv").toString(), "--output",
                    tempDir.resolve("o.csv").toString());

            mocked.verify(() -> ErrorHandler.errorAndExit(anyString(),
                    argThat(
                            e -> e.getCause() instanceof SourceException)));
        }
        assertFalse(Files.exists(tempDir.resolve("o.csv")));
    }

    @Test
    void run_異常ケース_不正なポリシー_ErrorHandlerが呼ばれること() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            main.run("--source-type", "json", "--source", "in.json", "--output", "out.json",
                    "--if-exists", "merge");

            mocked.verify(() -> ErrorHandler.errorAndExit(anyString(),
                    any(ConfigurationException.class)));
        }
    }
}
