package io.github.yok.sentilink.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.sentilink.config.DestinationConfig;
import io.github.yok.sentilink.config.SourceConfig;
import io.github.yok.sentilink.config.StoreKind;
import io.github.yok.sentilink.exception.MissingColumnException;
import io.github.yok.sentilink.exception.SourceException;
import io.github.yok.sentilink.model.Tabular;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for {@link CsvDataSource} and {@link CsvDataSink}.
 */
class CsvDataSourceTest {

    @TempDir
    Path tempDir;

    private final CsvDataSource source = new CsvDataSource();
    private final CsvDataSink sink = new CsvDataSink();

    private SourceConfig config(Path file, String textColumn) {
        return SourceConfig.builder().kind(StoreKind.DELIMITED_FILE).path(file.toString())
                .textColumn(textColumn).build();
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void load_正常ケース_ヘッダ行と全行が読み込まれること() throws Exception {
        Path file = write("in.csv",
                "id,text,rating\n1,Great product!,5\n2,Terrible experience,1\n3,It's okay,3\n");

        Tabular t = source.load(config(file, "text"));

        assertEquals(List.of("id", "text", "rating"), t.getColumns());
        assertEquals(3, t.size());
        assertEquals("Great product!", t.getRows().get(0).get("text"));
        assertEquals("3", t.getRows().get(2).get("id"));
    }

    @Test
    void load_正常ケース_空セルと欠落セルはnullとなること() throws Exception {
        Path file = write("in.csv", "id,text,rating\n1,,5\n2,\"quoted, text\"\n");

        Tabular t = source.load(config(file, "text"));

        assertNull(t.getRows().get(0).get("text"));
        assertEquals("quoted, text", t.getRows().get(1).get("text"));
        assertNull(t.getRows().get(1).get("rating"));
    }

    @Test
    void load_正常ケース_区切り文字を指定して読み込めること() throws Exception {
        Path file = write("in.tsv", "id\ttext\n1\thello, world\n");
        SourceConfig config = SourceConfig.builder().kind(StoreKind.DELIMITED_FILE)
                .path(file.toString()).textColumn("text").delimiter('\t').build();

        Tabular t = source.load(config);

        assertEquals("hello, world", t.getRows().get(0).get("text"));
    }

    @Test
    void load_異常ケース_テキスト列が存在しない_MissingColumnExceptionが送出されること()
            throws Exception {
        Path file = write("reviews.csv",
                "id,review,rating,product_id,user_id\n1,Nice,5,p1,u1\n");

        MissingColumnException ex = assertThrows(MissingColumnException.class,
                () -> source.load(config(file, "text")));

        assertEquals(List.of("id", "review", "rating", "product_id", "user_id"),
                ex.getAvailableColumns());
    }

    @Test
    void load_異常ケース_ファイルが存在しない_NOT_FOUNDのSourceExceptionが送出されること() {
        Path file = tempDir.resolve("missing.csv");

        SourceException ex =
                assertThrows(SourceException.class, () -> source.load(config(file, "text")));

        assertEquals(SourceException.Reason.NOT_FOUND, ex.getReason());
        assertEquals("File not found: " + file, ex.getMessage());
    }

    @Test
    void load_異常ケース_空ファイル_FORMAT_ERRORのSourceExceptionが送出されること()
            throws Exception {
        Path file = write("empty.csv", "");

        SourceException ex =
                assertThrows(SourceException.class, () -> source.load(config(file, "text")));

        assertEquals(SourceException.Reason.FORMAT_ERROR, ex.getReason());
    }

    @Test
    void load_異常ケース_引用符が閉じていない_FORMAT_ERRORのSourceExceptionが送出されること()
            throws Exception {
        Path file = write("broken.csv", "id,text\n1,\"unterminated\n");

        SourceException ex =
                assertThrows(SourceException.class, () -> source.load(config(file, "text")));

        assertEquals(SourceException.Reason.FORMAT_ERROR, ex.getReason());
    }

    @Test
    void save_正常ケース_保存後に読み込むと行数と列が保たれること() throws Exception {
        Map<String, Object> row1 = new LinkedHashMap<>();
        row1.put("id", 1L);
        row1.put("text", "Great, \"quoted\" text");
        row1.put("polarity", 0.88);
        Map<String, Object> row2 = new LinkedHashMap<>();
        row2.put("id", 2L);
        row2.put("text", null);
        row2.put("polarity", -1.0);
        Tabular dataset = Tabular.of(List.of("id", "text", "polarity"), List.of(row1, row2));
        Path out = tempDir.resolve("nested/dir/out.csv");

        sink.save(dataset, DestinationConfig.builder().kind(StoreKind.DELIMITED_FILE)
                .path(out.toString()).build());
        Tabular reloaded = source.load(config(out, "text"));

        assertEquals(dataset.getColumns(), reloaded.getColumns());
        assertEquals(2, reloaded.size());
        assertEquals(Arrays.asList("Great, \"quoted\" text", null),
                reloaded.columnValues("text"));
        assertEquals("0.88", reloaded.getRows().get(0).get("polarity"));
    }

    @Test
    void save_正常ケース_既存ファイルは上書きされること() throws Exception {
        Path out = write("out.csv", "old,content\nx,y\nz,w\n");

        sink.save(Tabular.ofTexts(List.of("new")), DestinationConfig.builder()
                .kind(StoreKind.DELIMITED_FILE).path(out.toString()).build());

        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals(List.of("text", "new"), lines);
    }
}
