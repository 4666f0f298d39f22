package io.github.yok.sentilink.store;

import io.github.yok.sentilink.config.SourceConfig;
import io.github.yok.sentilink.exception.SourceException;
import io.github.yok.sentilink.model.Tabular;
import io.github.yok.sentilink.util.CsvUtils;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Loads a delimited UTF-8 file whose first record is the header.
 *
 * <p>
 * Every value is loaded as a {@link String}; empty cells and cells missing from short records
 * become {@code null}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CsvDataSource implements DataSource {

    @Override
    public Tabular read(SourceConfig config) {
        Path file = Path.of(config.getPath());
        if (!Files.isRegularFile(file)) {
            throw new SourceException(SourceException.Reason.NOT_FOUND,
                    "File not found: " + file);
        }

        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser parser =
                        CSVParser.parse(reader, CsvUtils.readFormat(config.getDelimiter()))) {
            List<String> headers = parser.getHeaderNames();
            if (headers.isEmpty()) {
                throw new SourceException(SourceException.Reason.FORMAT_ERROR,
                        "No header row in file: " + file);
            }
            Tabular.Builder builder = Tabular.builder(headers);
            for (CSVRecord rec : parser) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (String h : headers) {
                    String value = rec.isSet(h) ? rec.get(h) : null;
                    row.put(h, value == null || value.isEmpty() ? null : value);
                }
                builder.addRow(row);
            }
            Tabular dataset = builder.build();
            log.info("Loaded {} records from CSV: {}", dataset.size(), file);
            return dataset;
        } catch (IOException | UncheckedIOException | IllegalArgumentException
                | IllegalStateException e) {
            throw new SourceException(SourceException.Reason.FORMAT_ERROR,
                    "Failed to parse CSV file: " + file + " (" + e.getMessage() + ")", e);
        }
    }
}
