package io.github.yok.sentilink.store;

import io.github.yok.sentilink.config.DestinationConfig;
import io.github.yok.sentilink.exception.SinkException;
import io.github.yok.sentilink.model.Tabular;
import io.github.yok.sentilink.util.CsvUtils;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes a dataset as a delimited UTF-8 file with a header row.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CsvDataSink implements DataSink {

    @Override
    public void save(Tabular dataset, DestinationConfig config) {
        Path file = Path.of(config.getPath());
        List<List<Object>> rows = new ArrayList<>(dataset.size());
        for (Map<String, Object> row : dataset.getRows()) {
            List<Object> cells = new ArrayList<>(dataset.getColumns().size());
            for (String column : dataset.getColumns()) {
                cells.add(row.get(column));
            }
            rows.add(cells);
        }
        try {
            CsvUtils.writeCsvUtf8(file, dataset.getColumns(), rows, config.getDelimiter());
        } catch (IOException e) {
            throw new SinkException("Failed to write CSV file: " + file, e);
        }
        log.info("Saved {} records to CSV: {}", dataset.size(), file);
    }
}
