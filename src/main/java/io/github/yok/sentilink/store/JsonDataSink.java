package io.github.yok.sentilink.store;

import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.sentilink.config.DestinationConfig;
import io.github.yok.sentilink.exception.SinkException;
import io.github.yok.sentilink.model.Tabular;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes a dataset as a pretty-printed JSON array of records with a two-space indent.
 * {@code null} values are kept.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JsonDataSink implements DataSink {

    private final ObjectMapper mapper;

    public JsonDataSink(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void save(Tabular dataset, DestinationConfig config) {
        Path file = Path.of(config.getPath());
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writer(prettyPrinter()).writeValue(file.toFile(), dataset.getRows());
        } catch (IOException e) {
            throw new SinkException("Failed to write JSON file: " + file, e);
        }
        log.info("Saved {} records to JSON: {}", dataset.size(), file);
    }

    // One record per block, two-space indent for arrays and objects
    private static DefaultPrettyPrinter prettyPrinter() {
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter();
        printer.indentArraysWith(DefaultIndenter.SYSTEM_LINEFEED_INSTANCE);
        return printer;
    }
}
