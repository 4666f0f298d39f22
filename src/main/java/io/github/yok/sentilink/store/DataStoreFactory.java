package io.github.yok.sentilink.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.sentilink.config.PipelineConfig;
import io.github.yok.sentilink.config.StoreKind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Factory that selects the {@link DataSource} / {@link DataSink} implementation for a
 * {@link StoreKind}.
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@RequiredArgsConstructor
public class DataStoreFactory {

    private final PipelineConfig pipelineConfig;
    private final JdbcConnector jdbcConnector;

    // Shared by the JSON source and sink
    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Creates the loader for a store kind.
     *
     * @param kind store kind
     * @return data source
     */
    public DataSource createSource(StoreKind kind) {
        switch (kind) {
            case DELIMITED_FILE:
                return new CsvDataSource();
            case STRUCTURED_FILE:
                return new JsonDataSource(objectMapper);
            case RELATIONAL:
                return new JdbcDataSource(jdbcConnector);
            default:
                throw new IllegalArgumentException("Unsupported source kind: " + kind);
        }
    }

    /**
     * Creates the writer for a store kind.
     *
     * @param kind store kind
     * @return data sink
     */
    public DataSink createSink(StoreKind kind) {
        switch (kind) {
            case DELIMITED_FILE:
                return new CsvDataSink();
            case STRUCTURED_FILE:
                return new JsonDataSink(objectMapper);
            case RELATIONAL:
                return new JdbcDataSink(jdbcConnector, pipelineConfig);
            default:
                throw new IllegalArgumentException("Unsupported sink kind: " + kind);
        }
    }
}
