package io.github.yok.sentilink.store;

import io.github.yok.sentilink.config.DestinationConfig;
import io.github.yok.sentilink.model.Tabular;

/**
 * Persists a {@link Tabular} dataset to one kind of store.
 *
 * @author Yasuharu.Okawauchi
 */
public interface DataSink {

    /**
     * Writes the dataset.
     *
     * @param dataset dataset to write
     * @param config destination settings
     * @throws io.github.yok.sentilink.exception.SinkException if the dataset cannot be written
     */
    void save(Tabular dataset, DestinationConfig config);
}
