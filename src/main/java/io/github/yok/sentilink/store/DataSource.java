package io.github.yok.sentilink.store;

import io.github.yok.sentilink.config.SourceConfig;
import io.github.yok.sentilink.model.Tabular;

/**
 * Loads a {@link Tabular} dataset from one kind of store.
 *
 * <p>
 * Implementations are selected by {@link DataStoreFactory} from
 * {@link io.github.yok.sentilink.config.StoreKind}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DataSource {

    /**
     * Reads the whole dataset without checking the text column.
     *
     * @param config source settings
     * @return loaded dataset
     * @throws io.github.yok.sentilink.exception.SourceException if the store cannot be read
     */
    Tabular read(SourceConfig config);

    /**
     * Reads the dataset and verifies that the configured text column exists.
     *
     * @param config source settings
     * @return loaded dataset containing {@link SourceConfig#getTextColumn()}
     * @throws io.github.yok.sentilink.exception.SourceException if the store cannot be read
     * @throws io.github.yok.sentilink.exception.MissingColumnException if the text column is
     *         absent
     */
    default Tabular load(SourceConfig config) {
        Tabular dataset = read(config);
        dataset.requireColumn(config.getTextColumn());
        return dataset;
    }
}
