package io.github.yok.sentilink.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code pipeline} section in {@code application.yml}. Holds
 * tuning values shared by every run; per-run settings live in {@link SourceConfig} and
 * {@link DestinationConfig}.
 *
 * <pre>
 * pipeline:
 *   progress-interval: 100
 *   jdbc-batch-size: 500
 *   jdbc-text-type: VARCHAR(4000)
 *   csv-delimiter: ','
 *   summary-suffix: _summary.txt
 *   lexicon: lexicon/en-sentiment.csv
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "pipeline")
@Data
public class PipelineConfig {

    /**
     * Number of rows scored between two progress log lines.
     */
    private int progressInterval = 100;

    /**
     * Number of rows sent per JDBC batch when writing a table.
     */
    private int jdbcBatchSize = 500;

    /**
     * SQL type used for text and untyped columns when a destination table is created.
     */
    private String jdbcTextType = "VARCHAR(4000)";

    /**
     * Field delimiter used for delimited files on both sides.
     */
    private char csvDelimiter = ',';

    /**
     * Suffix that replaces the output file extension to name the summary report.
     */
    private String summarySuffix = "_summary.txt";

    /**
     * Classpath location of the sentiment lexicon.
     */
    private String lexicon = "lexicon/en-sentiment.csv";
}
