package io.github.yok.sentilink;

import io.github.yok.sentilink.config.ConnectionConfig;
import io.github.yok.sentilink.config.DestinationConfig;
import io.github.yok.sentilink.config.ExistsPolicy;
import io.github.yok.sentilink.config.PipelineConfig;
import io.github.yok.sentilink.config.SourceConfig;
import io.github.yok.sentilink.config.StoreKind;
import io.github.yok.sentilink.core.PipelineResult;
import io.github.yok.sentilink.core.SentimentPipeline;
import io.github.yok.sentilink.exception.ConfigurationException;
import io.github.yok.sentilink.model.RunSummary;
import io.github.yok.sentilink.model.SentimentLabel;
import io.github.yok.sentilink.nlp.SentimentLexicon;
import io.github.yok.sentilink.nlp.SentimentScorer;
import io.github.yok.sentilink.nlp.TextPreprocessor;
import io.github.yok.sentilink.report.SummaryReportWriter;
import io.github.yok.sentilink.store.DataStoreFactory;
import io.github.yok.sentilink.util.ErrorHandler;
import java.time.Clock;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line options, builds {@link SourceConfig} and {@link DestinationConfig}, and
 * runs {@link SentimentPipeline}.
 * </p>
 *
 * <p>
 * Arguments:
 * </p>
 * <ul>
 * <li>{@code --source-type csv|json|db} (required) and {@code --source <path|connection id>}
 * (required) select the input. For {@code db} the source is a connection id declared under
 * {@code connections} in {@code application.yml}, and {@code --query <sql>} is required.</li>
 * <li>{@code --text-column <name>} names the text column (default {@code text}).</li>
 * <li>{@code --output-type csv|json|db} (defaults to the source type) and
 * {@code --output <path|connection id>} (required) select the output. For {@code db},
 * {@code --table <name>} is required and {@code --if-exists append|replace|fail} (default
 * {@code append}) decides what happens to an existing table.</li>
 * <li>{@code --no-summary} skips the statistics report; {@code --summary-path <path>} sets its
 * location explicitly.</li>
 * </ul>
 *
 * <p>
 * On success the processed record count and the label distribution are printed to standard
 * output. Fatal errors are reported through {@link ErrorHandler}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see ConnectionConfig
 * @see PipelineConfig
 * @see DataStoreFactory
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({ConnectionConfig.class, PipelineConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final ConnectionConfig connectionConfig;
    private final PipelineConfig pipelineConfig;
    private final DataStoreFactory storeFactory;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        try {
            CliOptions options = CliOptions.parse(args);
            SourceConfig source = buildSource(options);
            DestinationConfig destination = buildDestination(options, source.getKind());

            SentimentScorer scorer = new SentimentScorer(new TextPreprocessor(),
                    SentimentLexicon.fromClasspath(pipelineConfig.getLexicon()));
            SentimentPipeline pipeline = new SentimentPipeline(storeFactory, scorer,
                    new SummaryReportWriter(), pipelineConfig, Clock.systemDefaultZone());

            PipelineResult result = pipeline.run(source, destination);
            printResult(result.getSummary());
        } catch (Exception e) {
            log.error("Fatal error occurred: {}", e.getMessage(), e);
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    private SourceConfig buildSource(CliOptions options) {
        StoreKind kind = StoreKind.fromAlias(options.sourceType);
        SourceConfig.SourceConfigBuilder builder = SourceConfig.builder().kind(kind)
                .textColumn(options.textColumn).delimiter(pipelineConfig.getCsvDelimiter());
        if (kind.isFile()) {
            builder.path(options.source);
        } else {
            builder.connection(lookupConnection(options.source)).query(options.query);
        }
        return builder.build();
    }

    private DestinationConfig buildDestination(CliOptions options, StoreKind sourceKind) {
        StoreKind kind = options.outputType == null ? sourceKind
                : StoreKind.fromAlias(options.outputType);
        DestinationConfig.DestinationConfigBuilder builder = DestinationConfig.builder()
                .kind(kind).policy(ExistsPolicy.parse(options.ifExists))
                .summary(!options.noSummary).summaryPath(options.summaryPath)
                .delimiter(pipelineConfig.getCsvDelimiter());
        if (kind.isFile()) {
            builder.path(options.output);
        } else {
            builder.connection(lookupConnection(options.output)).table(options.table);
        }
        return builder.build();
    }

    private ConnectionConfig.Entry lookupConnection(String id) {
        if (id == null) {
            throw new ConfigurationException("Connection id is required for database stores");
        }
        return connectionConfig.find(id).orElseThrow(() -> new ConfigurationException(
                "Unknown connection id '" + id + "' (not declared under connections)"));
    }

    private static void printResult(RunSummary summary) {
        System.out.println("Pipeline completed successfully!");
        System.out.println("Processed " + summary.getTotalRows() + " records");
        System.out.println("Sentiment distribution:");
        for (SentimentLabel label : SentimentLabel.values()) {
            System.out.println("  " + label.value() + ": " + summary.count(label));
        }
    }

    /**
     * Parsed command-line options.
     */
    static final class CliOptions {
        String sourceType;
        String source;
        String query;
        String textColumn = "text";
        String outputType;
        String output;
        String table;
        String ifExists = "append";
        boolean noSummary;
        String summaryPath;

        static CliOptions parse(String... args) {
            CliOptions o = new CliOptions();
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--source-type":
                        o.sourceType = value(args, ++i);
                        break;
                    case "--source":
                        o.source = value(args, ++i);
                        break;
                    case "--query":
                        o.query = value(args, ++i);
                        break;
                    case "--text-column":
                        o.textColumn = value(args, ++i);
                        break;
                    case "--output-type":
                        o.outputType = value(args, ++i);
                        break;
                    case "--output":
                        o.output = value(args, ++i);
                        break;
                    case "--table":
                        o.table = value(args, ++i);
                        break;
                    case "--if-exists":
                        o.ifExists = value(args, ++i);
                        break;
                    case "--no-summary":
                        o.noSummary = true;
                        break;
                    case "--summary-path":
                        o.summaryPath = value(args, ++i);
                        break;
                    default:
                        log.warn("Unknown argument: {}", args[i]);
                }
            }
            if (o.sourceType == null) {
                throw new ConfigurationException("--source-type is required (csv, json or db)");
            }
            if (o.source == null) {
                throw new ConfigurationException("--source is required");
            }
            if (o.output == null) {
                throw new ConfigurationException("--output is required");
            }
            return o;
        }

        private static String value(String[] args, int index) {
            if (index >= args.length) {
                throw new ConfigurationException("Missing value for " + args[index - 1]);
            }
            return args[index];
        }
    }
}
