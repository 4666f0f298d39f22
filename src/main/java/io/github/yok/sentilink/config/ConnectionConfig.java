package io.github.yok.sentilink.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that holds the named JDBC connection descriptors declared in
 * {@code application.yml}. Relational sources and destinations refer to them by {@code id}.
 *
 * <pre>
 * connections:
 *   - id: reviews
 *     url: jdbc:postgresql://localhost:5432/nlpdb
 *     user: nlpuser
 *     password: secret
 *     driverClass: org.postgresql.Driver
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties
@Data
public class ConnectionConfig {

    /**
     * List of connection entries.
     */
    private List<Entry> connections = new ArrayList<>();

    /**
     * Looks up a connection entry by its logical ID.
     *
     * @param id logical connection ID
     * @return matching entry, or empty if none is declared
     */
    public Optional<Entry> find(String id) {
        if (id == null || connections == null) {
            return Optional.empty();
        }
        return connections.stream().filter(e -> id.equals(e.getId())).findFirst();
    }

    /**
     * Inner class that holds one DB connection setting.
     */
    @Data
    public static class Entry {
        // Logical ID of the connection (e.g., "reviews")
        private String id;
        // JDBC connection URL (e.g., jdbc:postgresql://localhost:5432/nlpdb)
        private String url;
        // Database user name
        private String user;
        // Database password
        @ToString.Exclude
        private String password;
        // Fully qualified JDBC driver class name; blank relies on JDBC 4 auto-loading
        private String driverClass;
    }
}
