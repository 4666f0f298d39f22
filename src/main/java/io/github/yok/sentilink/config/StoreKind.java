package io.github.yok.sentilink.config;

import com.google.common.collect.ImmutableSet;
import io.github.yok.sentilink.exception.ConfigurationException;
import java.util.Arrays;
import java.util.Locale;
import lombok.Getter;

/**
 * Kinds of data stores a dataset can be loaded from or saved to.
 *
 * <p>
 * Each kind declares the CLI aliases that select it, so that the command-line layer does not need
 * to hardcode string comparisons.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum StoreKind {

    // Delimited text file (CSV)
    DELIMITED_FILE("csv"),

    // Structured document file (JSON)
    STRUCTURED_FILE("json"),

    // Relational database: a query on the source side, a table on the destination side
    RELATIONAL("db", "jdbc", "postgres", "mysql");

    // Accepted aliases (all lowercase)
    private final ImmutableSet<String> aliases;

    StoreKind(String... aliases) {
        this.aliases = ImmutableSet.copyOf(aliases);
    }

    /**
     * @return {@code true} for file-backed kinds
     */
    public boolean isFile() {
        return this != RELATIONAL;
    }

    /**
     * Resolves a kind from one of its aliases (case-insensitive).
     *
     * @param alias alias such as {@code csv} or {@code db}
     * @return matching kind
     * @throws ConfigurationException if no kind declares the alias
     */
    public static StoreKind fromAlias(String alias) {
        if (alias == null) {
            throw new ConfigurationException("Store type is not specified");
        }
        String lower = alias.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(k -> k.aliases.contains(lower)).findFirst()
                .orElseThrow(() -> new ConfigurationException("Unsupported store type: " + alias));
    }
}
