package io.github.yok.sentilink.config;

import io.github.yok.sentilink.exception.ConfigurationException;
import java.util.Locale;

/**
 * Behavior of a relational destination when the target table already exists.
 *
 * @author Yasuharu.Okawauchi
 */
public enum ExistsPolicy {

    // Keep existing rows and add the new ones (table is created when missing)
    APPEND,

    // Drop the table and rewrite it with the new rows
    REPLACE,

    // Abort without writing anything
    FAIL;

    /**
     * Parses a policy name (case-insensitive).
     *
     * @param value one of {@code append}, {@code replace}, {@code fail}
     * @return matching policy
     * @throws ConfigurationException if the value is not a known policy
     */
    public static ExistsPolicy parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(
                    "if-exists policy is not specified (expected append, replace or fail)");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unsupported if-exists policy: '" + value
                    + "' (expected append, replace or fail)", e);
        }
    }
}
