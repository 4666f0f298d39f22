package io.github.yok.sentilink.store;

import io.github.yok.sentilink.config.ConnectionConfig;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Opens JDBC connections from {@link ConnectionConfig.Entry} descriptors.
 *
 * <p>
 * When a driver class name is configured it is loaded explicitly via {@link Class#forName(String)};
 * when it is {@code null} or blank, JDBC 4 auto-loading is used. Callers own the returned
 * connection and must close it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class JdbcConnector {

    /**
     * Opens a new connection.
     *
     * @param entry connection descriptor
     * @return open connection
     * @throws ClassNotFoundException when the configured driver class cannot be found
     * @throws SQLException when the connection cannot be established
     */
    public Connection open(ConnectionConfig.Entry entry)
            throws ClassNotFoundException, SQLException {
        loadDriverIfConfigured(entry.getDriverClass());
        log.debug("Opening connection: id={}, url={}", entry.getId(), entry.getUrl());
        return DriverManager.getConnection(entry.getUrl(), entry.getUser(), entry.getPassword());
    }

    /**
     * Loads the JDBC driver class only when the class name is configured.
     *
     * @param driverClass fully qualified JDBC driver class name, or {@code null}/blank
     * @throws ClassNotFoundException when the specified class cannot be found
     */
    static void loadDriverIfConfigured(String driverClass) throws ClassNotFoundException {
        if (driverClass == null || driverClass.isBlank()) {
            return;
        }
        Class.forName(driverClass);
    }
}
