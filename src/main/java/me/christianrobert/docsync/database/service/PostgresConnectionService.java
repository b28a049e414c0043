package me.christianrobert.docsync.database.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.docsync.database.model.ConnectionSettings;
import me.christianrobert.docsync.database.model.DatabaseEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;

@ApplicationScoped
public class PostgresConnectionService {

    private static final Logger log = LoggerFactory.getLogger(PostgresConnectionService.class);

    @Inject
    ConnectionSettingsResolver settingsResolver;

    public Map<String, Object> testConnection(DatabaseEndpoint endpoint) {
        Map<String, Object> result = new HashMap<>();
        result.put("endpoint", endpoint.name());

        try {
            log.info("Testing {} PostgreSQL database connection...", endpoint);

            ConnectionSettings settings = settingsResolver.resolve(endpoint);

            long startTime = System.currentTimeMillis();

            try (Connection connection = openConnection(settings)) {
                DatabaseMetaData metaData = connection.getMetaData();

                long connectionTime = System.currentTimeMillis() - startTime;

                result.put("status", "success");
                result.put("connected", true);
                result.put("message", "Successfully connected to " + endpoint + " database");
                result.put("connectionTimeMs", connectionTime);
                result.put("databaseProductName", metaData.getDatabaseProductName());
                result.put("databaseProductVersion", metaData.getDatabaseProductVersion());
                result.put("driverName", metaData.getDriverName());
                result.put("driverVersion", metaData.getDriverVersion());
                result.put("url", metaData.getURL());
                result.put("userName", metaData.getUserName());
                result.put("configurationSource", settings.getSource());

                log.info("{} connection test successful - Connected in {}ms", endpoint, connectionTime);
            }

        } catch (SQLException e) {
            log.error("{} connection test failed with SQL error", endpoint, e);
            result.put("status", "error");
            result.put("connected", false);
            result.put("message", "Database connection failed: " + e.getMessage());
            result.put("errorCode", e.getErrorCode());
            result.put("sqlState", e.getSQLState());
        } catch (Exception e) {
            log.error("{} connection test failed with error", endpoint, e);
            result.put("status", "error");
            result.put("connected", false);
            result.put("message", "Connection test failed: " + e.getMessage());
        }

        return result;
    }

    public Connection getConnection(DatabaseEndpoint endpoint) throws SQLException {
        return openConnection(settingsResolver.resolve(endpoint));
    }

    /**
     * Opens a connection from already resolved settings.
     * Sync jobs resolve both endpoints first and connect afterwards.
     */
    public Connection openConnection(ConnectionSettings settings) throws SQLException {
        log.debug("Creating {} database connection to: {}", settings.getEndpoint(), settings.getJdbcUrl());
        return DriverManager.getConnection(settings.getJdbcUrl(), settings.getUsername(), settings.getPassword());
    }

    public ConnectionSettings resolveSettings(DatabaseEndpoint endpoint) {
        return settingsResolver.resolve(endpoint);
    }

    public boolean isConfigured(DatabaseEndpoint endpoint) {
        return settingsResolver.isResolvable(endpoint);
    }
}
