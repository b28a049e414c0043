package me.christianrobert.docsync.database.model;

import java.util.Map;

/**
 * Resolved connection parameters for one endpoint.
 * This is a pure data model without dependencies on other services.
 */
public class ConnectionSettings {

    static final String DEFAULT_USER = "postgres";
    static final String DEFAULT_PASSWORD = "postgres";
    static final String DEFAULT_HOST = "localhost";
    static final String DEFAULT_PORT = "5432";
    static final String DEFAULT_DATABASE = "ccdr-explorer-db";

    private final DatabaseEndpoint endpoint;
    private final String jdbcUrl;
    private final String username;
    private final String password;
    private final String source;

    public ConnectionSettings(DatabaseEndpoint endpoint, String jdbcUrl, String username, String password, String source) {
        this.endpoint = endpoint;
        this.jdbcUrl = jdbcUrl;
        this.username = username;
        this.password = password;
        this.source = source;
    }

    /**
     * Builds settings from POSTGRES_* entries of an env file.
     * Missing entries fall back to the local development defaults.
     */
    public static ConnectionSettings fromEnv(DatabaseEndpoint endpoint, Map<String, String> env, String source) {
        String user = env.getOrDefault("POSTGRES_USER", DEFAULT_USER);
        String password = env.getOrDefault("POSTGRES_PASSWORD", DEFAULT_PASSWORD);
        String host = env.getOrDefault("POSTGRES_HOST", DEFAULT_HOST);
        String port = env.getOrDefault("POSTGRES_PORT", DEFAULT_PORT);
        String database = env.getOrDefault("POSTGRES_DB", DEFAULT_DATABASE);

        String url = String.format("jdbc:postgresql://%s:%s/%s", host, port, database);
        return new ConnectionSettings(endpoint, url, user, password, source);
    }

    public DatabaseEndpoint getEndpoint() {
        return endpoint;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    /**
     * @return where the settings came from (env file path or "configuration")
     */
    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return "ConnectionSettings{" +
                "endpoint=" + endpoint +
                ", url='" + jdbcUrl + '\'' +
                ", username='" + username + '\'' +
                ", source='" + source + '\'' +
                '}';
    }
}
