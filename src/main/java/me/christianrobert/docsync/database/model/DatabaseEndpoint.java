package me.christianrobert.docsync.database.model;

/**
 * The two databases a sync run connects to.
 * LOCAL is the read-only source, PRODUCTION the destination written inside one transaction.
 */
public enum DatabaseEndpoint {

    LOCAL("local"),
    PRODUCTION("production");

    private final String configPrefix;

    DatabaseEndpoint(String configPrefix) {
        this.configPrefix = configPrefix;
    }

    public String getConfigPrefix() {
        return configPrefix;
    }

    public String configKey(String suffix) {
        return configPrefix + "." + suffix;
    }

    /**
     * Resolves an endpoint from a REST path segment or job database name (case-insensitive).
     *
     * @throws IllegalArgumentException if the name matches no endpoint
     */
    public static DatabaseEndpoint fromName(String name) {
        if (name != null) {
            for (DatabaseEndpoint endpoint : values()) {
                if (endpoint.name().equalsIgnoreCase(name.trim()) || endpoint.configPrefix.equalsIgnoreCase(name.trim())) {
                    return endpoint;
                }
            }
        }
        throw new IllegalArgumentException("Unknown database endpoint: " + name);
    }
}
