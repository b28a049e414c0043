package me.christianrobert.docsync.database.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.docsync.config.service.ConfigService;
import me.christianrobert.docsync.config.service.EnvFileLoader;
import me.christianrobert.docsync.database.model.ConnectionSettings;
import me.christianrobert.docsync.database.model.DatabaseEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Resolves the connection parameters of an endpoint from its own configuration source.
 *
 * <p>An explicit {@code <endpoint>.url} (with {@code .username} and {@code .password}) wins.
 * Without it the endpoint's env file ({@code <endpoint>.env-file}) is read; the file must
 * exist and contain at least one entry.
 */
@ApplicationScoped
public class ConnectionSettingsResolver {

    private static final Logger log = LoggerFactory.getLogger(ConnectionSettingsResolver.class);

    @Inject
    ConfigService configService;

    public ConnectionSettings resolve(DatabaseEndpoint endpoint) {
        if (configService.hasText(endpoint.configKey("url"))) {
            String url = configService.getConfigValueAsString(endpoint.configKey("url")).trim();
            String user = configService.getConfigValueAsString(endpoint.configKey("username"));
            String password = configService.getConfigValueAsString(endpoint.configKey("password"));

            if (user == null || user.trim().isEmpty() || password == null) {
                throw new IllegalStateException(String.format(
                        "%s connection parameters not configured: '%s' is set but username/password are missing",
                        endpoint, endpoint.configKey("url")));
            }

            log.debug("Resolved {} connection from configuration: {}", endpoint, url);
            return new ConnectionSettings(endpoint, url, user.trim(), password, "configuration");
        }

        String envFile = configService.getConfigValueAsString(endpoint.configKey("env-file"));
        if (envFile == null || envFile.trim().isEmpty()) {
            throw new IllegalStateException(String.format(
                    "%s connection parameters not configured: neither '%s' nor '%s' is set",
                    endpoint, endpoint.configKey("url"), endpoint.configKey("env-file")));
        }

        Path path = Path.of(envFile.trim());
        if (!Files.isReadable(path)) {
            throw new IllegalStateException(String.format(
                    "Could not load %s environment from %s", endpoint.getConfigPrefix(), path));
        }

        Map<String, String> env;
        try {
            env = EnvFileLoader.load(path);
        } catch (IOException e) {
            throw new IllegalStateException(String.format(
                    "Could not load %s environment from %s: %s", endpoint.getConfigPrefix(), path, e.getMessage()), e);
        }

        if (env.isEmpty()) {
            throw new IllegalStateException(String.format(
                    "Could not load %s environment from %s: file has no entries", endpoint.getConfigPrefix(), path));
        }

        ConnectionSettings settings = ConnectionSettings.fromEnv(endpoint, env, path.toString());
        log.debug("Resolved {} connection from env file: {}", endpoint, settings);
        return settings;
    }

    public boolean isResolvable(DatabaseEndpoint endpoint) {
        try {
            resolve(endpoint);
            return true;
        } catch (IllegalStateException e) {
            log.debug("{} connection is not resolvable: {}", endpoint, e.getMessage());
            return false;
        }
    }
}
