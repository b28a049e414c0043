package me.christianrobert.docsync.config.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads dotenv-style files ({@code KEY=VALUE} per line).
 *
 * <p>Supported syntax: {@code #} comment lines, blank lines, an optional {@code export } prefix
 * and values wrapped in single or double quotes. Later keys override earlier ones.
 */
public final class EnvFileLoader {

    private static final Logger log = LoggerFactory.getLogger(EnvFileLoader.class);

    private EnvFileLoader() {
    }

    /**
     * Loads the given env file.
     *
     * @param file the file to read
     * @return the parsed entries in file order
     * @throws IOException if the file cannot be read
     */
    public static Map<String, String> load(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        Map<String, String> values = parse(lines);
        log.debug("Loaded {} entries from {}", values.size(), file);
        return values;
    }

    static Map<String, String> parse(List<String> lines) {
        Map<String, String> values = new LinkedHashMap<>();

        for (String rawLine : lines) {
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith("export ")) {
                line = line.substring("export ".length()).trim();
            }

            int separator = line.indexOf('=');
            if (separator <= 0) {
                log.debug("Ignoring malformed env line: {}", rawLine);
                continue;
            }

            String key = line.substring(0, separator).trim();
            String value = unquote(line.substring(separator + 1).trim());
            values.put(key, value);
        }

        return values;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        // Strip trailing inline comments on unquoted values
        int comment = value.indexOf(" #");
        if (comment >= 0) {
            return value.substring(0, comment).trim();
        }
        return value;
    }
}
