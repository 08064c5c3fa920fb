package com.finsight.backend.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@code KEY=value} lines from a {@code .env} file in the working directory into System properties,
 * for local runs. Keys already set as environment variables or System properties are left untouched.
 */
public final class DotenvLoader {

    private static final Logger log = LoggerFactory.getLogger(DotenvLoader.class);

    private DotenvLoader() {
    }

    public static void loadFromWorkingDirectoryIfPresent() {
        loadFrom(Path.of(".env"));
    }

    static int loadFrom(Path envPath) {
        if (!Files.isRegularFile(envPath)) {
            return 0;
        }

        try {
            List<String> lines = Files.readAllLines(envPath, StandardCharsets.UTF_8);
            int loaded = 0;

            for (String raw : lines) {
                String line = raw.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;

                int idx = line.indexOf('=');
                if (idx <= 0) continue;

                String key = line.substring(0, idx).trim();
                String value = unquote(line.substring(idx + 1).trim());
                if (key.isEmpty() || value.isEmpty()) continue;

                if (isDefined(System.getenv(key)) || isDefined(System.getProperty(key))) {
                    continue;
                }

                System.setProperty(key, value);
                loaded++;
            }

            if (loaded > 0) {
                log.info("[DotenvLoader] Loaded {} keys from {} (values hidden)", loaded, envPath.toAbsolutePath());
            }
            return loaded;
        } catch (IOException e) {
            log.warn("[DotenvLoader] Failed to read {} (ignored): {}", envPath, e.getMessage());
            return 0;
        }
    }

    private static String unquote(String value) {
        if (value.length() >= 2
                && ((value.startsWith("\"") && value.endsWith("\"")) || (value.startsWith("'") && value.endsWith("'")))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static boolean isDefined(String value) {
        return value != null && !value.isBlank();
    }
}
