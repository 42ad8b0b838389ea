package com.examgrader.utils;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class to load the grading service API key.
 * Priority: 1. environment variable, 2. .env file in the working directory, 3. configuration.
 */
public class ApiKeyLoader {
    private static final Logger logger = LoggerFactory.getLogger(ApiKeyLoader.class);

    public static final String ENV_VARIABLE = "TOGETHER_API_KEY";
    static final String CONFIG_PATH = "exam-grader.oracle.api-key";

    // Comments and blank lines never match
    private static final Pattern DOT_ENV_ENTRY =
        Pattern.compile("^\\s*(?:export\\s+)?([A-Za-z_][A-Za-z0-9_.]*)\\s*=\\s*(.*?)\\s*$");

    private ApiKeyLoader() {}

    /**
     * Returns the API key, or an empty string when none is configured
     */
    public static String loadApiKey(Config config) {
        return loadApiKey(config, System.getenv(ENV_VARIABLE), Paths.get(".env"));
    }

    static String loadApiKey(Config config, String environmentValue, Path dotEnv) {
        if (environmentValue != null && !environmentValue.isBlank()) {
            logger.info("Using grading service API key from environment variable");
            return environmentValue.trim();
        }
        String fromDotEnv = loadFromDotEnv(dotEnv, ENV_VARIABLE);
        if (fromDotEnv != null && !fromDotEnv.isBlank()) {
            logger.info("Using grading service API key from .env file");
            return fromDotEnv.trim();
        }
        if (config.hasPath(CONFIG_PATH)) {
            String fromConfig = config.getString(CONFIG_PATH);
            if (!fromConfig.isBlank()) {
                logger.info("Using grading service API key from configuration");
                return fromConfig.trim();
            }
        }
        logger.warn("No grading service API key found; every answer will be scored by the fallback");
        return "";
    }

    /**
     * Value of {@code keyName} in a .env file: {@code KEY=value} lines, optionally prefixed
     * with {@code export} and quoted. Returns null when the file or the key is absent.
     */
    static String loadFromDotEnv(Path envPath, String keyName) {
        if (!Files.exists(envPath)) {
            return null;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(envPath);
        } catch (IOException e) {
            logger.warn("Failed to read .env file: {}", e.getMessage());
            return null;
        }
        for (String line : lines) {
            Matcher matcher = DOT_ENV_ENTRY.matcher(line);
            if (matcher.matches() && matcher.group(1).equals(keyName)) {
                return unquote(matcher.group(2));
            }
        }
        return null;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
