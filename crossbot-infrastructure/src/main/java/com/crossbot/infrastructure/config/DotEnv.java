package com.crossbot.infrastructure.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a .env file:
 * KEY=value, optionally prefixed with "export ".
 * Blank lines and lines starting with # are skipped; a value may be single- or double-quoted.
 */
public final class DotEnv {

    private DotEnv() {}

    /** Returns an empty map when the file does not exist. */
    public static Map<String, String> loadIfExists(Path file) throws IOException {
        Map<String, String> out = new LinkedHashMap<>();
        if (file == null || !Files.isRegularFile(file)) return out;

        for (String raw : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            if (line.startsWith("export ")) line = line.substring("export ".length()).trim();

            int eq = line.indexOf('=');
            if (eq <= 0) continue;

            String key = line.substring(0, eq).trim();
            out.put(key, unquote(line.substring(eq + 1).trim()));
        }
        return out;
    }

    static String unquote(String v) {
        if (v.length() >= 2) {
            char first = v.charAt(0);
            char last = v.charAt(v.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return v.substring(1, v.length() - 1);
            }
        }
        return v;
    }
}
