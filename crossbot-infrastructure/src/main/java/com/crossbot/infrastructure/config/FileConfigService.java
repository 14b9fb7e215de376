package com.crossbot.infrastructure.config;

import com.crossbot.application.config.ConfigKey;
import com.crossbot.application.ports.ConfigPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * File + environment configuration.
 *
 * Load order (low -> high priority):
 *  1) config.properties
 *  2) .env (optional)
 *  3) secrets.properties (optional)
 *  4) OS environment variables
 *
 * Any key can be overridden from the environment as CROSSBOT_ + key with dots replaced by
 * underscores, upper-cased: risk.stop_loss_pct -> CROSSBOT_RISK_STOP_LOSS_PCT.
 * Exchange credentials are also read from BINANCE_API_KEY / BINANCE_API_SECRET,
 * in files or in the environment.
 */
public final class FileConfigService implements ConfigPort {

    private static final Logger log = LoggerFactory.getLogger(FileConfigService.class);

    static final String ENV_PREFIX = "CROSSBOT_";

    private static final Map<String, String> CREDENTIAL_ALIASES = Map.of(
            "BINANCE_API_KEY", ConfigKey.API_KEY.key(),
            "BINANCE_API_SECRET", ConfigKey.API_SECRET.key()
    );

    private final Properties props = new Properties();

    private FileConfigService(Path configDir, Map<String, String> env) throws IOException {
        loadFiles(configDir);
        applyAliases(propsAsAliasSource());
        applyEnvOverrides(env);
    }

    public static FileConfigService fromDirectory(Path configDir) throws IOException {
        return fromDirectory(configDir, System.getenv());
    }

    static FileConfigService fromDirectory(Path configDir, Map<String, String> env) throws IOException {
        FileConfigService cfg = new FileConfigService(configDir, env);
        log.info("[CONFIG] loaded {} keys from {}", cfg.props.size(), configDir.toAbsolutePath());
        return cfg;
    }

    private void loadFiles(Path configDir) throws IOException {
        if (configDir == null) return;

        loadPropsIfExists(configDir.resolve("config.properties"));

        for (Map.Entry<String, String> e : DotEnv.loadIfExists(configDir.resolve(".env")).entrySet()) {
            props.setProperty(e.getKey(), e.getValue());
        }

        loadPropsIfExists(configDir.resolve("secrets.properties"));
    }

    private void loadPropsIfExists(Path file) throws IOException {
        if (!Files.isRegularFile(file)) return;
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        }
    }

    private Map<String, String> propsAsAliasSource() {
        Map<String, String> found = new HashMap<>();
        for (String alias : CREDENTIAL_ALIASES.keySet()) {
            String v = props.getProperty(alias);
            if (v != null) found.put(alias, v);
        }
        return found;
    }

    private void applyAliases(Map<String, String> source) {
        for (Map.Entry<String, String> e : CREDENTIAL_ALIASES.entrySet()) {
            String v = source.get(e.getKey());
            if (v != null && !v.isBlank()) props.setProperty(e.getValue(), v.trim());
        }
    }

    private void applyEnvOverrides(Map<String, String> env) {
        Set<String> keys = new LinkedHashSet<>(props.stringPropertyNames());
        for (ConfigKey k : ConfigKey.values()) keys.add(k.key());

        for (String key : keys) {
            String v = env.get(toEnvKey(key));
            if (v != null) props.setProperty(key, v);
        }

        applyAliases(env);
    }

    /** risk.stop_loss_pct -> CROSSBOT_RISK_STOP_LOSS_PCT */
    static String toEnvKey(String key) {
        return ENV_PREFIX + key.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
    }

    @Override
    public String get(String key) {
        return get(key, null);
    }

    @Override
    public String get(String key, String defaultValue) {
        String v = props.getProperty(key);
        return v == null ? defaultValue : v;
    }

    @Override
    public String getSecret(String key) {
        String v = props.getProperty(key);
        return v == null || v.isBlank() ? null : v.trim();
    }
}
