package com.crosswatch.infrastructure.config;

import com.crosswatch.application.config.ConfigKey;
import com.crosswatch.application.ports.ConfigPort;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * File + env configuration.
 *
 * Load order (low -> high priority):
 *  1) config.properties
 *  2) .env (optional)
 *  3) secrets.properties (optional)
 *  4) OS environment variables (highest priority)
 *
 * Environment overrides work two ways: CROSSWATCH_* mapping of a property key
 * (trading.mode -> CROSSWATCH_TRADING_MODE) and direct names (BINANCE_API_KEY).
 */
public final class FileConfigService implements ConfigPort {

    private final Properties props = new Properties();
    private final Path configDir;

    public FileConfigService(Path configDir, Map<String, String> env) throws IOException {
        this.configDir = configDir;
        loadAll();
        applyEnvOverrides(env);
    }

    /** {@code <working dir>/config}, or the directory in CROSSWATCH_CONFIG_DIR. */
    public static FileConfigService defaultFromWorkingDir() throws IOException {
        String override = System.getenv("CROSSWATCH_CONFIG_DIR");
        Path dir = (override != null && !override.isBlank())
                ? Path.of(override.trim())
                : Path.of(System.getProperty("user.dir")).resolve("config");
        return new FileConfigService(dir, System.getenv());
    }

    public Path getConfigDir() {
        return configDir;
    }

    private void loadAll() throws IOException {
        if (configDir == null) return;

        loadPropsIfExists(configDir.resolve("config.properties"));

        Map<String, String> env = DotEnv.loadIfExists(configDir.resolve(".env"));
        for (Map.Entry<String, String> e : env.entrySet()) {
            props.setProperty(e.getKey(), e.getValue());
        }

        loadPropsIfExists(configDir.resolve("secrets.properties"));
    }

    private void loadPropsIfExists(Path file) throws IOException {
        if (file == null || !Files.exists(file)) return;
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        }
    }

    private void applyEnvOverrides(Map<String, String> env) {
        Set<String> keys = new LinkedHashSet<>(props.stringPropertyNames());
        for (ConfigKey k : ConfigKey.values()) keys.add(k.key());

        for (String key : keys) {
            String direct = env.get(key);
            if (direct != null) props.setProperty(key, direct);

            String mapped = env.get(toEnvKey(key));
            if (mapped != null) props.setProperty(key, mapped);
        }
    }

    /**
     * Maps a Java-properties key into an env-var key.
     *
     * Examples:
     * - telegram.botToken          -> CROSSWATCH_TELEGRAM_BOT_TOKEN
     * - symbol.BTCUSDT.quantity    -> CROSSWATCH_SYMBOL_BTCUSDT_QUANTITY
     */
    static String toEnvKey(String key) {
        String s = key.replace('.', '_');
        s = s.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        return "CROSSWATCH_" + s.toUpperCase(Locale.ROOT);
    }

    @Override
    public String get(String key) {
        return get(key, null);
    }

    @Override
    public String get(String key, String defaultValue) {
        String v = props.getProperty(key);
        return (v == null) ? defaultValue : v.trim();
    }

    @Override
    public int getInt(String key, int defaultValue) {
        String v = get(key, null);
        if (v == null) return defaultValue;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    @Override
    public double getDouble(String key, double defaultValue) {
        String v = get(key, null);
        if (v == null) return defaultValue;
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    @Override
    public String getSecret(String key) {
        String v = props.getProperty(key);
        return v == null || v.isBlank() ? null : v.trim();
    }
}
