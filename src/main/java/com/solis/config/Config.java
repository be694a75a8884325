package com.solis.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeSet;

/**
 * Layered agent configuration.
 * <p>
 * Lookup order: environment override, local {@code ./config.properties}, classpath
 * {@code config.properties}, built-in defaults. Blank values fall through to the next layer.
 */
public final class Config {
    private static final Logger LOG = LogManager.getLogger(Config.class);

    /** Environment variables that override a config key. */
    static final Map<String, String> ENV_KEYS = buildEnvKeys();

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Properties envProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        return load(workingDir, System.getenv());
    }

    public static Config load(Path workingDir, Map<String, String> env) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(new InputStreamReader(in, StandardCharsets.UTF_8));
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            LOG.warn("failed to read classpath config.properties, using defaults: {}", e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (Reader in = Files.newBufferedReader(local, StandardCharsets.UTF_8)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                LOG.warn("failed to read {}: {}", local, e.getMessage());
            }
        }

        config.applyEnv(env);
        return config;
    }

    /**
     * Build Config from Spring-bound configuration properties.
     */
    public static Config fromConfigurationProperties(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        flattenInto(config, "", rawProperties);
        return config;
    }

    /**
     * Config with only defaults plus the given overrides; used by embedders and tests.
     */
    public static Config of(Path workingDir, Map<String, String> overrides) {
        Config config = new Config(workingDir);
        if (overrides != null) {
            for (Map.Entry<String, String> entry : overrides.entrySet()) {
                putBoundValue(config, entry.getKey(), entry.getValue());
            }
        }
        return config;
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        if (getString(key).isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key, int fallback) {
        String value = getString(key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    public double getDouble(String key, double fallback) {
        String value = getString(key);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public Map<String, String> defaults() {
        return DEFAULTS;
    }

    public ResolvedValue resolve(String key) {
        return new ResolvedValue(key, getString(key), sourceOf(key));
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(envProps.getProperty(key)).isEmpty()) {
            return "env";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    /**
     * Key/value/source lines for the startup summary. Credentials are masked.
     */
    public List<ResolvedValue> summary() {
        List<ResolvedValue> out = new ArrayList<>();
        for (String key : new TreeSet<>(DEFAULTS.keySet())) {
            ResolvedValue value = resolve(key);
            if (isSecret(key) && !value.value.isEmpty()) {
                value = new ResolvedValue(key, "***", value.source);
            }
            out.add(value);
        }
        return out;
    }

    static boolean isSecret(String key) {
        return key.endsWith("_token") || key.endsWith("webhook_url");
    }

    private void applyEnv(Map<String, String> env) {
        if (env == null) {
            return;
        }
        for (Map.Entry<String, String> mapping : ENV_KEYS.entrySet()) {
            String value = nonBlank(env.get(mapping.getKey()));
            if (!value.isEmpty()) {
                envProps.setProperty(mapping.getValue(), value);
                props.setProperty(mapping.getValue(), value);
            }
        }
    }

    private static String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim();
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (config == null || value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String fullKey = prefix.isEmpty() ? key : prefix + "." + key;
                flattenInto(config, fullKey, entry.getValue());
            }
            return;
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(item == null ? "" : String.valueOf(item));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        putBoundValue(config, prefix, String.valueOf(value));
    }

    private static void putBoundValue(Config config, String key, String value) {
        if (key == null || key.trim().isEmpty()) {
            return;
        }
        String normalizedKey = key.trim();
        String normalizedValue = value == null ? "" : value;
        config.overrideProps.setProperty(normalizedKey, normalizedValue);
        config.props.setProperty(normalizedKey, normalizedValue);
    }

    private static Map<String, String> buildEnvKeys() {
        Map<String, String> keys = new LinkedHashMap<>();
        keys.put("HEARTBEAT_HOUR", "heartbeat.hour_utc");
        keys.put("REPORTS_DIR", "reports.dir");
        keys.put("ANOMALY_THRESHOLD", "anomaly.threshold");
        keys.put("LOG_LEVEL", "log.level");
        keys.put("SOLIS_CACHE_DIR", "cache.dir");
        keys.put("ALERTS_ENABLED", "alerts.enabled");
        keys.put("ALERT_CHANNEL", "alerts.channel");
        keys.put("ALERT_ANOMALY_THRESHOLD", "alerts.anomaly_threshold");
        keys.put("TELEGRAM_BOT_TOKEN", "alerts.telegram.bot_token");
        keys.put("TELEGRAM_CHAT_ID", "alerts.telegram.chat_id");
        keys.put("DISCORD_WEBHOOK_URL", "alerts.discord.webhook_url");
        return Collections.unmodifiableMap(keys);
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("heartbeat.hour_utc", "8");
        defaults.put("heartbeat.lock_file", "/tmp/solis-heartbeat.lock");
        defaults.put("heartbeat.state_file", ".solis-state.json");

        defaults.put("cache.dir", ".cache");
        defaults.put("cache.ttl_hours", "12");
        defaults.put("cache.purge_expired", "false");

        defaults.put("reports.dir", "reports");
        defaults.put("anomaly.threshold", "2.0");

        defaults.put("retry.attempts", "3");
        defaults.put("retry.base_delay_ms", "1000");
        defaults.put("retry.max_delay_ms", "10000");

        defaults.put("http.timeout_sec", "20");
        defaults.put("sources.repos.url", "");
        defaults.put("sources.onchain.url", "");
        defaults.put("sources.dex.url", "");
        defaults.put("sources.tokens.url", "");

        defaults.put("alerts.enabled", "false");
        defaults.put("alerts.channel", "telegram");
        defaults.put("alerts.anomaly_threshold", "3.0");
        defaults.put("alerts.telegram.bot_token", "");
        defaults.put("alerts.telegram.chat_id", "");
        defaults.put("alerts.discord.webhook_url", "");

        defaults.put("outputs.log_dir", "logs");
        defaults.put("log.level", "info");

        return Collections.unmodifiableMap(defaults);
    }

    public static final class ResolvedValue {
        public final String key;
        public final String value;
        public final String source;

        public ResolvedValue(String key, String value, String source) {
            this.key = key == null ? "" : key;
            this.value = value == null ? "" : value;
            this.source = source == null ? "default" : source;
        }
    }
}
