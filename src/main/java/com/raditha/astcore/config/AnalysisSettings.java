package com.raditha.astcore.config;

import com.raditha.astcore.model.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Builds an {@link AnalysisConfig} from {@link Settings} (astcore.yml) with
 * programmatic overrides.
 *
 * Configuration priority: overrides > nested {@code astcore} map > top-level keys > defaults
 */
public class AnalysisSettings {
    private static final Logger logger = LoggerFactory.getLogger(AnalysisSettings.class);

    static final String CONFIG_KEY = "astcore";

    private AnalysisSettings() {
        /* this is only a utility class */
    }

    /**
     * Load configuration without overrides.
     */
    public static AnalysisConfig loadConfig() {
        return loadConfig(null, null, 0);
    }

    /**
     * Load configuration, applying overrides where provided.
     *
     * @param presetOverride   preset name ("strict", "thorough", "default"), null to use YAML
     * @param languageOverride language, null to use YAML/default
     * @param threadsOverride  worker threads, 0 to use YAML/default
     * @return complete analysis configuration
     */
    public static AnalysisConfig loadConfig(String presetOverride, Language languageOverride, int threadsOverride) {
        Map<String, Object> config = nestedConfig();

        String preset = presetOverride != null ? presetOverride : getString(config, "preset", null);
        AnalysisConfig base = preset == null ? AnalysisConfig.defaults() : switch (preset) {
            case "strict" -> AnalysisConfig.strict();
            case "thorough" -> AnalysisConfig.thorough();
            default -> AnalysisConfig.defaults();
        };

        Language language = languageOverride != null ? languageOverride
                : Language.fromString(getString(config, "language", base.language().name()));
        boolean inconclusive = getBoolean(config, "inconclusive", base.inconclusive());
        boolean warnings = getBoolean(config, "warnings", base.warnings());
        int sizeofWchar = getInt(config, "sizeof_wchar_t", base.sizeofWchar());
        boolean trackScopes = getBoolean(config, "track_scopes", base.trackScopes());
        int workerThreads = threadsOverride != 0 ? threadsOverride
                : getInt(config, "worker_threads", base.workerThreads());

        AnalysisConfig result = new AnalysisConfig(language, inconclusive, warnings, sizeofWchar,
                trackScopes, workerThreads);
        logger.debug("Analysis configuration: {}", result);
        return result;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> nestedConfig() {
        Object raw = Settings.getProperty(CONFIG_KEY);
        if (raw instanceof Map) {
            return (Map<String, Object>) raw;
        }
        return Map.of();
    }

    private static Object lookup(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value != null ? value : Settings.getProperty(key);
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = lookup(map, key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String s) {
            return Integer.parseInt(s.trim());
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = lookup(map, key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return Boolean.parseBoolean(s.trim());
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = lookup(map, key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
