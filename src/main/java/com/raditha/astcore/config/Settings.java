package com.raditha.astcore.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;

/**
 * Process-wide property map loaded from a YAML file.
 * <p>
 * Values are looked up by top-level key; nested maps are returned as-is and
 * interpreted by the component that owns the key.
 */
public class Settings {
    private static final Logger logger = LoggerFactory.getLogger(Settings.class);

    /** Classpath resource read by {@link #loadConfigMap()}. */
    public static final String DEFAULT_CONFIG = "astcore.yml";

    private static final Map<String, Object> props = new HashMap<>();

    private Settings() {
        /* this is only a utility class */
    }

    /**
     * Replace the current properties with the content of the default
     * classpath configuration. Missing resource leaves the map empty.
     */
    public static synchronized void loadConfigMap() throws IOException {
        props.clear();
        try (InputStream in = Settings.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG)) {
            if (in == null) {
                logger.debug("No {} on the classpath, using defaults", DEFAULT_CONFIG);
                return;
            }
            load(in);
        }
    }

    /**
     * Replace the current properties with the content of a YAML file.
     */
    public static synchronized void loadConfigMap(File configFile) throws IOException {
        props.clear();
        try (InputStream in = new FileInputStream(configFile)) {
            load(in);
        }
        logger.debug("Loaded configuration from {}", configFile);
    }

    private static void load(InputStream in) {
        Object loaded = new Yaml().load(in);
        if (loaded instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                props.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        } else if (loaded != null) {
            throw new IllegalArgumentException("Configuration root must be a mapping");
        }
    }

    public static synchronized Object getProperty(String key) {
        return props.get(key);
    }

    /**
     * Set or, with a null value, remove a property.
     */
    public static synchronized void setProperty(String key, Object value) {
        if (value == null) {
            props.remove(key);
        } else {
            props.put(key, value);
        }
    }

    public static synchronized void clear() {
        props.clear();
    }
}
