package com.acme.pgprecheck.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Loads {@link PrecheckConfig} from a properties or YAML file.
 *
 * <p>Lookup order:
 * <ol>
 *   <li>the file named by the {@code precheck.config} system property</li>
 *   <li>{@code precheck.properties} on the classpath</li>
 *   <li>{@code precheck.yml} on the classpath</li>
 *   <li>{@link PrecheckConfig#DEFAULTS}</li>
 * </ol>
 *
 * <p>System properties with the same key override file values, e.g.
 * {@code -Dprecheck.probe.timeout.seconds=30}.
 *
 * <h2>Keys:</h2>
 * <ul>
 *   <li>{@code precheck.probe.timeout.seconds}</li>
 *   <li>{@code precheck.connect.timeout.seconds}</li>
 *   <li>{@code precheck.workers}</li>
 *   <li>{@code precheck.sslmode}</li>
 *   <li>{@code precheck.admin.database}</li>
 *   <li>{@code precheck.report.dir}</li>
 *   <li>{@code precheck.report.json.enabled}</li>
 * </ul>
 */
public final class PrecheckConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(PrecheckConfigLoader.class);

    public static final String CONFIG_PATH_PROPERTY = "precheck.config";

    private PrecheckConfigLoader() {}

    public static PrecheckConfig load() {
        String external = System.getProperty(CONFIG_PATH_PROPERTY);
        if (external != null && !external.isBlank()) {
            try {
                return loadFromFile(Path.of(external));
            } catch (IOException e) {
                throw new PrecheckConfigException("Failed to read " + external, e);
            }
        }

        InputStream is = getResource("precheck.properties");
        if (is != null) {
            return loadProperties(is, "precheck.properties");
        }

        is = getResource("precheck.yml");
        if (is != null) {
            return loadYaml(is, "precheck.yml");
        }

        log.debug("No precheck configuration found, using defaults");
        return parse(new Properties());
    }

    public static PrecheckConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static InputStream getResource(String name) {
        return PrecheckConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static PrecheckConfig loadProperties(InputStream is, String source) {
        try (is) {
            Properties props = new Properties();
            props.load(is);
            log.debug("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new PrecheckConfigException("Failed to load " + source, e);
        }
    }

    private static PrecheckConfig loadYaml(InputStream is, String source) {
        Map<String, Object> root;
        try (is) {
            root = new Yaml().load(is);
        } catch (IOException | YAMLException e) {
            throw new PrecheckConfigException("Failed to load " + source, e);
        }
        Properties props = new Properties();
        if (root != null) flatten("", root, props);
        log.debug("Loaded config from {}", source);
        return parse(props);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<String, Object>) val, props);
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    private static PrecheckConfig parse(Properties props) {
        PrecheckConfig.Builder b = PrecheckConfig.builder();

        getLong(props, "precheck.probe.timeout.seconds").ifPresent(v -> {
            if (v > 0) b.probeTimeoutSeconds(v);
            else log.warn("Ignoring non-positive precheck.probe.timeout.seconds: {}", v);
        });
        getLong(props, "precheck.connect.timeout.seconds").ifPresent(v -> {
            if (v > 0) b.connectTimeoutSeconds(v);
            else log.warn("Ignoring non-positive precheck.connect.timeout.seconds: {}", v);
        });
        getInt(props, "precheck.workers").ifPresent(v -> {
            if (v > 0) b.workers(v);
            else log.warn("Ignoring non-positive precheck.workers: {}", v);
        });

        getString(props, "precheck.sslmode").filter(v -> !v.isEmpty()).ifPresent(b::sslMode);
        getString(props, "precheck.admin.database").filter(v -> !v.isEmpty()).ifPresent(b::adminDatabase);
        getString(props, "precheck.report.dir").filter(v -> !v.isEmpty()).ifPresent(b::reportDir);
        getString(props, "precheck.report.json.enabled").ifPresent(v -> b.jsonReportEnabled(Boolean.parseBoolean(v)));

        return b.build();
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        return val != null ? Optional.of(val.trim()) : Optional.empty();
    }

    private static Optional<Long> getLong(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Long.parseLong(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }

    private static Optional<Integer> getInt(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Integer.parseInt(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }
}
