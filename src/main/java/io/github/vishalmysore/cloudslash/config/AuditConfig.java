package io.github.vishalmysore.cloudslash.config;

import lombok.Builder;
import lombok.Value;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Audit run settings. Read from {@code cloudslash.properties} on the
 * classpath; JVM system properties with the same keys take precedence.
 */
@Value
@Builder(toBuilder = true)
public class AuditConfig {
    private static final Logger log = Logger.getLogger(AuditConfig.class.getName());

    public static final String DEFAULT_RESOURCE = "cloudslash.properties";

    public static final String START_WORKERS = "swarm.startWorkers";
    public static final String MIN_WORKERS = "swarm.minWorkers";
    public static final String MAX_WORKERS = "swarm.maxWorkers";
    public static final String QUEUE_CAPACITY = "swarm.queueCapacity";

    @Builder.Default
    int startWorkers = 50;
    @Builder.Default
    int minWorkers = 5;
    @Builder.Default
    int maxWorkers = 500;
    @Builder.Default
    int queueCapacity = 1000;

    public static AuditConfig defaults() {
        return AuditConfig.builder().build();
    }

    public static AuditConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Loads the named classpath resource. A missing or unreadable resource
     * yields the defaults.
     */
    public static AuditConfig load(String resource) {
        Properties props = new Properties();
        try (InputStream is = AuditConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                props.load(is);
            } else {
                log.info("No " + resource + " on classpath, using defaults");
            }
        } catch (IOException e) {
            log.warning("Could not load " + resource + ": " + e.getMessage());
        }
        for (String key : new String[] { START_WORKERS, MIN_WORKERS, MAX_WORKERS, QUEUE_CAPACITY }) {
            String override = System.getProperty(key);
            if (override != null) {
                props.setProperty(key, override);
            }
        }
        return fromProperties(props);
    }

    public static AuditConfig fromProperties(Properties props) {
        AuditConfig defaults = defaults();
        AuditConfig config = AuditConfig.builder()
                .startWorkers(readInt(props, START_WORKERS, defaults.getStartWorkers()))
                .minWorkers(readInt(props, MIN_WORKERS, defaults.getMinWorkers()))
                .maxWorkers(readInt(props, MAX_WORKERS, defaults.getMaxWorkers()))
                .queueCapacity(readInt(props, QUEUE_CAPACITY, defaults.getQueueCapacity()))
                .build();

        if (config.getMinWorkers() > config.getMaxWorkers()) {
            log.warning("swarm.minWorkers exceeds swarm.maxWorkers, using default bounds");
            return config.toBuilder()
                    .minWorkers(defaults.getMinWorkers())
                    .maxWorkers(defaults.getMaxWorkers())
                    .build();
        }
        return config;
    }

    private static int readInt(Properties props, String key, int fallback) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 1) {
                log.warning(key + " must be positive, got " + parsed + "; using " + fallback);
                return fallback;
            }
            return parsed;
        } catch (NumberFormatException e) {
            log.warning(key + " is not a number: '" + value + "'; using " + fallback);
            return fallback;
        }
    }
}
