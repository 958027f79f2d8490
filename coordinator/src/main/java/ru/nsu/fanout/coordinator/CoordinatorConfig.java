package ru.nsu.fanout.coordinator;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Настройки координатора. Значения по умолчанию переопределяются
 * переменными окружения и аргументами командной строки.
 */
@Slf4j
@Getter
@AllArgsConstructor
public class CoordinatorConfig {
    public static final int DEFAULT_PORT = 8080;
    public static final Path DEFAULT_OUTPUT_ROOT = Path.of("processed_results");
    public static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(2);
    public static final Duration DEFAULT_DISPATCH_TIMEOUT = Duration.ofSeconds(45);
    public static final int DEFAULT_MAX_CONCURRENT_CALLS = 16;

    static final String PORT_ENV = "FANOUT_PORT";
    static final String OUTPUT_DIR_ENV = "FANOUT_OUTPUT_DIR";
    static final String PROBE_TIMEOUT_ENV = "FANOUT_PROBE_TIMEOUT_MS";
    static final String DISPATCH_TIMEOUT_ENV = "FANOUT_DISPATCH_TIMEOUT_MS";
    static final String MAX_CONCURRENT_CALLS_ENV = "FANOUT_MAX_CONCURRENT_CALLS";

    private final int port;
    private final Path outputRoot;
    private final Duration probeTimeout;
    private final Duration dispatchTimeout;
    private final int maxConcurrentCalls;

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig(DEFAULT_PORT, DEFAULT_OUTPUT_ROOT,
                DEFAULT_PROBE_TIMEOUT, DEFAULT_DISPATCH_TIMEOUT, DEFAULT_MAX_CONCURRENT_CALLS);
    }

    public static CoordinatorConfig fromEnvironment(Map<String, String> env) {
        String outputDir = env.get(OUTPUT_DIR_ENV);
        return new CoordinatorConfig(
                positiveInt(env, PORT_ENV, DEFAULT_PORT),
                outputDir == null || outputDir.isBlank() ? DEFAULT_OUTPUT_ROOT : Path.of(outputDir),
                Duration.ofMillis(positiveInt(env, PROBE_TIMEOUT_ENV, (int) DEFAULT_PROBE_TIMEOUT.toMillis())),
                Duration.ofMillis(positiveInt(env, DISPATCH_TIMEOUT_ENV, (int) DEFAULT_DISPATCH_TIMEOUT.toMillis())),
                positiveInt(env, MAX_CONCURRENT_CALLS_ENV, DEFAULT_MAX_CONCURRENT_CALLS));
    }

    public CoordinatorConfig withPort(int port) {
        return new CoordinatorConfig(port, outputRoot, probeTimeout, dispatchTimeout, maxConcurrentCalls);
    }

    public CoordinatorConfig withOutputRoot(Path outputRoot) {
        return new CoordinatorConfig(port, outputRoot, probeTimeout, dispatchTimeout, maxConcurrentCalls);
    }

    public CoordinatorConfig withTimeouts(Duration probeTimeout, Duration dispatchTimeout) {
        return new CoordinatorConfig(port, outputRoot, probeTimeout, dispatchTimeout, maxConcurrentCalls);
    }

    private static int positiveInt(Map<String, String> env, String name, int defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value '{}' for {}, using default: {}", value, name, defaultValue);
            return defaultValue;
        }
        if (parsed <= 0) {
            log.warn("Non-positive value {} for {}, using default: {}", parsed, name, defaultValue);
            return defaultValue;
        }
        return parsed;
    }
}
