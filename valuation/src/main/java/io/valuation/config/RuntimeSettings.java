package io.valuation.config;

import io.valuation.error.ConfigException;

import java.nio.file.Path;

/**
 * Knobs of the run itself rather than of the grant. Each value comes from a system property, then an
 * environment variable, then the default.
 */
public record RuntimeSettings(
        int workers,
        int queueCapacity,
        int httpAttempts,
        long httpBackoffMillis,
        Path outputDir
) {
    public static RuntimeSettings defaults() {
        return new RuntimeSettings(4, 64, 3, 250L, Path.of("output"));
    }

    public static RuntimeSettings fromEnv() {
        int workers = intValue("valuation.workers", "VALUATION_WORKERS", "4");
        int queue = intValue("valuation.queue", "VALUATION_QUEUE", "64");
        int attempts = intValue("valuation.http.attempts", "VALUATION_HTTP_ATTEMPTS", "3");
        long backoff = longValue("valuation.http.backoffMillis", "VALUATION_HTTP_BACKOFF_MS", "250");
        Path out = Path.of(lookup("valuation.out", "VALUATION_OUT", "output"));
        return new RuntimeSettings(workers, queue, attempts, backoff, out);
    }

    public RuntimeSettings withWorkers(int w) {
        return new RuntimeSettings(w, queueCapacity, httpAttempts, httpBackoffMillis, outputDir);
    }

    public RuntimeSettings withOutputDir(Path dir) {
        return new RuntimeSettings(workers, queueCapacity, httpAttempts, httpBackoffMillis, dir);
    }

    private static String lookup(String property, String env, String def) {
        return System.getProperty(property, System.getenv().getOrDefault(env, def));
    }

    private static int intValue(String property, String env, String def) {
        String v = lookup(property, env, def);
        try {
            int i = Integer.parseInt(v.trim());
            if (i < 1) throw new ConfigException(property, "must be >= 1, was " + i);
            return i;
        } catch (NumberFormatException e) {
            throw new ConfigException(property, "not an integer: '" + v + "'", e);
        }
    }

    private static long longValue(String property, String env, String def) {
        String v = lookup(property, env, def);
        try {
            long l = Long.parseLong(v.trim());
            if (l < 0) throw new ConfigException(property, "must be >= 0, was " + l);
            return l;
        } catch (NumberFormatException e) {
            throw new ConfigException(property, "not an integer: '" + v + "'", e);
        }
    }
}
