package io.valuation.config;

import io.valuation.error.ConfigException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RuntimeSettingsTest {
    @AfterEach
    void clearProperties() {
        System.clearProperty("valuation.workers");
        System.clearProperty("valuation.http.backoffMillis");
        System.clearProperty("valuation.out");
    }

    @Test
    void defaults() {
        RuntimeSettings s = RuntimeSettings.defaults();
        assertEquals(4, s.workers());
        assertEquals(64, s.queueCapacity());
        assertEquals(3, s.httpAttempts());
        assertEquals(250L, s.httpBackoffMillis());
        assertEquals(Path.of("output"), s.outputDir());
    }

    @Test
    void systemPropertiesOverride() {
        System.setProperty("valuation.workers", "2");
        System.setProperty("valuation.http.backoffMillis", "10");
        System.setProperty("valuation.out", "build/reports");

        RuntimeSettings s = RuntimeSettings.fromEnv();

        assertEquals(2, s.workers());
        assertEquals(10L, s.httpBackoffMillis());
        assertEquals(Path.of("build/reports"), s.outputDir());
    }

    @Test
    void rejectsBadValues() {
        System.setProperty("valuation.workers", "zero");
        assertEquals("valuation.workers", assertThrows(ConfigException.class, RuntimeSettings::fromEnv).field());
        System.setProperty("valuation.workers", "0");
        assertEquals("valuation.workers", assertThrows(ConfigException.class, RuntimeSettings::fromEnv).field());
    }

    @Test
    void withersReplaceOneField() {
        RuntimeSettings s = RuntimeSettings.defaults().withWorkers(1).withOutputDir(Path.of("out"));
        assertEquals(1, s.workers());
        assertEquals(Path.of("out"), s.outputDir());
        assertEquals(64, s.queueCapacity());
    }
}
