package com.examgrader.utils;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class GraderSettingsTest {

    @Test
    void testDefaultsFromReferenceConfiguration() {
        Config config = ConfigFactory.parseResources("application.conf").resolve();

        GraderSettings settings = GraderSettings.fromConfig(config);

        assertEquals(8080, settings.getHttpPort());
        assertEquals(4, settings.getGradingWorkers());
        assertEquals(Duration.ofMinutes(3), settings.getEvaluationTimeout());
        assertEquals(Duration.ofSeconds(15), settings.getQueueTimeout());
        assertEquals("https://api.together.xyz/v1", settings.getOracle().baseUrl());
        assertEquals("meta-llama/Llama-3-8b-chat", settings.getOracle().model());
        assertEquals(100, settings.getOracle().maxTokens());
        assertEquals(0.5, settings.getOracle().temperature(), 1e-9);
        assertEquals("\n", settings.getOracle().stop());
    }

    @Test
    void testOverridesAndWorkerFloor() {
        Config config = ConfigFactory.parseString(
                "exam-grader.evaluation.workers = 0\n"
                + "exam-grader.evaluation.timeout = 5s\n"
                + "exam-grader.oracle.temperature = 0.2\n")
            .withFallback(ConfigFactory.parseResources("application.conf"))
            .resolve();

        GraderSettings settings = GraderSettings.fromConfig(config);

        assertEquals(1, settings.getGradingWorkers());
        assertEquals(Duration.ofSeconds(5), settings.getEvaluationTimeout());
        assertEquals(0.2, settings.getOracle().temperature(), 1e-9);
    }

    @Test
    void testQueueAndEvaluationTimeoutMustFitInsideAskTimeout() {
        Config config = ConfigFactory.parseString(
                "exam-grader.http.ask-timeout = 60s\n"
                + "exam-grader.evaluation.timeout = 50s\n"
                + "exam-grader.evaluation.queue-timeout = 10s\n")
            .withFallback(ConfigFactory.parseResources("application.conf"))
            .resolve();

        ConfigException.BadValue error = assertThrows(ConfigException.BadValue.class,
            () -> GraderSettings.fromConfig(config));
        assertTrue(error.getMessage().contains("queue-timeout"));
    }
}
