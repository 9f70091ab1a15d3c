package com.delta.resumeextractor.extraction;

import com.delta.resumeextractor.config.ExtractorProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExtractorPropertiesGuardrailTest {

    @Test
    void batchSizeAndWorkersAreClamped() {
        ExtractorProperties properties = new ExtractorProperties();
        properties.getQueue().setBatchSize(0);
        properties.getQueue().setRecencyDays(-3);
        properties.getWorkers().setCount(0);
        assertEquals(1, properties.getQueue().getBatchSize());
        assertEquals(1, properties.getQueue().getRecencyDays());
        assertEquals(1, properties.getWorkers().getCount());
    }

    @Test
    void inputBudgetHasAFloor() {
        ExtractorProperties properties = new ExtractorProperties();
        assertEquals(480_000, properties.getLlm().getMaxInputChars());
        properties.getLlm().setMaxInputChars(10);
        assertEquals(1_000, properties.getLlm().getMaxInputChars());
    }

    @Test
    void claimOwnerFallsBackToProcessName() {
        ExtractorProperties properties = new ExtractorProperties();
        properties.getQueue().setClaimOwner("   ");
        assertTrue(properties.getQueue().getClaimOwner().startsWith("extractor-"));
    }

    @Test
    void baseUrlLosesTrailingSlashAndTemperatureIsBounded() {
        ExtractorProperties properties = new ExtractorProperties();
        properties.getLlm().setBaseUrl("https://llm.example.com/v1/");
        properties.getLlm().setTemperature(5.0);
        assertEquals("https://llm.example.com/v1", properties.getLlm().getBaseUrl());
        assertEquals(2.0, properties.getLlm().getTemperature());
    }

    @Test
    void blankApiKeyIsNotConfigured() {
        ExtractorProperties properties = new ExtractorProperties();
        properties.getLlm().setApiKey(" ");
        assertFalse(properties.getLlm().hasApiKey());
        properties.getLlm().setApiKey("sk-test");
        assertTrue(properties.getLlm().hasApiKey());
    }

    @Test
    void persistenceMaxDelayNeverBelowBaseDelay() {
        ExtractorProperties properties = new ExtractorProperties();
        properties.getPersistence().setBaseDelayMs(2000);
        properties.getPersistence().setMaxDelayMs(500);
        properties.getPersistence().setMaxAttempts(0);
        assertEquals(2000, properties.getPersistence().getMaxDelayMs());
        assertEquals(1, properties.getPersistence().getMaxAttempts());
    }
}
