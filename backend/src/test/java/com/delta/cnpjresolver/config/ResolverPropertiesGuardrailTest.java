package com.delta.cnpjresolver.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResolverPropertiesGuardrailTest {

    @Test
    void websiteUserAgentFallsBackToBrowserDefault() {
        ResolverProperties properties = new ResolverProperties();
        properties.getWebsite().setUserAgent("   ");
        assertTrue(properties.getWebsite().getUserAgent().startsWith("Mozilla/5.0"));
    }

    @Test
    void attemptsAndDelaysAreClamped() {
        ResolverProperties properties = new ResolverProperties();
        properties.getHttp().setMaxAttempts(0);
        properties.getHttp().setMinDelayMs(-10);
        properties.getHttp().setMaxDelayMs(-5);
        properties.getBranches().setMaxPages(0);
        properties.getBatch().setWorkers(-1);
        properties.getLayers().setInterLayerDelayMs(-1);
        assertEquals(1, properties.getHttp().getMaxAttempts());
        assertEquals(0, properties.getHttp().getMinDelayMs());
        assertEquals(0, properties.getHttp().getMaxDelayMs());
        assertEquals(1, properties.getBranches().getMaxPages());
        assertEquals(1, properties.getBatch().getWorkers());
        assertEquals(0, properties.getLayers().getInterLayerDelayMs());
    }

    @Test
    void maxDelayNeverBelowMinDelay() {
        ResolverProperties properties = new ResolverProperties();
        properties.getHttp().setMinDelayMs(3000);
        properties.getHttp().setMaxDelayMs(1000);
        assertEquals(3000, properties.getHttp().getMaxDelayMs());
    }

    @Test
    void defaultsMatchDirectoryPolicy() {
        ResolverProperties properties = new ResolverProperties();
        assertEquals(5, properties.getHttp().getMaxAttempts());
        assertEquals(List.of("website", "encyclopedia", "search-engine"), properties.getLayers().getOrder());
        assertTrue(properties.getHttp().getRotateStatuses().containsAll(List.of(403, 429, 503)));
        assertTrue(properties.getHttp().getUserAgents().size() >= 5);
    }

    @Test
    void cliModeDefaultsToResolveAndIsNormalized() {
        ResolverProperties properties = new ResolverProperties();
        assertEquals("resolve", properties.getCli().getMode());
        properties.getCli().setMode("  ");
        assertEquals("resolve", properties.getCli().getMode());
        properties.getCli().setMode(" BRANCHES-ONLY ");
        assertEquals("branches-only", properties.getCli().getMode());
    }
}
