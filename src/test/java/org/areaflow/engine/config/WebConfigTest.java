package org.areaflow.engine.config;

import org.junit.jupiter.api.Test;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WebConfigTest {

    private static class RecordingCorsRegistry extends CorsRegistry {
        Map<String, CorsConfiguration> mappings() {
            return getCorsConfigurations();
        }
    }

    @Test
    void shouldExposeOnlyTheV1Api() {
        RecordingCorsRegistry registry = new RecordingCorsRegistry();

        new WebConfig(List.of("https://app.example.com")).addCorsMappings(registry);

        CorsConfiguration cors = registry.mappings().get("/v1/**");
        assertNotNull(cors);
        assertEquals(1, registry.mappings().size());
        assertEquals("https://app.example.com", cors.checkOrigin("https://app.example.com"));
        assertNull(cors.checkOrigin("https://evil.example.com"));
        assertFalse(cors.getAllowedMethods().contains("PUT"));
        assertTrue(cors.getAllowedMethods().contains("DELETE"));
    }

    @Test
    void shouldAllowAnyOriginByDefault() {
        RecordingCorsRegistry registry = new RecordingCorsRegistry();

        new WebConfig(List.of("*")).addCorsMappings(registry);

        assertEquals("*", registry.mappings().get("/v1/**").checkOrigin("https://app.example.com"));
    }
}
