package com.e2eq.restcore.config;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RestCoreConfigTest {

    private static RestCoreConfig load(Map<String, String> properties) {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
                .withMapping(RestCoreConfig.class)
                .withSources(new PropertiesConfigSource(properties, "test", 100))
                .build();
        return config.getConfigMapping(RestCoreConfig.class);
    }

    @Test
    public void testDefaults() {
        RestCoreConfig config = load(Map.of());

        assertEquals("Rest API Server", config.web().name());
        assertEquals(8080, config.web().port());
        assertEquals("mongodb://localhost:27017", config.mongo().uri());
        assertTrue(config.mongo().database().isEmpty());
        assertEquals("*", config.cors().allowedOrigin());
        assertTrue(config.cors().allowedHeaders().contains("Authorization"));
        assertEquals(900, config.security().sessionTimeout());
        assertFalse(config.security().useHttps());
        assertEquals("POL", config.locale().defaultCountry());
        assertTrue(config.logging().exceptionsEnabled());
        assertEquals(List.of(500, 501, 502, 503), config.logging().exceptionsCodes());
        assertEquals(50, config.listing().perPage());
        assertEquals(100, config.listing().maxPerPage());
    }

    @Test
    public void testOverrides() {
        RestCoreConfig config = load(Map.of(
                "restcore.mongo.database", "shop",
                "restcore.listing.max-per-page", "25",
                "restcore.logging.exceptions-codes", "404,500"));

        assertEquals("shop", config.mongo().database().orElseThrow());
        assertEquals(25, config.listing().maxPerPage());
        assertEquals(List.of(404, 500), config.logging().exceptionsCodes());
    }
}
