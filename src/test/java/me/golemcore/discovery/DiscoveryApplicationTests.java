package me.golemcore.discovery;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class DiscoveryApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(DiscoveryApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(DiscoveryApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(DiscoveryApplication.class.getMethod("main", String[].class));
    }
}
