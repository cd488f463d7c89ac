package me.golemcore.runtime;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.*;

class RuntimeApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(RuntimeApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(RuntimeApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(RuntimeApplication.class.getMethod("main", String[].class));
    }

    @Test
    void shouldDetectServeAsFirstCommand() {
        assertTrue(RuntimeApplication.isServe(new String[] { "serve" }));
        assertTrue(RuntimeApplication.isServe(new String[] { "--spring.profiles.active=dev", "serve" }));
        assertFalse(RuntimeApplication.isServe(new String[] { "cron", "list" }));
        assertFalse(RuntimeApplication.isServe(new String[] { "cron", "add", "-n", "serve" }));
        assertFalse(RuntimeApplication.isServe(new String[0]));
    }
}
