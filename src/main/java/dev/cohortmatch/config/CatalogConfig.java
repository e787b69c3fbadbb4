package dev.cohortmatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the facility catalog.
 * Loaded from application.yml under 'catalog' prefix.
 * The active provider is picked by 'catalog.source' through conditions on the providers.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "catalog")
public class CatalogConfig {

    private List<InlineFacility> facilities = new ArrayList<>();

    private Remote remote = new Remote();

    @Data
    public static class InlineFacility {
        private String name;
        private String range;
    }

    @Data
    public static class Remote {
        private String url;
        private Duration timeout = Duration.ofSeconds(10);
        private int maxRetries = 2;
        private Duration retryBackoff = Duration.ofMillis(500);
    }
}
