package dev.cohortmatch;

import dev.cohortmatch.catalog.CatalogUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class CohortMatcherApplication implements CommandLineRunner {

    private final RecommendationRunner recommendationRunner;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(CohortMatcherApplication.class, args);
    }

    @Override
    public void run(String... args) {
        try {
            recommendationRunner.execute();
            exitManager.exit(ExitManager.SUCCESS);
        } catch (CatalogUnavailableException e) {
            log.error("Facility catalog unavailable ({}): {}", e.getSource(), e.getMessage());
            exitManager.exit(ExitManager.CATALOG_UNAVAILABLE);
        } catch (Exception e) {
            log.error("Cohort Matcher failed: {}", e.getMessage());
            exitManager.exit(ExitManager.FAILURE);
        }
    }
}
