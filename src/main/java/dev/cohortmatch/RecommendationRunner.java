package dev.cohortmatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.cohortmatch.catalog.CatalogUnavailableException;
import dev.cohortmatch.config.UserInputLoader;
import dev.cohortmatch.model.Recommendation;
import dev.cohortmatch.model.UserInput;
import dev.cohortmatch.service.RecommendationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;

/**
 * Runs one recommendation: load the profile, score it, match the catalog, report the result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecommendationRunner {

  private static final String SEPARATOR = "========================================";

  private final UserInputLoader userInputLoader;
  private final RecommendationService recommendationService;
  private final ObjectMapper objectMapper;

  @Value("${recommendation.output-file:}")
  private String outputFile;

  @Value("${recommendation.metrics-wait-seconds:0}")
  private int metricsWaitSeconds;

  /**
   * Executes a single recommendation run.
   *
   * @return the recommendation that was produced
   * @throws CatalogUnavailableException if the catalog could not be obtained
   */
  public Recommendation execute() {
    log.info(SEPARATOR);
    log.info("Cohort Matcher Starting");
    log.info(SEPARATOR);

    try {
      UserInput user = userInputLoader.load();
      Recommendation recommendation = recommendationService.recommend(user).block();
      if (recommendation == null) {
        throw new IllegalStateException("No recommendation produced");
      }

      String json = objectMapper.writeValueAsString(recommendation);
      log.info(SEPARATOR);
      log.info("Cohort: {}", recommendation.cohort());
      log.info("Recommendation: {}", json);
      log.info(SEPARATOR);

      writeOutput(recommendation);
      handleMetricsWait();
      return recommendation;
    } catch (CatalogUnavailableException e) {
      throw e;
    } catch (Exception e) {
      log.error("Cohort Matcher failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Recommendation run failed", e);
    }
  }

  private void writeOutput(Recommendation recommendation) throws IOException {
    if (outputFile == null || outputFile.isBlank()) {
      return;
    }
    objectMapper.writerWithDefaultPrettyPrinter().writeValue(new File(outputFile), recommendation);
    log.info("Recommendation written to {}", outputFile);
  }

  private void handleMetricsWait() {
    if (metricsWaitSeconds > 0) {
      log.info("Keeping alive for {} seconds (metrics scrape)...", metricsWaitSeconds);
      try {
        Thread.sleep(metricsWaitSeconds * 1000L);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        log.warn("Metrics wait interrupted");
      }
    }
  }
}
