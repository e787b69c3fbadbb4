package dev.cohortmatch.catalog.impl;

import com.fasterxml.jackson.databind.JsonNode;
import dev.cohortmatch.catalog.CatalogProvider;
import dev.cohortmatch.catalog.CatalogUnavailableException;
import dev.cohortmatch.config.CatalogConfig;
import dev.cohortmatch.model.CatalogEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.util.retry.Retry;

/**
 * Catalog served as a JSON array by an HTTP endpoint:
 * {@code [{"name": "...", "cohort_range": "10-30"}]}.
 * Elements are converted one by one so a single malformed element is rejected on its own.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "catalog.source", havingValue = "remote")
public class RemoteCatalogProvider implements CatalogProvider {

    private final WebClient webClient;
    private final CatalogConfig.Remote remoteConfig;

    public RemoteCatalogProvider(WebClient.Builder webClientBuilder, CatalogConfig catalogConfig) {
        this.remoteConfig = catalogConfig.getRemote();
        this.webClient = webClientBuilder
                .defaultHeader("Accept", "application/json")
                .build();
        log.info("Using remote facility catalog at {}", remoteConfig.getUrl());
    }

    @Override
    public String getName() {
        return "remote";
    }

    @Override
    public Flux<CatalogEntry> fetchEntries() {
        String url = remoteConfig.getUrl();
        if (url == null || url.isBlank()) {
            return Flux.error(new CatalogUnavailableException(getName(), "catalog.remote.url is not configured"));
        }

        return webClient.get()
                .uri(url)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(remoteConfig.getTimeout())
                .retryWhen(Retry.backoff(remoteConfig.getMaxRetries(), remoteConfig.getRetryBackoff())
                        .filter(this::isRetryable)
                        .doBeforeRetry(signal -> log.warn("Retrying catalog fetch from {} (attempt {}): {}",
                                url, signal.totalRetries() + 1, signal.failure().getMessage())))
                .onErrorMap(e -> !(e instanceof CatalogUnavailableException),
                        e -> {
                            Throwable cause = Exceptions.isRetryExhausted(e) ? e.getCause() : e;
                            return new CatalogUnavailableException(getName(), String.valueOf(cause.getMessage()), cause);
                        })
                .flatMapMany(this::toEntries);
    }

    /**
     * Split the body into entries. Only a body that is not an array fails the catalog;
     * an element of the wrong shape becomes an entry the loader will reject.
     */
    private Flux<CatalogEntry> toEntries(JsonNode body) {
        if (!body.isArray()) {
            return Flux.error(new CatalogUnavailableException(getName(),
                    "expected a JSON array but got " + body.getNodeType()));
        }
        return Flux.fromIterable(body).map(this::toEntry);
    }

    private CatalogEntry toEntry(JsonNode element) {
        if (!element.isObject()) {
            return new CatalogEntry(null, element.toString());
        }
        return new CatalogEntry(textOrNull(element.get("name")), textOrRaw(element.get("cohort_range")));
    }

    private String textOrNull(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }

    private String textOrRaw(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isTextual() ? node.asText() : node.toString();
    }

    /**
     * Only rate limiting and server errors are worth another attempt.
     */
    private boolean isRetryable(Throwable e) {
        if (e instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            return status == 429 || status >= 500;
        }
        return false;
    }
}
