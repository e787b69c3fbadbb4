package dev.cohortmatch.catalog.impl;

import dev.cohortmatch.config.CatalogConfig;
import dev.cohortmatch.model.CatalogEntry;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InlineCatalogProviderTest {

    private static CatalogConfig.InlineFacility facility(String name, String range) {
        CatalogConfig.InlineFacility facility = new CatalogConfig.InlineFacility();
        facility.setName(name);
        facility.setRange(range);
        return facility;
    }

    @Test
    void shouldEmitConfiguredFacilitiesInOrder() {
        CatalogConfig config = new CatalogConfig();
        config.setFacilities(List.of(facility("Stadium", "10-40"), facility("Gym", "30-60")));

        InlineCatalogProvider provider = new InlineCatalogProvider(config);

        StepVerifier.create(provider.fetchEntries())
                .expectNext(new CatalogEntry("Stadium", "10-40"))
                .expectNext(new CatalogEntry("Gym", "30-60"))
                .verifyComplete();
        assertThat(provider.getName()).isEqualTo("inline");
    }

    @Test
    void shouldCompleteEmptyWithoutFacilities() {
        InlineCatalogProvider provider = new InlineCatalogProvider(new CatalogConfig());

        StepVerifier.create(provider.fetchEntries()).verifyComplete();
    }
}
