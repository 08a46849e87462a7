package com.registrygateway.gateway.selection;

import com.registrygateway.common.model.BusinessSearchQuery;
import com.registrygateway.common.model.OperationKind;
import com.registrygateway.gateway.config.GatewaySettings;
import com.registrygateway.gateway.registry.ProviderRegistry;
import com.registrygateway.gateway.support.MutableClock;
import com.registrygateway.gateway.support.StubProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProviderSelectorTest {

    private final ProviderRegistry registry = new ProviderRegistry(MutableClock.startingAt("2024-01-01T00:00:00Z"));
    private final ProviderSelector selector = new ProviderSelector(registry, GatewaySettings.defaults());

    @Nested
    @DisplayName("selectBest()")
    class SelectBest {

        @Test
        @DisplayName("higher quality wins when everything else is equal")
        void qualityWins() {
            registry.register(StubProvider.named("experian", 0.93, Map.of()));
            registry.register(StubProvider.named("dnb", 0.95, Map.of()));

            assertEquals("dnb", selector.selectBest(BusinessSearchQuery.empty()).orElseThrow().name());
        }

        @Test
        @DisplayName("US query with financial, compliance and news prefers full-coverage dnb over experian")
        void usScenario() {
            registry.register(new StubProvider(StubProvider.descriptor("experian", 0.93, Map.of("US", 0.90),
                EnumSet.of(OperationKind.SEARCH, OperationKind.DETAILS, OperationKind.FINANCIAL), 0.0, 100, 10)));
            registry.register(new StubProvider(StubProvider.descriptor("dnb", 0.95, Map.of("US", 0.95),
                EnumSet.allOf(OperationKind.class), 0.0, 100, 10)));

            BusinessSearchQuery query = BusinessSearchQuery.builder()
                .companyName("Acme").country("US").includeFinancial(true).includeCompliance(true).includeNews(true).build();

            assertEquals("dnb", selector.selectBest(query).orElseThrow().name());
        }

        @Test
        @DisplayName("equal scores go to the provider registered first")
        void tieBreakByRegistrationOrder() {
            registry.register(StubProvider.named("first", 0.9, Map.of()));
            registry.register(StubProvider.named("second", 0.9, Map.of()));

            assertEquals("first", selector.selectBest(BusinessSearchQuery.empty()).orElseThrow().name());
        }

        @Test
        @DisplayName("unhealthy providers are skipped")
        void skipsUnhealthy() {
            StubProvider best = StubProvider.named("best", 0.99, Map.of());
            best.setHealthy(false);
            registry.register(best);
            registry.register(StubProvider.named("ok", 0.5, Map.of()));

            assertEquals("ok", selector.selectBest(BusinessSearchQuery.empty()).orElseThrow().name());
        }

        @Test
        @DisplayName("no healthy provider → empty")
        void emptyWhenNoneHealthy() {
            StubProvider only = StubProvider.named("only");
            only.setHealthy(false);
            registry.register(only);

            assertTrue(selector.selectBest(BusinessSearchQuery.empty()).isEmpty());
        }
    }

    @Nested
    @DisplayName("score()")
    class Score {

        @Test
        @DisplayName("quality, coverage, cost and feature terms add up")
        void fullScore() {
            StubProvider p = new StubProvider(StubProvider.descriptor("p", 0.8, Map.of("US", 0.5),
                EnumSet.of(OperationKind.SEARCH, OperationKind.FINANCIAL), 2.0, 100, 10));
            BusinessSearchQuery query = BusinessSearchQuery.builder()
                .country("US").includeFinancial(true).includeNews(true).build();

            double expected = 0.8 * 0.3 + 0.5 * 0.2 + (1 - 2.0 / 10) * 0.2 + 0.3 * 1 / 2;
            assertEquals(expected, selector.score(p, query), 1e-9);
        }

        @Test
        @DisplayName("no requested features → feature term is 0")
        void noFeaturesRequested() {
            StubProvider p = StubProvider.named("p", 1.0, Map.of());
            assertEquals(0.3 + 0.2, selector.score(p, BusinessSearchQuery.empty()), 1e-9);
        }

        @Test
        @DisplayName("cost above the ceiling clamps to 0; cost term dropped when optimization is off")
        void costTerm() {
            StubProvider pricey = new StubProvider(StubProvider.descriptor("p", 1.0, Map.of(),
                EnumSet.allOf(OperationKind.class), 25.0, 100, 10));
            assertEquals(0.3, selector.score(pricey, BusinessSearchQuery.empty()), 1e-9);

            ProviderSelector noCost = new ProviderSelector(registry,
                GatewaySettings.builder().costOptimizationEnabled(false).build());
            assertEquals(0.3, noCost.score(StubProvider.named("free", 1.0, Map.of()), BusinessSearchQuery.empty()), 1e-9);
        }

        @Test
        @DisplayName("unknown country contributes no coverage")
        void unknownCountry() {
            StubProvider p = StubProvider.named("p", 1.0, Map.of("US", 1.0));
            BusinessSearchQuery query = BusinessSearchQuery.builder().country("ZZ").build();
            assertEquals(0.3 + 0.2, selector.score(p, query), 1e-9);
        }
    }
}
