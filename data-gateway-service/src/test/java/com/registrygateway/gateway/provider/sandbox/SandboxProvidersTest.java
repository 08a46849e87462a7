package com.registrygateway.gateway.provider.sandbox;

import com.registrygateway.common.exception.ProviderException;
import com.registrygateway.common.model.BusinessData;
import com.registrygateway.common.model.BusinessSearchQuery;
import com.registrygateway.common.model.FinancialData;
import com.registrygateway.common.model.OperationKind;
import com.registrygateway.common.model.ValidationResult;
import com.registrygateway.gateway.provider.CostTable;
import com.registrygateway.gateway.provider.ProviderDescriptor;
import com.registrygateway.gateway.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SandboxProvidersTest {

    private final MutableClock clock = MutableClock.startingAt("2024-03-15T12:00:00Z");

    private static ProviderDescriptor descriptor(String name, int rate, Set<OperationKind> capabilities) {
        return new ProviderDescriptor(name, name, capabilities, 0.9, Map.of("US", 0.8),
            CostTable.flat(1.0), rate, 10);
    }

    private static ProviderDescriptor descriptor(String name, int rate) {
        return descriptor(name, rate, Set.of());
    }

    @Nested
    @DisplayName("capabilities and quota")
    class Capabilities {

        @Test
        @DisplayName("empty configured capabilities fall back to each source's native operations")
        void nativeCapabilities() {
            assertEquals(EnumSet.allOf(OperationKind.class),
                new DunBradstreetProvider(descriptor("dnb", 100), clock).descriptor().capabilities());
            assertEquals(EnumSet.of(OperationKind.SEARCH, OperationKind.DETAILS, OperationKind.FINANCIAL, OperationKind.COMPLIANCE),
                new ExperianProvider(descriptor("experian", 120), clock).descriptor().capabilities());
            assertEquals(EnumSet.of(OperationKind.SEARCH, OperationKind.DETAILS, OperationKind.FINANCIAL, OperationKind.NEWS),
                new BloombergProvider(descriptor("bloomberg", 200), clock).descriptor().capabilities());
            assertEquals(EnumSet.of(OperationKind.SEARCH, OperationKind.DETAILS, OperationKind.NEWS),
                new FactivaProvider(descriptor("factiva", 300), clock).descriptor().capabilities());
        }

        @Test
        @DisplayName("configured capabilities win over native ones")
        void configuredCapabilities() {
            ExperianProvider experian = new ExperianProvider(
                descriptor("experian", 120, EnumSet.of(OperationKind.SEARCH)), clock);
            assertEquals(Set.of(OperationKind.SEARCH), experian.descriptor().capabilities());
        }

        @Test
        @DisplayName("daily quota is ten times the per-minute rate")
        void quotaLimits() {
            assertEquals(1000, new DunBradstreetProvider(descriptor("dnb", 100), clock).quota().dailyLimit());
            assertEquals(1200, new ExperianProvider(descriptor("experian", 120), clock).quota().dailyLimit());
            assertEquals(2000, new BloombergProvider(descriptor("bloomberg", 200), clock).quota().dailyLimit());
            assertEquals(3000, new FactivaProvider(descriptor("factiva", 300), clock).quota().dailyLimit());
        }

        @Test
        @DisplayName("each subscribed call counts against quota; assembly alone does not")
        void quotaCountsCalls() {
            DunBradstreetProvider dnb = new DunBradstreetProvider(descriptor("dnb", 100), clock);
            var pending = dnb.getBusinessDetails("dnb:1");
            assertEquals(0, dnb.quota().dailyUsed());

            pending.block();
            dnb.getFinancialData("dnb:1").block();
            assertEquals(2, dnb.quota().dailyUsed());
            assertEquals(998, dnb.quota().remaining());
        }
    }

    @Nested
    @DisplayName("unsupported operations")
    class Unsupported {

        @Test
        @DisplayName("Factiva has no financial data")
        void factivaFinancial() {
            FactivaProvider factiva = new FactivaProvider(descriptor("factiva", 300), clock);
            StepVerifier.create(factiva.getFinancialData("factiva:1"))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(ProviderException.class, e);
                    assertEquals("financial data not available from Factiva", e.getMessage());
                    assertEquals("factiva", ((ProviderException) e).getProviderName());
                })
                .verify();
            assertEquals(0, factiva.quota().dailyUsed(), "refused calls are not counted");
        }

        @Test
        @DisplayName("Experian has no news, Bloomberg no compliance")
        void otherGaps() {
            StepVerifier.create(new ExperianProvider(descriptor("experian", 120), clock).getNewsData("x"))
                .expectErrorMessage("news data not available from Experian")
                .verify();
            StepVerifier.create(new BloombergProvider(descriptor("bloomberg", 200), clock).getComplianceData("x"))
                .expectErrorMessage("compliance data not available from Bloomberg")
                .verify();
        }

        @Test
        @DisplayName("null, blank or prefix-only business ids fail as provider errors without using quota")
        void missingBusinessId() {
            DunBradstreetProvider dnb = new DunBradstreetProvider(descriptor("dnb", 100), clock);

            StepVerifier.create(dnb.getFinancialData(null))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(ProviderException.class, e);
                    assertEquals("business id must not be blank", e.getMessage());
                    assertEquals("dnb", ((ProviderException) e).getProviderName());
                })
                .verify();
            StepVerifier.create(dnb.getBusinessDetails("  "))
                .expectError(ProviderException.class)
                .verify();
            StepVerifier.create(dnb.getNewsData("dnb:"))
                .expectError(ProviderException.class)
                .verify();
            assertEquals(0, dnb.quota().dailyUsed());
        }
    }

    @Nested
    @DisplayName("synthetic records")
    class Records {

        @Test
        @DisplayName("search echoes the query and attaches only requested, supported sections")
        void searchRecord() {
            BloombergProvider bloomberg = new BloombergProvider(descriptor("bloomberg", 200), clock);
            BusinessSearchQuery query = BusinessSearchQuery.builder()
                .companyName("Acme").registrationNumber("REG-1").country("US").city("Austin").state("TX")
                .includeFinancial(true).includeCompliance(true).includeNews(true).build();

            BusinessData data = bloomberg.searchBusiness(query).block();

            assertNotNull(data);
            assertEquals("bloomberg:REG-1", data.id());
            assertEquals("Acme", data.companyName());
            assertEquals("Austin", data.address().city());
            assertEquals("TX", data.address().state());
            assertEquals("bloomberg", data.providerName());
            assertNotNull(data.financial());
            assertNull(data.compliance(), "Bloomberg has no compliance feed");
            assertEquals(2, data.news().size());
            assertEquals(0.9, data.dataQuality(), 1e-9);
            assertEquals(0.9 * 0.8, data.confidence(), 1e-9);
            assertEquals(java.util.List.of("BICS:1010"), data.industryCodes());
        }

        @Test
        @DisplayName("search without a registration number derives a stable id")
        void derivedId() {
            DunBradstreetProvider dnb = new DunBradstreetProvider(descriptor("dnb", 100), clock);
            BusinessSearchQuery query = BusinessSearchQuery.builder().companyName("Acme").country("GB").build();

            BusinessData first = dnb.searchBusiness(query).block();
            BusinessData second = dnb.searchBusiness(query).block();

            assertEquals(first.id(), second.id());
            assertTrue(first.id().startsWith("dnb:dnb-"));
            assertEquals(0.9 * 0.5, first.confidence(), 1e-9, "uncovered country halves confidence");
        }

        @Test
        @DisplayName("financial data is deterministic and positive per business id")
        void financial() {
            ExperianProvider experian = new ExperianProvider(descriptor("experian", 120), clock);
            FinancialData a = experian.getFinancialData("experian:42").block();
            FinancialData b = experian.getFinancialData("experian:42").block();

            assertEquals(a, b);
            assertEquals(2023, a.fiscalYear());
            assertTrue(a.revenue() > 0);
            assertEquals("USD", a.currency());
        }

        @Test
        @DisplayName("records produced by sandbox search pass validation with the base quality")
        void validation() {
            DunBradstreetProvider dnb = new DunBradstreetProvider(descriptor("dnb", 100), clock);
            BusinessData data = dnb.searchBusiness(BusinessSearchQuery.builder().companyName("Acme").build()).block();

            ValidationResult result = dnb.validateData(data);
            assertTrue(result.isValid());
            assertEquals(0.9, result.qualityScore(), 1e-9);
        }

        @Test
        @DisplayName("search without a company name fails validation")
        void nameless() {
            DunBradstreetProvider dnb = new DunBradstreetProvider(descriptor("dnb", 100), clock);
            BusinessData data = dnb.searchBusiness(BusinessSearchQuery.empty()).block();

            ValidationResult result = dnb.validateData(data);
            assertFalse(result.isValid());
            assertTrue(result.hasIssue("company_name", "missing"));
        }
    }
}
