package com.registrygateway.gateway.provider.sandbox;

import com.registrygateway.common.exception.ProviderException;
import com.registrygateway.common.model.Address;
import com.registrygateway.common.model.BusinessData;
import com.registrygateway.common.model.BusinessSearchQuery;
import com.registrygateway.common.model.ComplianceData;
import com.registrygateway.common.model.FinancialData;
import com.registrygateway.common.model.NewsItem;
import com.registrygateway.common.model.OperationKind;
import com.registrygateway.common.model.QuotaInfo;
import com.registrygateway.common.model.ValidationResult;
import com.registrygateway.gateway.provider.BusinessDataProvider;
import com.registrygateway.gateway.provider.BusinessDataValidator;
import com.registrygateway.gateway.provider.ProviderDescriptor;
import com.registrygateway.gateway.provider.QuotaCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Base for the sandbox adapters: deterministic, offline stand-ins for commercial
 * registries whose contracts are not available in every environment.
 *
 * <p>Records are synthesized from the request itself (company name, registration number,
 * location) plus a stable per-id seed, so repeated calls return equal data. Each subclass
 * declares which operations its real counterpart offers; anything else fails with a
 * {@link ProviderException} exactly as the live source would refuse it.
 *
 * <p>When the descriptor advertises no capabilities, the adapter's native set is used.
 */
public abstract class AbstractSandboxProvider implements BusinessDataProvider {

    private static final Logger log = LoggerFactory.getLogger(AbstractSandboxProvider.class);

    private final ProviderDescriptor descriptor;
    private final Set<OperationKind> nativeOperations;
    private final String displayName;
    private final QuotaCounter quota;
    private final Clock clock;
    private volatile boolean healthy = true;

    protected AbstractSandboxProvider(ProviderDescriptor descriptor, Set<OperationKind> nativeOperations,
                                      String displayName, Clock clock) {
        this.descriptor = descriptor.capabilities().isEmpty()
            ? descriptor.withCapabilities(nativeOperations)
            : descriptor;
        this.nativeOperations = Set.copyOf(nativeOperations);
        this.displayName      = displayName;
        this.clock            = clock;
        this.quota            = QuotaCounter.forRateLimit(descriptor.rateLimitPerMinute(), clock);
    }

    @Override
    public ProviderDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public boolean isHealthy() {
        return healthy;
    }

    @Override
    public void setHealthy(boolean healthy) {
        this.healthy = healthy;
    }

    @Override
    public QuotaInfo quota() {
        return quota.snapshot();
    }

    @Override
    public Mono<BusinessData> searchBusiness(BusinessSearchQuery query) {
        return call(OperationKind.SEARCH, () -> {
            String nativeId = nativeIdFor(query);
            boolean financial  = query.includeFinancial() && nativeOperations.contains(OperationKind.FINANCIAL);
            boolean compliance = query.includeCompliance() && nativeOperations.contains(OperationKind.COMPLIANCE);
            boolean news       = query.includeNews() && nativeOperations.contains(OperationKind.NEWS);
            return buildRecord(nativeId, query.companyName(), query.registrationNumber(), query.taxId(),
                new Address("1 Market Street", null,
                    orDefault(query.city(), "New York"),
                    orDefault(query.state(), "NY"),
                    "10001",
                    orDefault(query.country(), "US")),
                financial ? financialFor(nativeId) : null,
                compliance ? complianceFor(nativeId) : null,
                news ? newsFor(nativeId) : List.of(),
                query.country());
        });
    }

    @Override
    public Mono<BusinessData> getBusinessDetails(String businessId) {
        return call(OperationKind.DETAILS, businessId, nativeId ->
            buildRecord(nativeId, "Business " + nativeId, nativeId, null,
                new Address("1 Market Street", null, "New York", "NY", "10001", "US"),
                null, null, List.of(), "US"));
    }

    @Override
    public Mono<FinancialData> getFinancialData(String businessId) {
        return call(OperationKind.FINANCIAL, businessId, this::financialFor);
    }

    @Override
    public Mono<ComplianceData> getComplianceData(String businessId) {
        return call(OperationKind.COMPLIANCE, businessId, this::complianceFor);
    }

    @Override
    public Mono<List<NewsItem>> getNewsData(String businessId) {
        return call(OperationKind.NEWS, businessId, this::newsFor);
    }

    @Override
    public ValidationResult validateData(BusinessData data) {
        return BusinessDataValidator.validate(data, descriptor.qualityScore());
    }

    // ── synthesis hooks ─────────────────────────────────────────────────────

    /** Industry classification codes attached to every record from this source. */
    protected List<String> industryCodes() {
        return List.of("NAICS:541511");
    }

    protected FinancialData financialFor(String nativeId) {
        double scale = 1.0 + seed(nativeId) / 100.0;
        return new FinancialData(2023, 10_000_000 * scale, 1_200_000 * scale, 25_000_000 * scale,
            11_000_000 * scale, (int) (120 * scale), "USD");
    }

    protected ComplianceData complianceFor(String nativeId) {
        return new ComplianceData("compliant", 0.92, "low", List.of(),
            List.of("business-registration"), clock.instant());
    }

    protected List<NewsItem> newsFor(String nativeId) {
        Instant now = clock.instant();
        return List.of(
            new NewsItem(nativeId + " reports quarterly results", "Revenue in line with guidance.",
                displayName, null, now.minus(Duration.ofDays(1)), 0.3),
            new NewsItem(nativeId + " expands regional operations", "New office announced.",
                displayName, null, now.minus(Duration.ofDays(7)), 0.5));
    }

    // ── internals ───────────────────────────────────────────────────────────

    private <T> Mono<T> call(OperationKind operation, Supplier<T> body) {
        return Mono.defer(() -> {
            if (!nativeOperations.contains(operation)) {
                return Mono.error(new ProviderException(name(),
                    operation.description() + " not available from " + displayName));
            }
            quota.recordCall();
            log.debug("SANDBOX_CALL provider={} operation={}", name(), operation.code());
            return Mono.fromSupplier(body);
        });
    }

    private <T> Mono<T> call(OperationKind operation, String businessId, Function<String, T> body) {
        String nativeId = BusinessData.nativeId(name(), businessId);
        if (nativeId == null || nativeId.isBlank()) {
            return Mono.error(new ProviderException(name(), "business id must not be blank"));
        }
        return call(operation, () -> body.apply(nativeId));
    }

    private BusinessData buildRecord(String nativeId, String companyName, String registrationNumber,
                                     String taxId, Address address, FinancialData financial,
                                     ComplianceData compliance, List<NewsItem> news, String country) {
        double quality = descriptor.qualityScore();
        double coverage = country == null ? 1.0 : descriptor.coverage().getOrDefault(country, 0.5);
        return new BusinessData(
            BusinessData.namespacedId(name(), nativeId),
            companyName,
            companyName == null ? null : companyName + " Inc.",
            orDefault(registrationNumber, nativeId),
            taxId,
            address,
            industryCodes(),
            financial,
            compliance,
            news,
            quality,
            quality * coverage,
            name(),
            clock.instant());
    }

    private String nativeIdFor(BusinessSearchQuery query) {
        if (query.registrationNumber() != null && !query.registrationNumber().isBlank()) {
            return query.registrationNumber();
        }
        String basis = orDefault(query.companyName(), "") + "|" + orDefault(query.taxId(), "")
            + "|" + orDefault(query.country(), "");
        return String.format("%s-%08x", type(), basis.hashCode());
    }

    private static int seed(String nativeId) {
        return Math.floorMod(nativeId.hashCode(), 50);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
