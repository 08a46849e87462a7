package com.registrygateway.gateway.provider.sec;

import com.fasterxml.jackson.databind.JsonNode;
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
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Live adapter for the SEC EDGAR public APIs ({@code data.sec.gov}).
 *
 * <ul>
 *   <li>details / search → {@code /submissions/CIK##########.json}</li>
 *   <li>financial → {@code /api/xbrl/companyfacts/CIK##########.json}, latest annual (10-K, FY) facts</li>
 * </ul>
 *
 * <p>EDGAR keys filers by CIK, so search needs a registration number holding the CIK.
 * Compliance screening and news are not offered. Every transport or parse failure is
 * reported as a {@link ProviderException}.
 */
public class SecEdgarProvider implements BusinessDataProvider {

    private static final Logger log = LoggerFactory.getLogger(SecEdgarProvider.class);

    public static final String TYPE = "sec";
    static final String DISPLAY_NAME = "SEC EDGAR";

    private static final Set<OperationKind> NATIVE_OPERATIONS =
        EnumSet.of(OperationKind.SEARCH, OperationKind.DETAILS, OperationKind.FINANCIAL);

    private static final List<String> REVENUE_CONCEPTS =
        List.of("Revenues", "RevenueFromContractWithCustomerExcludingAssessedTax", "SalesRevenueNet");

    private final ProviderDescriptor descriptor;
    private final WebClient webClient;
    private final QuotaCounter quota;
    private final Clock clock;
    private volatile boolean healthy = true;

    public SecEdgarProvider(ProviderDescriptor descriptor, WebClient webClient, Clock clock) {
        this.descriptor = descriptor.capabilities().isEmpty()
            ? descriptor.withCapabilities(NATIVE_OPERATIONS)
            : descriptor;
        this.webClient  = webClient;
        this.clock      = clock;
        this.quota      = QuotaCounter.forRateLimit(descriptor.rateLimitPerMinute(), clock);
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
        if (query.registrationNumber() == null || query.registrationNumber().isBlank()) {
            return Mono.error(new ProviderException(name(),
                DISPLAY_NAME + " search requires a CIK registration number"));
        }
        Mono<BusinessData> details = getBusinessDetails(query.registrationNumber());
        if (!query.includeFinancial()) {
            return details;
        }
        return details.flatMap(record -> getFinancialData(query.registrationNumber())
            .map(financial -> withFinancial(record, financial))
            .onErrorResume(ProviderException.class, e -> {
                log.warn("[SEC] financial facts unavailable, returning profile only. cik={} reason={}",
                    query.registrationNumber(), e.getMessage());
                return Mono.just(record);
            }));
    }

    @Override
    public Mono<BusinessData> getBusinessDetails(String businessId) {
        return Mono.defer(() -> {
            String cik = normalizeCik(businessId);
            quota.recordCall();
            return webClient.get()
                .uri("/submissions/CIK{cik}.json", cik)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(json -> mapSubmission(cik, json));
        }).onErrorMap(e -> !(e instanceof ProviderException),
            e -> new ProviderException(name(), DISPLAY_NAME + " submissions request failed: " + e.getMessage(), e))
          .doOnSuccess(r -> log.info("[SEC] submissions fetched. id={} name={}",
            r == null ? null : r.id(), r == null ? null : r.companyName()));
    }

    @Override
    public Mono<FinancialData> getFinancialData(String businessId) {
        return Mono.defer(() -> {
            String cik = normalizeCik(businessId);
            quota.recordCall();
            return webClient.get()
                .uri("/api/xbrl/companyfacts/CIK{cik}.json", cik)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(json -> mapCompanyFacts(cik, json));
        }).onErrorMap(e -> !(e instanceof ProviderException),
            e -> new ProviderException(name(), DISPLAY_NAME + " company facts request failed: " + e.getMessage(), e));
    }

    @Override
    public Mono<ComplianceData> getComplianceData(String businessId) {
        return unsupported(OperationKind.COMPLIANCE);
    }

    @Override
    public Mono<List<NewsItem>> getNewsData(String businessId) {
        return unsupported(OperationKind.NEWS);
    }

    @Override
    public ValidationResult validateData(BusinessData data) {
        return BusinessDataValidator.validate(data, descriptor.qualityScore());
    }

    // ── mapping ─────────────────────────────────────────────────────────────

    private BusinessData mapSubmission(String cik, JsonNode root) {
        String companyName = text(root, "name");
        if (companyName == null) {
            throw new ProviderException(name(), "No filer found in " + DISPLAY_NAME + " for CIK " + cik);
        }
        JsonNode business = root.path("addresses").path("business");
        Address address = new Address(
            text(business, "street1"),
            text(business, "street2"),
            text(business, "city"),
            text(business, "stateOrCountry"),
            text(business, "zipCode"),
            "US");

        List<String> industryCodes = new ArrayList<>();
        String sic = text(root, "sic");
        if (sic != null) {
            industryCodes.add("SIC:" + sic);
        }

        return new BusinessData(
            BusinessData.namespacedId(name(), cik),
            companyName,
            companyName,
            cik,
            text(root, "ein"),
            address,
            industryCodes,
            null,
            null,
            List.of(),
            descriptor.qualityScore(),
            descriptor.qualityScore() * descriptor.coverage().getOrDefault("US", 1.0),
            name(),
            clock.instant());
    }

    private FinancialData mapCompanyFacts(String cik, JsonNode root) {
        JsonNode gaap = root.path("facts").path("us-gaap");
        if (gaap.isMissingNode()) {
            throw new ProviderException(name(), "No us-gaap facts in " + DISPLAY_NAME + " for CIK " + cik);
        }
        AnnualFact revenue = null;
        for (String concept : REVENUE_CONCEPTS) {
            revenue = latestAnnual(gaap, concept);
            if (revenue != null) break;
        }
        AnnualFact netIncome   = latestAnnual(gaap, "NetIncomeLoss");
        AnnualFact assets      = latestAnnual(gaap, "Assets");
        AnnualFact liabilities = latestAnnual(gaap, "Liabilities");

        int fiscalYear = revenue != null ? revenue.fiscalYear()
            : assets != null ? assets.fiscalYear() : 0;
        if (fiscalYear == 0) {
            throw new ProviderException(name(), "No annual financial facts in " + DISPLAY_NAME + " for CIK " + cik);
        }
        return new FinancialData(
            fiscalYear,
            revenue == null ? 0.0 : revenue.value(),
            netIncome == null ? 0.0 : netIncome.value(),
            assets == null ? 0.0 : assets.value(),
            liabilities == null ? 0.0 : liabilities.value(),
            0,
            "USD");
    }

    /** Latest 10-K full-year USD value for {@code concept}, or {@code null}. */
    private static AnnualFact latestAnnual(JsonNode gaap, String concept) {
        JsonNode entries = gaap.path(concept).path("units").path("USD");
        if (!entries.isArray()) return null;
        AnnualFact best = null;
        String bestEnd = "";
        for (JsonNode entry : entries) {
            if (!"10-K".equals(entry.path("form").asText()) || !"FY".equals(entry.path("fp").asText())) {
                continue;
            }
            int fy = entry.path("fy").asInt(0);
            String end = entry.path("end").asText("");
            if (best == null || fy > best.fiscalYear() || (fy == best.fiscalYear() && end.compareTo(bestEnd) > 0)) {
                best = new AnnualFact(fy, entry.path("val").asDouble());
                bestEnd = end;
            }
        }
        return best;
    }

    private record AnnualFact(int fiscalYear, double value) {}

    // ── helpers ─────────────────────────────────────────────────────────────

    private String normalizeCik(String businessId) {
        String raw = BusinessData.nativeId(name(), businessId);
        String digits = raw == null ? "" : raw.trim();
        if (digits.isEmpty() || digits.length() > 10 || !digits.chars().allMatch(Character::isDigit)) {
            throw new ProviderException(name(), "Invalid CIK: " + businessId);
        }
        return "0".repeat(10 - digits.length()) + digits;
    }

    private <T> Mono<T> unsupported(OperationKind operation) {
        return Mono.error(new ProviderException(name(), operation.description() + " not available from " + DISPLAY_NAME));
    }

    private static BusinessData withFinancial(BusinessData r, FinancialData financial) {
        return new BusinessData(r.id(), r.companyName(), r.legalName(), r.registrationNumber(), r.taxId(),
            r.address(), r.industryCodes(), financial, r.compliance(), r.news(), r.dataQuality(),
            r.confidence(), r.providerName(), r.lastUpdated());
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) return null;
        String s = value.asText();
        return s.isBlank() ? null : s;
    }
}
