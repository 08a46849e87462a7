package com.registrygateway.gateway.provider;

import com.registrygateway.common.model.BusinessData;
import com.registrygateway.common.model.BusinessSearchQuery;
import com.registrygateway.common.model.ComplianceData;
import com.registrygateway.common.model.FinancialData;
import com.registrygateway.common.model.NewsItem;
import com.registrygateway.common.model.OperationKind;
import com.registrygateway.common.model.QuotaInfo;
import com.registrygateway.common.model.ValidationResult;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Capability contract every external business-data source is wrapped behind.
 * The gateway depends on nothing else about a source.
 *
 * <p>Lookups are lazy {@link Mono}s: nothing is sent upstream until subscription, and a
 * cancelled subscription abandons the call. Failures should be signalled as
 * {@link com.registrygateway.common.exception.ProviderException}; only those trigger
 * the gateway's fallback hop.
 */
public interface BusinessDataProvider {

    /** Static metadata fixed at registration: capabilities, coverage, cost, rate limit. */
    ProviderDescriptor descriptor();

    default String name() {
        return descriptor().name();
    }

    default String type() {
        return descriptor().type();
    }

    default double costPerOperation(OperationKind operation) {
        return descriptor().costs().costFor(operation);
    }

    boolean isHealthy();

    /** Health is toggled externally (operators, monitors); the gateway only reads it. */
    void setHealthy(boolean healthy);

    QuotaInfo quota();

    Mono<BusinessData> searchBusiness(BusinessSearchQuery query);

    Mono<BusinessData> getBusinessDetails(String businessId);

    Mono<FinancialData> getFinancialData(String businessId);

    Mono<ComplianceData> getComplianceData(String businessId);

    Mono<List<NewsItem>> getNewsData(String businessId);

    ValidationResult validateData(BusinessData data);
}
