package com.registrygateway.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A business search request. Every field is optional; an empty query is valid
 * and simply resolves to the best-scoring healthy provider.
 *
 * <p>The optional-data flags ({@code includeFinancial}, {@code includeCompliance},
 * {@code includeNews}) both request the extra sub-records and steer provider
 * selection towards providers that can supply them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BusinessSearchQuery(
    String companyName,
    String registrationNumber,
    String taxId,
    String country,
    String state,
    String city,
    String industry,
    boolean includeFinancial,
    boolean includeCompliance,
    boolean includeNews,
    int maxResults,
    String sortBy
) {

    public static BusinessSearchQuery empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Number of optional feature groups (financial, compliance, news) requested. */
    @JsonIgnore
    public int requestedFeatureCount() {
        return (includeFinancial ? 1 : 0) + (includeCompliance ? 1 : 0) + (includeNews ? 1 : 0);
    }

    public static final class Builder {
        private String companyName;
        private String registrationNumber;
        private String taxId;
        private String country;
        private String state;
        private String city;
        private String industry;
        private boolean includeFinancial;
        private boolean includeCompliance;
        private boolean includeNews;
        private int maxResults;
        private String sortBy;

        private Builder() {}

        public Builder companyName(String companyName) { this.companyName = companyName; return this; }
        public Builder registrationNumber(String registrationNumber) { this.registrationNumber = registrationNumber; return this; }
        public Builder taxId(String taxId) { this.taxId = taxId; return this; }
        public Builder country(String country) { this.country = country; return this; }
        public Builder state(String state) { this.state = state; return this; }
        public Builder city(String city) { this.city = city; return this; }
        public Builder industry(String industry) { this.industry = industry; return this; }
        public Builder includeFinancial(boolean includeFinancial) { this.includeFinancial = includeFinancial; return this; }
        public Builder includeCompliance(boolean includeCompliance) { this.includeCompliance = includeCompliance; return this; }
        public Builder includeNews(boolean includeNews) { this.includeNews = includeNews; return this; }
        public Builder maxResults(int maxResults) { this.maxResults = maxResults; return this; }
        public Builder sortBy(String sortBy) { this.sortBy = sortBy; return this; }

        public BusinessSearchQuery build() {
            return new BusinessSearchQuery(companyName, registrationNumber, taxId, country, state, city,
                industry, includeFinancial, includeCompliance, includeNews, maxResults, sortBy);
        }
    }
}
