package com.registrygateway.gateway.provider;

import com.registrygateway.common.model.OperationKind;

/**
 * Per-call prices for one provider. An operation-specific price of zero (or less)
 * falls back to {@code perRequest}.
 */
public record CostTable(
    double perRequest,
    double perSearch,
    double perDetail,
    double perFinancial,
    double perCompliance,
    double perNews
) {

    public static CostTable flat(double perRequest) {
        return new CostTable(perRequest, 0, 0, 0, 0, 0);
    }

    public double costFor(OperationKind operation) {
        double specific = switch (operation) {
            case SEARCH     -> perSearch;
            case DETAILS    -> perDetail;
            case FINANCIAL  -> perFinancial;
            case COMPLIANCE -> perCompliance;
            case NEWS       -> perNews;
        };
        return specific > 0 ? specific : Math.max(0.0, perRequest);
    }
}
