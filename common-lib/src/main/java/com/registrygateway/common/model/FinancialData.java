package com.registrygateway.common.model;

public record FinancialData(
    int fiscalYear,
    double revenue,
    double netIncome,
    double totalAssets,
    double totalLiabilities,
    int employeeCount,
    String currency
) {}
