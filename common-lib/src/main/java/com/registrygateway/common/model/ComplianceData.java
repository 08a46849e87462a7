package com.registrygateway.common.model;

import java.time.Instant;
import java.util.List;

public record ComplianceData(
    String regulatoryStatus,
    double complianceScore,
    String riskLevel,
    List<String> sanctions,
    List<String> licenses,
    Instant lastChecked
) {
    public ComplianceData {
        sanctions = sanctions == null ? List.of() : List.copyOf(sanctions);
        licenses  = licenses == null ? List.of() : List.copyOf(licenses);
    }
}
