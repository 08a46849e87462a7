package com.registrygateway.common.model;

import java.util.List;

public record ValidationResult(boolean isValid, double qualityScore, List<ValidationIssue> issues) {

    public ValidationResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public boolean hasIssue(String field, String type) {
        return issues.stream().anyMatch(i -> i.field().equals(field) && i.type().equals(type));
    }
}
