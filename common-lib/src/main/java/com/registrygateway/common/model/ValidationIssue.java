package com.registrygateway.common.model;

public record ValidationIssue(String field, String type, String message) {

    public static ValidationIssue missing(String field) {
        return new ValidationIssue(field, "missing", field + " is missing");
    }
}
