package com.registrygateway.common.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The five operations every data provider may support. Doubles as the provider
 * capability vocabulary and as the key into a provider's cost table.
 */
public enum OperationKind {
    SEARCH("search", "business search"),
    DETAILS("details", "business details"),
    FINANCIAL("financial", "financial data"),
    COMPLIANCE("compliance", "compliance data"),
    NEWS("news", "news data");

    private static final Map<String, OperationKind> BY_CODE = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(OperationKind::code, Function.identity()));

    private final String code;
    private final String description;

    OperationKind(String code, String description) {
        this.code = code;
        this.description = description;
    }

    /** Lower-case identifier used in configuration and cache keys. */
    public String code() {
        return code;
    }

    /** Human-readable noun phrase used in error messages. */
    public String description() {
        return description;
    }

    /**
     * Resolves a configuration code ({@code "financial"}, {@code "NEWS"}, ...).
     *
     * @throws IllegalArgumentException for unknown codes
     */
    public static OperationKind fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("operation code must not be null");
        }
        OperationKind kind = BY_CODE.get(code.trim().toLowerCase(Locale.ROOT));
        if (kind == null) {
            throw new IllegalArgumentException("unknown operation code: " + code);
        }
        return kind;
    }
}
