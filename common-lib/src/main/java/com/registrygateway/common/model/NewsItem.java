package com.registrygateway.common.model;

import java.time.Instant;

public record NewsItem(
    String title,
    String summary,
    String source,
    String url,
    Instant publishedDate,
    double sentiment    // -1 (negative) .. +1 (positive)
) {}
