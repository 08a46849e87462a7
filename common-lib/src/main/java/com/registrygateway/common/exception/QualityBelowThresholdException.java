package com.registrygateway.common.exception;

import com.registrygateway.common.model.ValidationIssue;

import java.util.List;
import java.util.Locale;

/** A record was obtained but its validated quality score is under the configured threshold. */
public class QualityBelowThresholdException extends GatewayException {
    private final double qualityScore;
    private final double threshold;
    private final List<ValidationIssue> issues;

    public QualityBelowThresholdException(String providerName, double qualityScore, double threshold,
                                          List<ValidationIssue> issues) {
        super(providerName, String.format(Locale.ROOT,
            "data quality %.2f from provider %s is below threshold %.2f", qualityScore, providerName, threshold));
        this.qualityScore = qualityScore;
        this.threshold = threshold;
        this.issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public double getQualityScore() {
        return qualityScore;
    }

    public double getThreshold() {
        return threshold;
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }
}
