package com.registrygateway.gateway.provider;

import com.registrygateway.common.model.Address;
import com.registrygateway.common.model.BusinessData;
import com.registrygateway.common.model.ValidationIssue;
import com.registrygateway.common.model.ValidationResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Field-completeness rules shared by the bundled adapters' {@code validateData}.
 *
 * <p>Five fields are checked: company name, registration number, street, city and
 * country. A record without a company name is invalid; any other gap only lowers the
 * score. The score is the provider's base quality scaled by the share of checked
 * fields present, so a complete record scores exactly the base quality.
 */
public final class BusinessDataValidator {

    static final String COMPANY_NAME        = "company_name";
    static final String REGISTRATION_NUMBER = "registration_number";
    static final String STREET              = "address.street1";
    static final String CITY                = "address.city";
    static final String COUNTRY             = "address.country";

    private static final int CHECKED_FIELDS = 5;

    private BusinessDataValidator() { /* utility class */ }

    public static ValidationResult validate(BusinessData data, double baseQuality) {
        if (data == null) {
            return new ValidationResult(false, 0.0, List.of(ValidationIssue.missing("record")));
        }
        List<ValidationIssue> issues = new ArrayList<>();
        Address address = data.address();

        check(data.companyName(), COMPANY_NAME, issues);
        check(data.registrationNumber(), REGISTRATION_NUMBER, issues);
        check(address.street1(), STREET, issues);
        check(address.city(), CITY, issues);
        check(address.country(), COUNTRY, issues);

        if (data.dataQuality() < 0.0 || data.dataQuality() > 1.0) {
            issues.add(new ValidationIssue("data_quality", "out_of_range",
                "data_quality must be within [0,1] but was " + data.dataQuality()));
        }

        long missing = issues.stream().filter(i -> "missing".equals(i.type())).count();
        double completeness = (double) (CHECKED_FIELDS - missing) / CHECKED_FIELDS;
        double score = clamp(baseQuality) * completeness;
        boolean valid = issues.stream().noneMatch(i -> COMPANY_NAME.equals(i.field()))
            && issues.stream().noneMatch(i -> "out_of_range".equals(i.type()));

        return new ValidationResult(valid, score, issues);
    }

    private static void check(String value, String field, List<ValidationIssue> issues) {
        if (value == null || value.isBlank()) {
            issues.add(ValidationIssue.missing(field));
        }
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
