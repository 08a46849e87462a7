package com.registrygateway.common.model;

public record Address(
    String street1,
    String street2,
    String city,
    String state,
    String postalCode,
    String country
) {
    public static Address empty() {
        return new Address(null, null, null, null, null, null);
    }
}
