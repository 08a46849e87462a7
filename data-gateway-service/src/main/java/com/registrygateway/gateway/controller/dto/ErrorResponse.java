package com.registrygateway.gateway.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.registrygateway.common.exception.GatewayException;

/** Error body returned for every gateway failure. {@code provider} is omitted when unknown. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    @JsonProperty("error")    String error,
    @JsonProperty("message")  String message,
    @JsonProperty("provider") String provider,
    @JsonProperty("traceId")  String traceId
) {

    public static ErrorResponse of(GatewayException e, String traceId) {
        return new ErrorResponse(e.getClass().getSimpleName(), e.getMessage(), e.getProviderName(), traceId);
    }
}
