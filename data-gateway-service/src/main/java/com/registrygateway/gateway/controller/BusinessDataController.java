package com.registrygateway.gateway.controller;

import com.registrygateway.common.exception.GatewayException;
import com.registrygateway.common.exception.NoProviderAvailableException;
import com.registrygateway.common.exception.ProviderNotFoundException;
import com.registrygateway.common.exception.QualityBelowThresholdException;
import com.registrygateway.common.exception.RateLimitedException;
import com.registrygateway.common.model.BusinessSearchQuery;
import com.registrygateway.common.trace.TraceContextUtil;
import com.registrygateway.gateway.controller.dto.ErrorResponse;
import com.registrygateway.gateway.controller.dto.ProviderStatus;
import com.registrygateway.gateway.service.BusinessDataGatewayService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST facade over {@link BusinessDataGatewayService}.
 * Gateway failures become an {@link ErrorResponse} with a status chosen by {@link #statusFor}.
 */
@RestController
@RequestMapping("/api/v1/business-data")
public class BusinessDataController {

    private static final Logger log = LoggerFactory.getLogger(BusinessDataController.class);

    private final BusinessDataGatewayService gatewayService;

    public BusinessDataController(BusinessDataGatewayService gatewayService) {
        this.gatewayService = gatewayService;
    }

    @PostMapping("/search")
    public Mono<ResponseEntity<Object>> search(
            @RequestBody(required = false) BusinessSearchQuery query,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolveTraceId(traceHeader);
        TraceContextUtil.withMdc(traceId, () ->
            log.info("SEARCH_REQUESTED companyName={} country={}",
                query == null ? null : query.companyName(), query == null ? null : query.country()));
        return respond(gatewayService.searchBusiness(query), traceId);
    }

    @GetMapping("/{id}/details")
    public Mono<ResponseEntity<Object>> details(
            @PathVariable String id,
            @RequestParam(value = "provider", required = false) String provider,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolveTraceId(traceHeader);
        return respond(gatewayService.getBusinessDetails(id, provider), traceId);
    }

    @GetMapping("/{id}/financial")
    public Mono<ResponseEntity<Object>> financial(
            @PathVariable String id,
            @RequestParam(value = "provider", required = false) String provider,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolveTraceId(traceHeader);
        return respond(gatewayService.getFinancialData(id, provider), traceId);
    }

    @GetMapping("/{id}/compliance")
    public Mono<ResponseEntity<Object>> compliance(
            @PathVariable String id,
            @RequestParam(value = "provider", required = false) String provider,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolveTraceId(traceHeader);
        return respond(gatewayService.getComplianceData(id, provider), traceId);
    }

    @GetMapping("/{id}/news")
    public Mono<ResponseEntity<Object>> news(
            @PathVariable String id,
            @RequestParam(value = "provider", required = false) String provider,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolveTraceId(traceHeader);
        return respond(gatewayService.getNewsData(id, provider), traceId);
    }

    @GetMapping("/providers")
    public ResponseEntity<List<ProviderStatus>> providers() {
        return ResponseEntity.ok(gatewayService.providers().stream().map(ProviderStatus::from).toList());
    }

    @PutMapping("/providers/{name}/health")
    public Mono<ResponseEntity<Object>> setHealth(
            @PathVariable String name,
            @RequestParam("healthy") boolean healthy,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolveTraceId(traceHeader);
        return respond(Mono.fromCallable(() -> ProviderStatus.from(gatewayService.setProviderHealth(name, healthy))), traceId);
    }

    @DeleteMapping("/providers/{name}")
    public Mono<ResponseEntity<Object>> unregister(
            @PathVariable String name,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolveTraceId(traceHeader);
        return respond(Mono.fromCallable(() -> ProviderStatus.from(gatewayService.unregisterProvider(name))), traceId);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private <T> Mono<ResponseEntity<Object>> respond(Mono<T> result, String traceId) {
        return TraceContextUtil.withTraceId(
            result
                .map(body -> ResponseEntity.<Object>ok(body))
                .onErrorResume(GatewayException.class, e -> {
                    HttpStatus status = statusFor(e);
                    TraceContextUtil.withMdc(traceId, () ->
                        log.warn("REQUEST_FAILED status={} error={} message={}",
                            status.value(), e.getClass().getSimpleName(), e.getMessage()));
                    return Mono.just(ResponseEntity.status(status).<Object>body(ErrorResponse.of(e, traceId)));
                }),
            traceId);
    }

    static HttpStatus statusFor(GatewayException e) {
        if (e instanceof NoProviderAvailableException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        if (e instanceof RateLimitedException) {
            return HttpStatus.TOO_MANY_REQUESTS;
        }
        if (e instanceof ProviderNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof QualityBelowThresholdException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        return HttpStatus.BAD_GATEWAY;
    }
}
