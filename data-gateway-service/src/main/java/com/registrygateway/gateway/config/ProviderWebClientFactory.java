package com.registrygateway.gateway.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Builds one {@link WebClient} per live provider: netty connect/response/read timeouts,
 * a fixed {@code User-Agent}, 5xx responses turned into errors, credentials masked in
 * request logs.
 */
@Component
public class ProviderWebClientFactory {

    private static final Logger log = LoggerFactory.getLogger(ProviderWebClientFactory.class);

    static final String DEFAULT_USER_AGENT = "registry-gateway/1.0 (ops@registrygateway.example)";

    private final WebClient.Builder builder;

    public ProviderWebClientFactory(WebClient.Builder builder) {
        this.builder = builder;
    }

    public WebClient create(String providerName, String baseUrl, String userAgent, Duration timeout) {
        long timeoutMs = timeout == null || timeout.isZero() || timeout.isNegative() ? 15_000 : timeout.toMillis();
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeoutMs, 10_000))
            .responseTimeout(Duration.ofMillis(timeoutMs))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS))
            );

        return builder.clone()
            .baseUrl(baseUrl)
            .defaultHeader(HttpHeaders.USER_AGENT, userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(serverErrorFilter(providerName))
            .filter(loggingFilter(providerName))
            .build();
    }

    private ExchangeFilterFunction serverErrorFilter(String providerName) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return Mono.error(new IllegalStateException(
                    providerName + " server error: " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter(String providerName) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String sanitized = sanitize(clientRequest.url().toString());
            log.debug("OUTBOUND_REQUEST provider={} method={} url={}", providerName, clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }

    static String sanitize(String url) {
        return url.replaceAll("(?i)(api_?key|token|secret)=[^&]+", "$1=***");
    }
}
