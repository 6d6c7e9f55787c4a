package com.example.campaign.delivery.transport;

import com.example.campaign.shared.config.AppProperties;
import com.example.campaign.shared.model.Subscriber;
import io.github.resilience4j.bulkhead.annotation.Bulkhead;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Posts each notification to the push gateway, which handles VAPID signing and payload encryption
 * toward the browser push services.
 *
 * <p>Status mapping: 2xx delivered, 404/410 gone, 408/425/429 transient, 5xx and transport errors
 * transient (and counted by the circuit breaker), any other 4xx rejected.
 */
@Component
@Slf4j
public class HttpPushTransport implements PushTransport {

    static final String GATEWAY = "pushGateway";

    private final WebClient pushWebClient;
    private final Duration timeout;

    public HttpPushTransport(WebClient pushWebClient, AppProperties appProperties) {
        this.pushWebClient = pushWebClient;
        this.timeout = appProperties.getPush().getTimeout();
    }

    @Override
    @CircuitBreaker(name = GATEWAY, fallbackMethod = "gatewayUnavailable")
    @Bulkhead(name = GATEWAY, fallbackMethod = "gatewayUnavailable")
    public PushResult send(Subscriber subscriber, PushPayload payload) {
        return pushWebClient.post()
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(GatewayRequest.of(subscriber, payload))
                .exchangeToMono(response -> response.releaseBody()
                        .then(Mono.fromCallable(() -> classify(response.statusCode()))))
                .timeout(timeout)
                .onErrorMap(TimeoutException.class,
                        e -> new PushGatewayUnavailableException("Push gateway timed out after " + timeout, e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new PushGatewayUnavailableException("Push gateway unreachable: " + e.getMessage(), e))
                .block();
    }

    PushResult gatewayUnavailable(Subscriber subscriber, PushPayload payload, Throwable cause) {
        log.debug("Push to subscriber {} deferred: {}", subscriber.getId(), cause.getMessage());
        return PushResult.transientFailure(cause.getMessage());
    }

    static PushResult classify(HttpStatusCode status) {
        int code = status.value();
        if (status.is2xxSuccessful()) {
            return PushResult.delivered();
        }
        if (code == 404 || code == 410) {
            return PushResult.gone("Subscription expired (HTTP " + code + ")");
        }
        if (code == 408 || code == 425 || code == 429) {
            return PushResult.transientFailure("HTTP " + code);
        }
        if (status.is5xxServerError()) {
            throw new PushGatewayUnavailableException("Push gateway returned HTTP " + code);
        }
        return PushResult.rejected("HTTP " + code);
    }

    @Value
    @Builder
    static class GatewayRequest {
        String endpoint;
        String p256dh;
        String auth;
        int ttl;
        PushPayload notification;

        static GatewayRequest of(Subscriber subscriber, PushPayload payload) {
            return GatewayRequest.builder()
                    .endpoint(subscriber.getEndpoint())
                    .p256dh(subscriber.getP256dh())
                    .auth(subscriber.getAuthSecret())
                    .ttl(payload.getTtlSeconds())
                    .notification(payload)
                    .build();
        }
    }
}
