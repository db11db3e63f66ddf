package com.example.podcast_backend.service.billing;

import com.example.podcast_backend.config.BillingProperties;
import com.example.podcast_backend.config.RetrySettings;
import com.example.podcast_backend.service.Interfaces.CreditLedgerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Credit ledger over HTTP. 2xx is a charge, 409 means the correlation id was already booked,
 * 429/5xx and connection errors are retried, anything else is a failed charge.
 */
@Component
public class HttpCreditLedgerClient implements CreditLedgerClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpCreditLedgerClient.class);
    static final String CHARGES_PATH = "/v1/ledger/charges";

    private final WebClient client;
    private final BillingProperties properties;

    public HttpCreditLedgerClient(@Qualifier("ledgerWebClient") WebClient client, BillingProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    @Override
    public Outcome charge(UUID userId, long amount, String correlationId) {
        RetrySettings retry = properties.getLedger().getRetry();
        Mono<Outcome> call = client.post()
                .uri(CHARGES_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .header("Idempotency-Key", correlationId)
                .bodyValue(Map.of(
                        "userId", userId.toString(),
                        "amount", amount,
                        "correlationId", correlationId))
                .exchangeToMono(resp -> toOutcome(resp.statusCode(), resp.bodyToMono(String.class).defaultIfEmpty("")))
                .retryWhen(Retry.backoff(Math.max(0, retry.getMaxAttempts() - 1), retry.getInitialBackoff())
                        .maxBackoff(retry.getMaxBackoff())
                        .filter(HttpCreditLedgerClient::isRetryable)
                        .doBeforeRetry(signal -> LOGGER.warn("LEDGER retry attempt={} correlationId={} cause={}",
                                signal.totalRetries() + 1, correlationId, signal.failure().toString())));

        try {
            Outcome outcome = call.block(blockTimeout(retry));
            return outcome == null ? Outcome.FAILED : outcome;
        } catch (RuntimeException e) {
            LOGGER.warn("LEDGER charge failed correlationId={} amount={} cause={}", correlationId, amount, e.toString());
            return Outcome.FAILED;
        }
    }

    private static Mono<Outcome> toOutcome(HttpStatusCode status, Mono<String> body) {
        if (status.is2xxSuccessful()) {
            return body.thenReturn(Outcome.SUCCESS);
        }
        if (status.value() == HttpStatus.CONFLICT.value()) {
            return body.thenReturn(Outcome.ALREADY_CHARGED);
        }
        if (status.is5xxServerError() || status.value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return body.flatMap(b -> Mono.error(new LedgerUnavailableException("Ledger %s: %s".formatted(status, b))));
        }
        return body.map(b -> {
            LOGGER.warn("LEDGER rejected status={} body={}", status, b);
            return Outcome.FAILED;
        });
    }

    private static boolean isRetryable(Throwable t) {
        return t instanceof LedgerUnavailableException || t instanceof WebClientRequestException;
    }

    private Duration blockTimeout(RetrySettings retry) {
        Duration perCall = properties.getLedger().getTimeout();
        return perCall.multipliedBy(Math.max(1, retry.getMaxAttempts()))
                .plus(retry.getMaxBackoff().multipliedBy(Math.max(0, retry.getMaxAttempts() - 1)));
    }

    static class LedgerUnavailableException extends RuntimeException {
        LedgerUnavailableException(String message) {
            super(message);
        }
    }
}
