package com.example.podcast_backend.service.billing;

import com.example.podcast_backend.config.BillingProperties;
import com.example.podcast_backend.config.RetrySettings;
import com.example.podcast_backend.service.Interfaces.CreditLedgerClient;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class HttpCreditLedgerClientTest {

    private static BillingProperties fastRetries() {
        BillingProperties props = new BillingProperties();
        props.getLedger().setRetry(new RetrySettings(3, Duration.ofMillis(1), Duration.ofMillis(5)));
        props.getLedger().setTimeout(Duration.ofSeconds(2));
        return props;
    }

    private static HttpCreditLedgerClient client(ExchangeFunction exchange) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://ledger.test")
                .exchangeFunction(exchange)
                .build();
        return new HttpCreditLedgerClient(webClient, fastRetries());
    }

    private static Mono<ClientResponse> respond(HttpStatus status) {
        return Mono.just(ClientResponse.create(status).body("{}").build());
    }

    @Test
    void correlationIdIsSentAsIdempotencyKey() {
        List<ClientRequest> seen = new ArrayList<>();
        HttpCreditLedgerClient ledger = client(request -> {
            seen.add(request);
            return respond(HttpStatus.CREATED);
        });

        CreditLedgerClient.Outcome outcome = ledger.charge(UUID.randomUUID(), 270, "assembly:job-1");

        assertThat(outcome).isEqualTo(CreditLedgerClient.Outcome.SUCCESS);
        assertThat(seen).hasSize(1);
        assertThat(seen.get(0).url().getPath()).isEqualTo(HttpCreditLedgerClient.CHARGES_PATH);
        assertThat(seen.get(0).headers().getFirst("Idempotency-Key")).isEqualTo("assembly:job-1");
    }

    @Test
    void conflictMeansAlreadyCharged() {
        HttpCreditLedgerClient ledger = client(request -> respond(HttpStatus.CONFLICT));

        assertThat(ledger.charge(UUID.randomUUID(), 1, "assembly:job-2")).isEqualTo(CreditLedgerClient.Outcome.ALREADY_CHARGED);
    }

    @Test
    void serverErrorsAreRetriedWithinTheBudget() {
        AtomicInteger calls = new AtomicInteger();
        HttpCreditLedgerClient ledger = client(request ->
                calls.incrementAndGet() < 3 ? respond(HttpStatus.SERVICE_UNAVAILABLE) : respond(HttpStatus.OK));

        assertThat(ledger.charge(UUID.randomUUID(), 1, "assembly:job-3")).isEqualTo(CreditLedgerClient.Outcome.SUCCESS);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void persistentOutageEndsAsFailedNotAsException() {
        AtomicInteger calls = new AtomicInteger();
        HttpCreditLedgerClient ledger = client(request -> {
            calls.incrementAndGet();
            return respond(HttpStatus.BAD_GATEWAY);
        });

        assertThat(ledger.charge(UUID.randomUUID(), 1, "assembly:job-4")).isEqualTo(CreditLedgerClient.Outcome.FAILED);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void clientErrorsAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        HttpCreditLedgerClient ledger = client(request -> {
            calls.incrementAndGet();
            return respond(HttpStatus.UNPROCESSABLE_ENTITY);
        });

        assertThat(ledger.charge(UUID.randomUUID(), 1, "assembly:job-5")).isEqualTo(CreditLedgerClient.Outcome.FAILED);
        assertThat(calls.get()).isEqualTo(1);
    }
}
