package com.example.podcast_backend.config;

import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Outbound HTTP clients: hosting platform streams, credit ledger, remote worker.
 */
@Configuration
@EnableConfigurationProperties(BillingProperties.class)
public class HttpClientConfig {

    @Bean
    @Qualifier("streamWebClient")
    public WebClient streamWebClient(WebClient.Builder builder, StorageProperties storage) {
        HttpClient http = HttpClient.create()
                .followRedirect(true) // download endpoint redirects to the CDN
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Duration.ofSeconds(5).toMillis())
                .responseTimeout(storage.getSpreaker().getTimeout());
        return builder
                .clientConnector(new ReactorClientHttpConnector(http))
                .build();
    }

    @Bean
    @Qualifier("ledgerWebClient")
    public WebClient ledgerWebClient(WebClient.Builder builder, BillingProperties billing) {
        HttpClient http = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Duration.ofSeconds(3).toMillis())
                .responseTimeout(billing.getLedger().getTimeout());
        WebClient.Builder b = builder
                .baseUrl(billing.getLedger().getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(http));
        String apiKey = billing.getLedger().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            b.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        return b.build();
    }

    @Bean
    @Qualifier("workerWebClient")
    public WebClient workerWebClient(WebClient.Builder builder, DispatchProperties dispatch) {
        HttpClient http = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Duration.ofSeconds(5).toMillis())
                .responseTimeout(dispatch.getWorker().getTimeout());
        WebClient.Builder b = builder.clientConnector(new ReactorClientHttpConnector(http));
        if (dispatch.getWorker().getBaseUrl() != null && !dispatch.getWorker().getBaseUrl().isBlank()) {
            b.baseUrl(dispatch.getWorker().getBaseUrl());
        }
        return b.build();
    }
}
