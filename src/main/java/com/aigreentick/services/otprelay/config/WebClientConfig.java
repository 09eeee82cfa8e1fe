package com.aigreentick.services.otprelay.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClient configuration for outbound calls.
 *
 * allocationWebClient — getnum API, one request per /range, 20s timeout
 * telegramWebClient   — Bot API; the response timeout covers the getUpdates long poll
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class WebClientConfig {

    private static final int CONNECT_TIMEOUT_MS = 10_000;

    private final OtpRelayProperties properties;

    @Bean(name = "allocationWebClient")
    public WebClient allocationWebClient() {
        int timeout = properties.getAllocationApi().getTimeoutSeconds();
        return WebClient.builder()
                .baseUrl(properties.getAllocationApi().getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .clientConnector(new ReactorClientHttpConnector(httpClient(timeout)))
                .filter(logRequest("Allocation API"))
                .filter(logResponse("Allocation API"))
                .build();
    }

    @Bean(name = "telegramWebClient")
    public WebClient telegramWebClient() {
        OtpRelayProperties.Telegram telegram = properties.getTelegram();
        int timeout = Math.max(telegram.getSendTimeoutSeconds(),
                telegram.getLongPollTimeoutSeconds() + telegram.getSendTimeoutSeconds());
        return WebClient.builder()
                .baseUrl(telegram.getBotBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .clientConnector(new ReactorClientHttpConnector(httpClient(timeout)))
                // the base URL carries the bot token, so only the method is logged
                .filter(logRequest("Telegram"))
                .build();
    }

    private HttpClient httpClient(int timeoutSeconds) {
        return HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
                .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                                .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                );
    }

    private ExchangeFilterFunction logRequest(String target) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            if ("Telegram".equals(target)) {
                log.debug("-> {} Request: {} {}", target, clientRequest.method(),
                        clientRequest.url().getPath().replaceAll("/bot[^/]+", "/bot***"));
            } else {
                log.debug("-> {} Request: {} {}", target, clientRequest.method(), clientRequest.url());
            }
            return Mono.just(clientRequest);
        });
    }

    private ExchangeFilterFunction logResponse(String target) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            log.debug("<- {} Response: {}", target, clientResponse.statusCode());
            return Mono.just(clientResponse);
        });
    }
}
