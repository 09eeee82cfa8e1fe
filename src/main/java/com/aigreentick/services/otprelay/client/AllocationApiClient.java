package com.aigreentick.services.otprelay.client;

import com.aigreentick.services.otprelay.config.OtpRelayProperties;
import com.aigreentick.services.otprelay.constants.OtpRelayConstants;
import com.aigreentick.services.otprelay.dto.request.AllocateNumberRequest;
import com.aigreentick.services.otprelay.exception.AllocationApiException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.Map;

/**
 * HTTP client for the number allocation provider (getnum API).
 *
 * Every call carries the mapikey header. Calls are NOT retried: a failed
 * /range is reported to the user, who re-issues the command.
 *
 * CircuitBreaker "allocationApi" fails fast while the provider is down.
 * 4xx (ClientException) is ignored by the breaker: a bad range says nothing
 * about provider health.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AllocationApiClient {

    @Qualifier("allocationWebClient")
    private final WebClient webClient;
    private final OtpRelayProperties properties;

    private static final String CB_NAME = "allocationApi";

    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE =
            new ParameterizedTypeReference<>() {};

    /**
     * Allocate one number from {@code range} (e.g. "88017XXX").
     * Returns the raw JSON response; parsing is left to AllocationService.
     */
    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackRequestNumber")
    public Map<String, Object> requestNumber(String range) {
        log.info("Requesting number allocation: range={}", range);
        try {
            Map<String, Object> response = webClient.post()
                    .uri(OtpRelayConstants.ALLOCATION_NUMBER_PATH)
                    .header(OtpRelayConstants.HEADER_MAPIKEY, properties.getAllocationApi().getKey())
                    .bodyValue(AllocateNumberRequest.forRange(range))
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, res ->
                            res.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .map(body -> new AllocationApiException.ClientException(
                                            "Allocation rejected (" + res.statusCode().value() + "): " + body,
                                            res.statusCode().value())))
                    .onStatus(HttpStatusCode::is5xxServerError, res ->
                            res.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .map(body -> new AllocationApiException(
                                            "Allocation server error (" + res.statusCode().value() + "): " + body,
                                            res.statusCode().value())))
                    .bodyToMono(MAP_TYPE)
                    .block();

            log.debug("Allocation response for range={}: {}", range, response);
            return response != null ? response : Map.of();
        } catch (WebClientResponseException ex) {
            throw mapWebClientException(ex);
        } catch (WebClientRequestException ex) {
            throw AllocationApiException.unreachable(ex);
        } catch (DecodingException ex) {
            throw new AllocationApiException("Allocation API returned an unreadable body: " + ex.getMessage(), ex);
        }
    }

    /**
     * Admin listing of past allocations. Returns the body as-is.
     */
    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackFetchAllocationInfo")
    public String fetchAllocationInfo(String date, String page, String search, String status) {
        log.info("Fetching allocation info: date={}, page={}, status={}", date, page, status);
        try {
            String body = webClient.get()
                    .uri(uri -> uri
                            .path(OtpRelayConstants.ALLOCATION_INFO_PATH)
                            .queryParam("date", date)
                            .queryParam("page", page)
                            .queryParam("search", search)
                            .queryParam("status", status)
                            .build())
                    .header(OtpRelayConstants.HEADER_MAPIKEY, properties.getAllocationApi().getKey())
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, res ->
                            res.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .map(errorBody -> res.statusCode().is4xxClientError()
                                            ? new AllocationApiException.ClientException(
                                                    "Allocation info rejected: " + errorBody, res.statusCode().value())
                                            : new AllocationApiException(
                                                    "Allocation info server error: " + errorBody, res.statusCode().value())))
                    .bodyToMono(String.class)
                    .block();

            return body != null ? body : "";
        } catch (WebClientResponseException ex) {
            throw mapWebClientException(ex);
        } catch (WebClientRequestException ex) {
            throw AllocationApiException.unreachable(ex);
        }
    }

    // ======================================================
    // FALLBACKS
    // ======================================================

    private Map<String, Object> fallbackRequestNumber(String range, Throwable ex) {
        throw handleFallback(ex);
    }

    private String fallbackFetchAllocationInfo(String date, String page, String search, String status,
                                               Throwable ex) {
        throw handleFallback(ex);
    }

    private RuntimeException handleFallback(Throwable ex) {
        if (ex instanceof CallNotPermittedException) {
            log.error("Circuit OPEN: allocation API calls blocked");
            return AllocationApiException.serviceUnavailable();
        }
        if (ex instanceof AllocationApiException allocationEx) {
            return allocationEx;
        }
        return new AllocationApiException("Allocation API call failed: " + ex.getMessage(), ex);
    }

    // ======================================================
    // PRIVATE HELPERS
    // ======================================================

    private AllocationApiException mapWebClientException(WebClientResponseException ex) {
        int status = ex.getStatusCode().value();
        if (status >= 400 && status < 500) {
            return new AllocationApiException.ClientException(
                    "Allocation API client error (" + status + "): " + ex.getMessage(), status);
        }
        return new AllocationApiException("Allocation API error (" + status + "): " + ex.getMessage(), status);
    }
}
