package com.aigreentick.services.otprelay.service;

import com.aigreentick.services.otprelay.config.OtpRelayProperties;
import com.aigreentick.services.otprelay.constants.CallbackOutcome;
import com.aigreentick.services.otprelay.constants.OtpRelayConstants;
import com.aigreentick.services.otprelay.dto.response.CallbackResult;
import com.aigreentick.services.otprelay.exception.CallbackAuthenticationException;
import com.aigreentick.services.otprelay.exception.InvalidRequestException;
import com.aigreentick.services.otprelay.util.CandidateFields;
import com.aigreentick.services.otprelay.util.PhoneNumberNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Decision pipeline for inbound OTP callbacks. Stops at the first failing step:
 *
 *   1. authenticate  — X-Callback-Secret if a secret is configured, else mapikey
 *   2. parse         — body must be a non-empty JSON object
 *   3. extract       — number, message body, OTP (direct field or extracted)
 *   4. number check  — missing number → admin gets the payload, caller gets 400
 *   5. resolve       — InboundNumberMatcher
 *   6. deliver       — owner chat, else admin chat, else dropped
 *
 * Only steps 4 and 6 have side effects (chat messages). The mapping store is
 * read, never written.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CallbackService {

    private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE =
            new TypeReference<>() {};

    private final OtpRelayProperties properties;
    private final ObjectMapper objectMapper;
    private final InboundNumberMatcher numberMatcher;
    private final OtpExtractor otpExtractor;
    private final SubscriberNotifier notifier;

    public CallbackResult process(String rawBody, String secretHeader, String apiKeyHeader) {
        authenticate(secretHeader, apiKeyHeader);
        Map<String, Object> payload = parsePayload(rawBody);

        Optional<String> rawNumber = CandidateFields.firstPresent(payload, OtpRelayConstants.CALLBACK_NUMBER_FIELDS);
        Optional<String> messageBody = CandidateFields.firstPresent(payload, OtpRelayConstants.CALLBACK_BODY_FIELDS);
        Optional<String> otp = CandidateFields.firstPresent(payload, OtpRelayConstants.CALLBACK_OTP_FIELDS)
                .or(() -> messageBody.flatMap(otpExtractor::extract));

        String number = rawNumber.map(PhoneNumberNormalizer::normalize).orElse("");
        if (number.isEmpty()) {
            log.warn("Callback missing number: {}", payload.keySet());
            escalate("MISSING NUMBER in callback", payload);
            throw InvalidRequestException.missingNumber();
        }

        String display = PhoneNumberNormalizer.toDisplay(number);
        String text = otp
                .map(code -> "OTP for " + display + ": " + code)
                .orElseGet(() -> "⚠️ OTP not detected for " + display + "\n" + messageBody.orElse("(empty message)"));

        Optional<Long> subscriber = numberMatcher.resolve(number);
        if (subscriber.isPresent()) {
            notifier.notify(subscriber.get(), text);
            log.info("Forwarded OTP for {} to {}", number, subscriber.get());
            return result(CallbackOutcome.FORWARDED, number);
        }

        if (escalate("UNMAPPED: " + text, payload)) {
            log.info("Sent unmapped OTP for {} to admin", number);
            return result(CallbackOutcome.ESCALATED, number);
        }

        log.info("No mapping for {} and no admin set", number);
        return result(CallbackOutcome.DROPPED, number);
    }

    // ───────────────────────────────────────────────────────────
    // PRIVATE HELPERS
    // ───────────────────────────────────────────────────────────

    private void authenticate(String secretHeader, String apiKeyHeader) {
        if (properties.getCallback().hasSecret()) {
            if (!constantTimeEquals(secretHeader, properties.getCallback().getSecret())) {
                throw CallbackAuthenticationException.secretMismatch();
            }
            return;
        }
        if (!constantTimeEquals(apiKeyHeader, properties.getAllocationApi().getKey())) {
            throw CallbackAuthenticationException.apiKeyMismatch();
        }
    }

    /** Constant-time comparison; null on either side never matches */
    private boolean constantTimeEquals(String received, String expected) {
        if (received == null || expected == null || expected.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(
                received.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }

    private Map<String, Object> parsePayload(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            throw InvalidRequestException.missingPayload();
        }
        JsonNode tree;
        try {
            tree = objectMapper.readTree(rawBody);
        } catch (JsonProcessingException ex) {
            log.warn("Callback JSON parse error: {}", ex.getOriginalMessage());
            throw InvalidRequestException.malformedPayload();
        }
        if (tree == null || !tree.isObject()) {
            throw InvalidRequestException.malformedPayload();
        }
        if (tree.isEmpty()) {
            throw InvalidRequestException.missingPayload();
        }
        return objectMapper.convertValue(tree, PAYLOAD_TYPE);
    }

    /**
     * @return false when no admin chat is configured
     */
    private boolean escalate(String headline, Map<String, Object> payload) {
        if (!properties.hasAdmin()) {
            return false;
        }
        String text = headline + "\npayload: "
                + CandidateFields.truncate(toJson(payload), OtpRelayConstants.PAYLOAD_DISPLAY_LIMIT);
        notifier.notify(properties.getAdminChatId(), text);
        return true;
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            return String.valueOf(payload);
        }
    }

    private CallbackResult result(CallbackOutcome outcome, String number) {
        return CallbackResult.builder().outcome(outcome).number(number).build();
    }
}
