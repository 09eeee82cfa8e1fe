package com.aigreentick.services.otprelay.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the passcode out of a free-text SMS body.
 *
 * Heuristics, first match wins:
 *   1. a standalone 4-8 digit run ("Your code is 482910")
 *   2. a 3-8 digit run right after '#', ':' or '-' ("PIN:123")
 *   3. the first digit run of any length
 *
 * The standalone-run rule goes first so timestamps and long reference
 * numbers earlier in the text lose to the usual OTP shape.
 */
@Component
public class OtpExtractor {

    private static final List<Pattern> HEURISTICS = List.of(
            Pattern.compile("\\b(\\d{4,8})\\b"),
            Pattern.compile("[#:\\-]\\s*(\\d{3,8})"),
            Pattern.compile("(\\d+)")
    );

    public Optional<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (Pattern pattern : HEURISTICS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return Optional.of(matcher.group(1));
            }
        }
        return Optional.empty();
    }
}
