package com.aigreentick.services.otprelay.service;

import com.aigreentick.services.otprelay.constants.OtpRelayConstants;
import com.aigreentick.services.otprelay.repository.NumberMappingStore;
import com.aigreentick.services.otprelay.util.PhoneNumberNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the chat that owns an inbound number.
 *
 * The callback sender and the allocation API do not agree on format: one may
 * send "+8801799999", the other "01799999" or "8801799999". Matching order,
 * first hit wins:
 *
 *   1. exact normalized key
 *   2. suffix: last N digits of the input, N = 12 down to 6, against stored
 *      keys in insertion order (only windows the input is long enough for)
 *   3. loose: any stored key ending with the whole normalized input
 *
 * Two stored numbers sharing a long tail can collide; the first stored wins
 * and the collision is logged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InboundNumberMatcher {

    private final NumberMappingStore mappingStore;

    public Optional<Long> resolve(String rawNumber) {
        String number = PhoneNumberNormalizer.normalize(rawNumber);
        if (number.isEmpty()) {
            log.debug("Inbound number '{}' has no digits", rawNumber);
            return Optional.empty();
        }

        Map<String, Long> mappings = mappingStore.snapshot();

        Long exact = mappings.get(number);
        if (exact != null) {
            log.debug("Exact match for {}", number);
            return Optional.of(exact);
        }

        for (int length = OtpRelayConstants.MAX_SUFFIX_LENGTH;
             length >= OtpRelayConstants.MIN_SUFFIX_LENGTH; length--) {
            if (number.length() < length) {
                continue;
            }
            String suffix = number.substring(number.length() - length);
            List<String> candidates = keysEndingWith(mappings, suffix);
            if (!candidates.isEmpty()) {
                String winner = candidates.get(0);
                if (candidates.size() > 1) {
                    log.warn("Suffix collision for {}: last {} digits match {}, using {}",
                            number, length, candidates, winner);
                }
                log.info("Suffix match for {} -> {} ({} digits)", number, winner, length);
                return Optional.of(mappings.get(winner));
            }
        }

        List<String> loose = keysEndingWith(mappings, number);
        if (!loose.isEmpty()) {
            log.info("Loose match for {} -> {}", number, loose.get(0));
            return Optional.of(mappings.get(loose.get(0)));
        }

        log.debug("No mapping for {}", number);
        return Optional.empty();
    }

    private List<String> keysEndingWith(Map<String, Long> mappings, String suffix) {
        List<String> matches = new ArrayList<>();
        for (String key : mappings.keySet()) {
            if (key.endsWith(suffix)) {
                matches.add(key);
            }
        }
        return matches;
    }
}
