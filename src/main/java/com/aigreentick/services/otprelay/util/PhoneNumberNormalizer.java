package com.aigreentick.services.otprelay.util;

import lombok.experimental.UtilityClass;

/**
 * Canonical digits-only form used as the mapping key everywhere numbers are
 * stored or looked up, so "+1-555-0100" and "15550100" compare equal.
 */
@UtilityClass
public class PhoneNumberNormalizer {

    /**
     * Strip every non-digit. Null or empty input gives "".
     */
    public String normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        StringBuilder digits = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }
        return digits.toString();
    }

    /**
     * Human-readable form for chat messages: "+8801799999".
     */
    public String toDisplay(String raw) {
        String digits = normalize(raw);
        return digits.isEmpty() ? "" : "+" + digits;
    }
}
