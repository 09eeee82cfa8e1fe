package com.aigreentick.services.otprelay.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class PhoneNumberNormalizerTest {

    @ParameterizedTest
    @CsvSource({
            "'+880 1799-999', 8801799999",
            "'(555) 010-0', 5550100",
            "'8801799999', 8801799999",
            "'tel:+1.555.0100', 15550100"
    })
    void normalize_FormattedInput_KeepsDigitsOnly(String raw, String expected) {
        assertThat(PhoneNumberNormalizer.normalize(raw)).isEqualTo(expected);
    }

    @Test
    void normalize_NullOrEmpty_ReturnsEmpty() {
        assertThat(PhoneNumberNormalizer.normalize(null)).isEmpty();
        assertThat(PhoneNumberNormalizer.normalize("")).isEmpty();
        assertThat(PhoneNumberNormalizer.normalize("no digits")).isEmpty();
    }

    @Test
    void normalize_AppliedTwice_GivesSameResult() {
        // Given
        String once = PhoneNumberNormalizer.normalize("+1 (555) 010-0");

        // When
        String twice = PhoneNumberNormalizer.normalize(once);

        // Then
        assertThat(twice).isEqualTo(once);
    }

    @Test
    void toDisplay_PrefixesPlus() {
        assertThat(PhoneNumberNormalizer.toDisplay("880-1799-999")).isEqualTo("+8801799999");
        assertThat(PhoneNumberNormalizer.toDisplay(null)).isEmpty();
    }
}
