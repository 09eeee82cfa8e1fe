package com.aigreentick.services.otprelay.util;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateFieldsTest {

    @Test
    void firstPresent_UsesCandidateOrder() {
        // Given
        Map<String, Object> payload = Map.of("msisdn", "111", "to", "222");

        // When/Then
        assertThat(CandidateFields.firstPresent(payload, List.of("to", "msisdn"))).contains("222");
    }

    @Test
    void firstPresent_SkipsNullBlankAndNestedValues() {
        // Given
        Map<String, Object> payload = new HashMap<>();
        payload.put("to", null);
        payload.put("number", "   ");
        payload.put("full_number", Map.of("x", 1));
        payload.put("msisdn", List.of("1"));
        payload.put("copy", " 8801799999 ");

        // When/Then
        assertThat(CandidateFields.firstPresent(payload, List.of("to", "number", "full_number", "msisdn", "copy")))
                .contains("8801799999");
    }

    @Test
    void firstPresent_NumericValue_ReturnedAsText() {
        assertThat(CandidateFields.firstPresent(Map.of("otp", 4821), List.of("otp"))).contains("4821");
    }

    @Test
    void firstPresent_NothingUsable_ReturnsEmpty() {
        assertThat(CandidateFields.firstPresent(Map.of("other", "x"), List.of("to"))).isEmpty();
        assertThat(CandidateFields.firstPresent(null, List.of("to"))).isEmpty();
    }

    @Test
    void nestedObject_NotAnObject_ReturnsEmptyMap() {
        assertThat(CandidateFields.nestedObject(Map.of("data", "text"), "data")).isEmpty();
        assertThat(CandidateFields.nestedObject(Map.of("data", Map.of("number", "1")), "data"))
                .containsEntry("number", "1");
    }

    @Test
    void truncate_LongText_CutsAtLimit() {
        assertThat(CandidateFields.truncate("abcdef", 3)).isEqualTo("abc");
        assertThat(CandidateFields.truncate("ab", 3)).isEqualTo("ab");
        assertThat(CandidateFields.truncate(null, 3)).isEmpty();
    }
}
