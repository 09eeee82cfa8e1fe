package com.aigreentick.services.otprelay.service;

import com.aigreentick.services.otprelay.repository.NumberMappingStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InboundNumberMatcherTest {

    @Mock
    private NumberMappingStore mappingStore;

    @InjectMocks
    private InboundNumberMatcher matcher;

    private static Map<String, Long> mappings(Object... pairs) {
        Map<String, Long> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], (Long) pairs[i + 1]);
        }
        return map;
    }

    @Test
    void resolve_ExactMatch_AfterNormalizing() {
        // Given
        when(mappingStore.snapshot()).thenReturn(mappings("8801799999", 10L));

        // When/Then
        assertThat(matcher.resolve("+880 1799-999")).contains(10L);
    }

    @Test
    void resolve_NationalFormat_MatchesBySuffix() {
        // Given
        when(mappingStore.snapshot()).thenReturn(mappings("8801712345678", 20L));

        // When/Then
        assertThat(matcher.resolve("01712345678")).contains(20L);
    }

    @Test
    void resolve_ShortInput_MatchesLooselyAgainstLongerKey() {
        // Given
        when(mappingStore.snapshot()).thenReturn(mappings("8801799999", 30L));

        // When/Then
        assertThat(matcher.resolve("99999")).contains(30L);
    }

    @Test
    void resolve_SuffixCollision_FirstStoredWins() {
        // Given
        when(mappingStore.snapshot()).thenReturn(mappings(
                "11234567890", 1L,
                "21234567890", 2L));

        // When/Then
        assertThat(matcher.resolve("31234567890")).contains(1L);
    }

    @Test
    void resolve_LongerSuffixPreferred() {
        // Given
        when(mappingStore.snapshot()).thenReturn(mappings(
                "9000567890", 1L,
                "8801234567890", 2L));

        // When/Then
        assertThat(matcher.resolve("01234567890")).contains(2L);
    }

    @Test
    void resolve_NoMatch_ReturnsEmpty() {
        // Given
        when(mappingStore.snapshot()).thenReturn(mappings("8801799999", 10L));

        // When/Then
        assertThat(matcher.resolve("4470000000")).isEmpty();
    }

    @Test
    void resolve_NoDigits_ReturnsEmptyWithoutLookup() {
        assertThat(matcher.resolve("unknown")).isEmpty();
        assertThat(matcher.resolve(null)).isEmpty();
        verifyNoInteractions(mappingStore);
    }
}
