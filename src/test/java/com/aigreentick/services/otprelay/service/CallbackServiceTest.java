package com.aigreentick.services.otprelay.service;

import com.aigreentick.services.otprelay.config.OtpRelayProperties;
import com.aigreentick.services.otprelay.constants.CallbackOutcome;
import com.aigreentick.services.otprelay.dto.response.CallbackResult;
import com.aigreentick.services.otprelay.exception.CallbackAuthenticationException;
import com.aigreentick.services.otprelay.exception.InvalidRequestException;
import com.aigreentick.services.otprelay.repository.JsonFileNumberMappingStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class CallbackServiceTest {

    private static final String API_KEY = "test-mapikey";
    private static final long OWNER = 42L;
    private static final long ADMIN = 99L;

    @TempDir
    Path tempDir;

    @Mock
    private SubscriberNotifier notifier;

    private OtpRelayProperties properties;
    private JsonFileNumberMappingStore mappingStore;
    private CallbackService callbackService;

    @BeforeEach
    void setUp() {
        properties = new OtpRelayProperties();
        properties.getAllocationApi().setKey(API_KEY);

        ObjectMapper objectMapper = new ObjectMapper();
        mappingStore = new JsonFileNumberMappingStore(
                objectMapper, tempDir.resolve("mappings.json"), Duration.ofSeconds(2));
        mappingStore.init();

        callbackService = new CallbackService(properties, objectMapper,
                new InboundNumberMatcher(mappingStore), new OtpExtractor(), notifier);
    }

    @Test
    void process_MappedNumber_ForwardsOtpToOwner() {
        // Given
        mappingStore.put("8801799999", OWNER);

        // When
        CallbackResult result = callbackService.process(
                "{\"to\":\"+8801799999\",\"message\":\"code 1234\"}", null, API_KEY);

        // Then
        assertThat(result.getOutcome()).isEqualTo(CallbackOutcome.FORWARDED);
        assertThat(result.getNumber()).isEqualTo("8801799999");
        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        verify(notifier, times(1)).notify(eq(OWNER), text.capture());
        assertThat(text.getValue()).isEqualTo("OTP for +8801799999: 1234");
    }

    @Test
    void process_DirectOtpField_WinsOverBody() {
        // Given
        mappingStore.put("8801799999", OWNER);

        // When
        callbackService.process(
                "{\"msisdn\":\"8801799999\",\"otp\":\"5555\",\"message\":\"code 1234\"}", null, API_KEY);

        // Then
        verify(notifier).notify(OWNER, "OTP for +8801799999: 5555");
    }

    @Test
    void process_NoOtpInBody_ForwardsRawBodyWithWarning() {
        // Given
        mappingStore.put("8801799999", OWNER);

        // When
        CallbackResult result = callbackService.process(
                "{\"to\":\"8801799999\",\"message\":\"hello there\"}", null, API_KEY);

        // Then
        assertThat(result.getOutcome()).isEqualTo(CallbackOutcome.FORWARDED);
        verify(notifier).notify(eq(OWNER), contains("hello there"));
    }

    @Test
    void process_NationalFormatNumber_ResolvedBySuffix() {
        // Given
        mappingStore.put("8801712345678", OWNER);

        // When
        CallbackResult result = callbackService.process(
                "{\"number\":\"01712345678\",\"text\":\"PIN: 9087\"}", null, API_KEY);

        // Then
        assertThat(result.getOutcome()).isEqualTo(CallbackOutcome.FORWARDED);
        verify(notifier).notify(eq(OWNER), contains("9087"));
    }

    @Test
    void process_UnmappedWithAdmin_EscalatesWithPayload() {
        // Given
        properties.setAdminChatId(ADMIN);

        // When
        CallbackResult result = callbackService.process(
                "{\"to\":\"4470000000\",\"message\":\"code 1234\"}", null, API_KEY);

        // Then
        assertThat(result.getOutcome()).isEqualTo(CallbackOutcome.ESCALATED);
        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        verify(notifier).notify(eq(ADMIN), text.capture());
        assertThat(text.getValue())
                .startsWith("UNMAPPED: OTP for +4470000000: 1234")
                .contains("payload:")
                .contains("4470000000");
    }

    @Test
    void process_UnmappedWithoutAdmin_Dropped() {
        // When
        CallbackResult result = callbackService.process(
                "{\"to\":\"4470000000\",\"message\":\"code 1234\"}", null, API_KEY);

        // Then
        assertThat(result.getOutcome()).isEqualTo(CallbackOutcome.DROPPED);
        verifyNoInteractions(notifier);
    }

    @Test
    void process_MissingNumber_EscalatesThenRejects() {
        // Given
        properties.setAdminChatId(ADMIN);

        // When/Then
        assertThatThrownBy(() -> callbackService.process("{\"message\":\"code 1234\"}", null, API_KEY))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("missing number");
        verify(notifier).notify(eq(ADMIN), contains("MISSING NUMBER"));
    }

    @Test
    void process_EmptyOrNonObjectBody_Rejected() {
        assertThatThrownBy(() -> callbackService.process("", null, API_KEY))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> callbackService.process("{}", null, API_KEY))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> callbackService.process("[1,2]", null, API_KEY))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> callbackService.process("not json", null, API_KEY))
                .isInstanceOf(InvalidRequestException.class);
        verifyNoInteractions(notifier);
    }

    @Test
    void process_WrongApiKey_Forbidden() {
        assertThatThrownBy(() -> callbackService.process("{\"to\":\"1\"}", null, "wrong"))
                .isInstanceOf(CallbackAuthenticationException.class);
        assertThatThrownBy(() -> callbackService.process("{\"to\":\"1\"}", null, null))
                .isInstanceOf(CallbackAuthenticationException.class);
        verify(notifier, never()).notify(anyLong(), anyString());
    }

    @Test
    void process_SecretConfigured_ApiKeyNoLongerAccepted() {
        // Given
        properties.getCallback().setSecret("s3cret");
        mappingStore.put("8801799999", OWNER);
        String body = "{\"to\":\"8801799999\",\"message\":\"code 1234\"}";

        // When/Then
        assertThatThrownBy(() -> callbackService.process(body, null, API_KEY))
                .isInstanceOf(CallbackAuthenticationException.class);
        assertThat(callbackService.process(body, "s3cret", null).getOutcome())
                .isEqualTo(CallbackOutcome.FORWARDED);
    }

    @Test
    void process_NeverWritesMappings() {
        // Given
        mappingStore.put("8801799999", OWNER);

        // When
        callbackService.process("{\"to\":\"4470000000\",\"message\":\"1234\"}", null, API_KEY);

        // Then
        assertThat(mappingStore.snapshot()).containsOnlyKeys("8801799999");
    }
}
