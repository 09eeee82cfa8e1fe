package com.aigreentick.services.otprelay.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

/**
 * Fail-fast validation for required relay configuration.
 * If a required value is missing or still a placeholder, the application
 * context fails to load with the env var that needs setting.
 *
 * Required env vars:
 *   - TELEGRAM_TOKEN → otp-relay.telegram.bot-token
 *   - MAPIKEY        → otp-relay.allocation-api.key
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OtpRelayConfigValidator {

    private final OtpRelayProperties properties;

    private static final Set<String> PLACEHOLDER_VALUES = Set.of(
            "",
            "null",
            "undefined",
            "changeme",
            "${TELEGRAM_TOKEN}",
            "${MAPIKEY}"
    );

    @PostConstruct
    public void validate() {
        log.info("Validating OTP relay configuration...");

        validateRequired("TELEGRAM_TOKEN", "otp-relay.telegram.bot-token",
                properties.getTelegram().getBotToken());
        validateRequired("MAPIKEY", "otp-relay.allocation-api.key",
                properties.getAllocationApi().getKey());

        if (!properties.getCallback().hasSecret()) {
            log.warn("WEBHOOK_SECRET is not set. /callback will authenticate with the mapikey header.");
        }
        if (!properties.hasAdmin()) {
            log.warn("ADMIN_CHAT_ID is not set. Unmapped OTPs will be dropped and /allocations is open to everyone.");
        }

        log.info("OTP relay configuration validated. Allocation API: {}, mappings file: {}",
                properties.getAllocationApi().getBaseUrl(),
                properties.getStorage().getMappingsFile());
    }

    private void validateRequired(String envVar, String configKey, String value) {
        if (isNullOrPlaceholder(value)) {
            throw new IllegalStateException(String.format(
                    "Startup failed: missing required configuration '%s'. Set the %s environment variable.",
                    configKey, envVar));
        }
    }

    private boolean isNullOrPlaceholder(String value) {
        if (value == null) return true;
        return PLACEHOLDER_VALUES.contains(value.trim().toLowerCase())
                || PLACEHOLDER_VALUES.contains(value.trim());
    }
}
