package com.aigreentick.services.otprelay.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Typed config properties for the relay.
 *
 * Bound from application.yaml under prefix "otp-relay":
 * ┌─────────────────────────────────────────────────────────────────┐
 * │  otp-relay:                                                     │
 * │    admin-chat-id:        ${ADMIN_CHAT_ID}                       │
 * │    telegram.bot-token:   ${TELEGRAM_TOKEN}                      │
 * │    allocation-api.key:   ${MAPIKEY}                             │
 * │    allocation-api.base-url: ${API_BASE}                         │
 * │    callback.secret:      ${WEBHOOK_SECRET}                      │
 * │    storage.mappings-file: ${MAPPINGS_FILE}                      │
 * └─────────────────────────────────────────────────────────────────┘
 *
 * Secrets come from environment variables. See OtpRelayConfigValidator.
 */
@Configuration
@ConfigurationProperties(prefix = "otp-relay")
@Data
public class OtpRelayProperties {

    /** Chat that receives unroutable callbacks and may run /allocations. Optional. */
    private Long adminChatId;

    private Telegram telegram = new Telegram();

    private AllocationApi allocationApi = new AllocationApi();

    private Callback callback = new Callback();

    private Storage storage = new Storage();

    public boolean hasAdmin() {
        return adminChatId != null;
    }

    @Data
    public static class Telegram {

        /** Bot token issued by BotFather, never log it */
        private String botToken;

        private String apiBaseUrl = "https://api.telegram.org";

        /** Disable to run the webhook side only (e.g. a second replica) */
        private boolean pollingEnabled = true;

        private int longPollTimeoutSeconds = 20;

        private int sendTimeoutSeconds = 10;

        /**
         * Versioned base URL for one bot.
         * Example: https://api.telegram.org/bot123:abc
         */
        public String getBotBaseUrl() {
            return apiBaseUrl + "/bot" + botToken;
        }
    }

    @Data
    public static class AllocationApi {

        /** Sent as the mapikey header, also accepted on /callback when no secret is set */
        private String key;

        private String baseUrl = "https://x.mnitnetwork.com";

        private int timeoutSeconds = 20;
    }

    @Data
    public static class Callback {

        /** When set, X-Callback-Secret is required instead of mapikey */
        private String secret;

        public boolean hasSecret() {
            return secret != null && !secret.isBlank();
        }
    }

    @Data
    public static class Storage {

        private String mappingsFile = "mappings.json";

        private int lockTimeoutSeconds = 5;
    }
}
