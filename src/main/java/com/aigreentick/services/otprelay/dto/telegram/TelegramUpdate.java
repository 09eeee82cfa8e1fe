package com.aigreentick.services.otprelay.dto.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

/**
 * Subset of the Bot API Update object the command front end needs
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelegramUpdate {

    @JsonProperty("update_id")
    private long updateId;

    private Message message;

    /** True for plain text messages; other update kinds are ignored */
    public boolean hasText() {
        return message != null && message.getChat() != null && message.getText() != null;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {

        @JsonProperty("message_id")
        private long messageId;

        private Chat chat;

        private String text;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Chat {

        private long id;

        private String type;
    }
}
