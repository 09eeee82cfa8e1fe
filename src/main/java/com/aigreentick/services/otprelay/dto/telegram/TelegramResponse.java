package com.aigreentick.services.otprelay.dto.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

/**
 * Bot API envelope: {"ok": true, "result": ...} or {"ok": false, "error_code": 400, "description": "..."}
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelegramResponse<T> {

    private boolean ok;

    private T result;

    @JsonProperty("error_code")
    private Integer errorCode;

    private String description;
}
