package com.aigreentick.services.otprelay.dto.response;

import com.aigreentick.services.otprelay.constants.CallbackOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

/**
 * Data returned to the callback sender
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Callback processing result")
public class CallbackResult {

    @Schema(description = "What happened to the OTP", example = "FORWARDED")
    private CallbackOutcome outcome;

    @Schema(description = "Normalized destination number", example = "8801799999")
    private String number;
}
