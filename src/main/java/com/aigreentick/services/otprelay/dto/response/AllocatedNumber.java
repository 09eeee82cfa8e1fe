package com.aigreentick.services.otprelay.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

/**
 * Number parsed from a successful allocation response
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Allocated number details")
public class AllocatedNumber {

    @Schema(description = "Number as returned by the provider", example = "+8801799999")
    private String number;

    @Schema(description = "Digits-only mapping key", example = "8801799999")
    private String normalizedNumber;

    @Schema(description = "Country reported by the provider", example = "Bangladesh")
    private String country;

    @Schema(description = "Operator reported by the provider", example = "Grameenphone")
    private String operator;

    @Schema(description = "Allocation status reported by the provider", example = "success")
    private String status;

    @Schema(description = "Top-level provider message")
    private String message;
}
