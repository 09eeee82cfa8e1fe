package com.aigreentick.services.otprelay.dto.request;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

/**
 * Body of POST /mapi/v1/mdashboard/getnum/number.
 * is_national and remove_plus are sent as explicit nulls (provider defaults).
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.ALWAYS)
@Schema(description = "Number allocation request sent to the provider")
public class AllocateNumberRequest {

    @NotBlank(message = "Range is required")
    @Schema(description = "Range spec with wildcard suffix", example = "88017XXX")
    private String range;

    @JsonProperty("is_national")
    private Boolean isNational;

    @JsonProperty("remove_plus")
    private Boolean removePlus;

    public static AllocateNumberRequest forRange(String range) {
        return AllocateNumberRequest.builder().range(range).build();
    }
}
