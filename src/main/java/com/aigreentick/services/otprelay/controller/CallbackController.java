package com.aigreentick.services.otprelay.controller;

import com.aigreentick.services.otprelay.constants.OtpRelayConstants;
import com.aigreentick.services.otprelay.dto.response.ApiResponse;
import com.aigreentick.services.otprelay.dto.response.CallbackResult;
import com.aigreentick.services.otprelay.service.CallbackService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Inbound SMS callback from the number provider.
 *
 * Security:
 *   X-Callback-Secret must match the configured secret when one is set,
 *   otherwise the mapikey header must match the provider API key.
 *
 * Status codes:
 *   200 — accepted (forwarded, escalated to admin, or dropped)
 *   400 — body missing, not a JSON object, or no destination number
 *   403 — authentication failed
 *
 * Processing is synchronous; the provider gets its answer after delivery
 * was attempted.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Callbacks", description = "Inbound OTP callback endpoint")
public class CallbackController {

    private final CallbackService callbackService;

    /**
     * Raw body is read as String so authentication runs before any parsing.
     */
    @PostMapping(OtpRelayConstants.CALLBACK_PATH)
    @Operation(summary = "Receive an inbound SMS and relay its OTP")
    public ResponseEntity<ApiResponse<CallbackResult>> receiveCallback(
            @RequestBody(required = false) String rawBody,
            @RequestHeader(value = OtpRelayConstants.HEADER_CALLBACK_SECRET, required = false) String secretHeader,
            @RequestHeader(value = OtpRelayConstants.HEADER_MAPIKEY, required = false) String apiKeyHeader) {

        log.debug("Callback received");

        CallbackResult result = callbackService.process(rawBody, secretHeader, apiKeyHeader);
        return ResponseEntity.ok(ApiResponse.success(result, "ok"));
    }
}
