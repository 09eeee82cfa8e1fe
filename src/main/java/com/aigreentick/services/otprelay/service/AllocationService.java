package com.aigreentick.services.otprelay.service;

import com.aigreentick.services.otprelay.client.AllocationApiClient;
import com.aigreentick.services.otprelay.constants.AllocationState;
import com.aigreentick.services.otprelay.constants.OtpRelayConstants;
import com.aigreentick.services.otprelay.dto.response.AllocatedNumber;
import com.aigreentick.services.otprelay.dto.response.AllocationOutcome;
import com.aigreentick.services.otprelay.exception.AllocationApiException;
import com.aigreentick.services.otprelay.exception.AllocationResponseException;
import com.aigreentick.services.otprelay.exception.InvalidRequestException;
import com.aigreentick.services.otprelay.repository.NumberMappingStore;
import com.aigreentick.services.otprelay.util.CandidateFields;
import com.aigreentick.services.otprelay.util.PhoneNumberNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs one /range allocation for a chat.
 *
 * ═══════════════════════════════════════════════════════════════
 *   REQUESTED ──► API_CALLED ──► PARSED_OK ──► MAPPED ──► DONE
 *                     │
 *                     ├──► API_ERROR ───► REPORTED
 *                     └──► PARSE_ERROR ─► REPORTED
 * ═══════════════════════════════════════════════════════════════
 *
 * The mapping store is only touched on the MAPPED step, so a failed call or
 * an unusable response never leaves a partial mapping behind. Re-allocating
 * a number overwrites its owner.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AllocationService {

    private final AllocationApiClient allocationApiClient;
    private final NumberMappingStore mappingStore;

    public AllocationOutcome allocate(long subscriberId, String rangePrefix) {
        if (rangePrefix == null || rangePrefix.isBlank()) {
            throw InvalidRequestException.blankRange();
        }

        String range = toRangeSpec(rangePrefix);
        AllocationState state = AllocationState.REQUESTED;
        log.info("Allocation {}: subscriber={}, range={}", state, subscriberId, range);

        Map<String, Object> response;
        try {
            response = allocationApiClient.requestNumber(range);
            state = AllocationState.API_CALLED;
            log.debug("Allocation {}: range={}", state, range);
        } catch (AllocationApiException ex) {
            log.error("Allocation {}: subscriber={}, range={}, status={}: {}",
                    AllocationState.API_ERROR, subscriberId, range, ex.getHttpStatus(), ex.getMessage());
            return AllocationOutcome.reported(AllocationState.API_ERROR, "Allocation failed: " + ex.getMessage());
        }

        AllocatedNumber allocated;
        try {
            allocated = parseAllocatedNumber(response);
            state = AllocationState.PARSED_OK;
            log.debug("Allocation {}: number={}", state, allocated.getNumber());
        } catch (AllocationResponseException ex) {
            log.error("Allocation {}: subscriber={}, range={}, response={}",
                    AllocationState.PARSE_ERROR, subscriberId, range, response);
            return AllocationOutcome.reported(AllocationState.PARSE_ERROR, parseErrorReply(ex, response));
        }

        mappingStore.put(allocated.getNormalizedNumber(), subscriberId);
        state = AllocationState.MAPPED;
        log.debug("Allocation {}: {} -> {}", state, allocated.getNormalizedNumber(), subscriberId);

        AllocationOutcome outcome = AllocationOutcome.done(allocated, successReply(allocated));
        log.info("Allocation {}: {} -> {}", outcome.getState(), allocated.getNumber(), subscriberId);
        return outcome;
    }

    /**
     * Append the provider's wildcard suffix unless the user already typed it.
     * "88017" → "88017XXX", "88017xxx" stays as is.
     */
    public String toRangeSpec(String rangePrefix) {
        String trimmed = rangePrefix.trim();
        if (trimmed.toUpperCase(Locale.ROOT).endsWith(OtpRelayConstants.RANGE_WILDCARD_SUFFIX)) {
            return trimmed;
        }
        return trimmed + OtpRelayConstants.RANGE_WILDCARD_SUFFIX;
    }

    AllocatedNumber parseAllocatedNumber(Map<String, Object> response) {
        Map<String, Object> data = CandidateFields.nestedObject(response, "data");
        String number = CandidateFields.firstPresent(data, OtpRelayConstants.ALLOCATED_NUMBER_FIELDS)
                .orElseThrow(() -> new AllocationResponseException(OtpRelayConstants.ERROR_NUMBER_NOT_IN_RESPONSE));

        String normalized = PhoneNumberNormalizer.normalize(number);
        if (normalized.isEmpty()) {
            throw new AllocationResponseException(OtpRelayConstants.ERROR_NUMBER_NOT_IN_RESPONSE);
        }

        return AllocatedNumber.builder()
                .number(number)
                .normalizedNumber(normalized)
                .country(CandidateFields.firstPresent(data, List.of("country")).orElse(null))
                .operator(CandidateFields.firstPresent(data, List.of("operator")).orElse(null))
                .status(CandidateFields.firstPresent(data, List.of("status")).orElse(null))
                .message(CandidateFields.firstPresent(response, List.of("message")).orElse(null))
                .build();
    }

    private String successReply(AllocatedNumber allocated) {
        StringBuilder reply = new StringBuilder("Allocated: ")
                .append(PhoneNumberNormalizer.toDisplay(allocated.getNormalizedNumber()));
        if (allocated.getCountry() != null) {
            reply.append("\nCountry: ").append(allocated.getCountry());
        }
        if (allocated.getOperator() != null) {
            reply.append("\nOperator: ").append(allocated.getOperator());
        }
        if (allocated.getStatus() != null) {
            reply.append("\nStatus: ").append(allocated.getStatus());
        }
        return reply.toString();
    }

    private String parseErrorReply(AllocationResponseException ex, Map<String, Object> response) {
        String reply = "Allocation failed: " + ex.getMessage();
        String upstreamMessage = CandidateFields.firstPresent(response, List.of("message")).orElse(null);
        return upstreamMessage != null ? reply + "\n" + upstreamMessage : reply;
    }
}
