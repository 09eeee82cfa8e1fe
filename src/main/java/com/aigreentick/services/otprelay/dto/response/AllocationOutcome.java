package com.aigreentick.services.otprelay.dto.response;

import com.aigreentick.services.otprelay.constants.AllocationState;
import lombok.*;

/**
 * Result of one /range allocation. {@code replyText} is what the requester sees.
 */
@Getter
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@ToString
public class AllocationOutcome {

    /** DONE or REPORTED */
    private final AllocationState state;

    /** API_ERROR or PARSE_ERROR when state is REPORTED */
    private final AllocationState failedAt;

    private final AllocatedNumber allocatedNumber;

    private final String replyText;

    public boolean isSuccess() {
        return state == AllocationState.DONE;
    }

    public static AllocationOutcome done(AllocatedNumber number, String replyText) {
        return AllocationOutcome.builder()
                .state(AllocationState.DONE)
                .allocatedNumber(number)
                .replyText(replyText)
                .build();
    }

    public static AllocationOutcome reported(AllocationState failedAt, String replyText) {
        return AllocationOutcome.builder()
                .state(AllocationState.REPORTED)
                .failedAt(failedAt)
                .replyText(replyText)
                .build();
    }
}
