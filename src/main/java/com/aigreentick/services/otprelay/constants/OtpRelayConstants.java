package com.aigreentick.services.otprelay.constants;

import java.util.List;

/**
 * Application-wide constants for the OTP relay
 */
public final class OtpRelayConstants {

    private OtpRelayConstants() {
        throw new IllegalStateException("Constants class cannot be instantiated");
    }

    // Inbound webhook
    public static final String CALLBACK_PATH = "/callback";
    public static final String HEADER_CALLBACK_SECRET = "X-Callback-Secret";
    public static final String HEADER_MAPIKEY = "mapikey";

    // Allocation API
    public static final String ALLOCATION_NUMBER_PATH = "/mapi/v1/mdashboard/getnum/number";
    public static final String ALLOCATION_INFO_PATH = "/mapi/v1/mdashboard/getnum/info";
    public static final String RANGE_WILDCARD_SUFFIX = "XXX";
    public static final String DEFAULT_INFO_PAGE = "1";
    public static final String DEFAULT_INFO_STATUS = "success";

    // Candidate field names, first present wins
    public static final List<String> ALLOCATED_NUMBER_FIELDS = List.of("number", "full_number", "copy");
    public static final List<String> CALLBACK_NUMBER_FIELDS = List.of("to", "number", "full_number", "msisdn");
    public static final List<String> CALLBACK_BODY_FIELDS = List.of("message", "text", "sms", "body");
    public static final List<String> CALLBACK_OTP_FIELDS = List.of("otp", "code");

    // Inbound matching
    public static final int MAX_SUFFIX_LENGTH = 12;
    public static final int MIN_SUFFIX_LENGTH = 6;

    // Display limits
    public static final int TELEGRAM_MAX_MESSAGE_LENGTH = 4096;
    public static final int INFO_DISPLAY_LIMIT = 4000;
    public static final int PAYLOAD_DISPLAY_LIMIT = 1000;

    // Replies
    public static final String MSG_START = "OTP bot ready. Use /range <range-spec> to allocate numbers. /my to list yours.";
    public static final String MSG_RANGE_USAGE = "Usage: /range <range-spec>  e.g. /range 88017XXX";
    public static final String MSG_NO_NUMBERS = "No numbers allocated to you.";
    public static final String MSG_NOT_AUTHORIZED = "Not authorized.";
    public static final String MSG_FETCH_FAILED = "Fetch failed; check server logs.";
    public static final String ERROR_NUMBER_NOT_IN_RESPONSE = "number not found in response";
    public static final String ERROR_MISSING_NUMBER = "missing number";
}
