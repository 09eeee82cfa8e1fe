package com.aigreentick.services.otprelay.service;

import com.aigreentick.services.otprelay.client.AllocationApiClient;
import com.aigreentick.services.otprelay.config.OtpRelayProperties;
import com.aigreentick.services.otprelay.constants.OtpRelayConstants;
import com.aigreentick.services.otprelay.dto.response.AllocationOutcome;
import com.aigreentick.services.otprelay.dto.telegram.TelegramUpdate;
import com.aigreentick.services.otprelay.exception.AllocationApiException;
import com.aigreentick.services.otprelay.repository.NumberMappingStore;
import com.aigreentick.services.otprelay.util.CandidateFields;
import com.aigreentick.services.otprelay.util.PhoneNumberNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Chat command front end.
 *
 *   /start                          greeting
 *   /range <prefix>                 allocate a number for the calling chat
 *   /my                             list the calling chat's numbers
 *   /allocations [date] [page] [status]   provider listing, admin only when an admin is set
 *
 * "/cmd@BotName" is accepted. Plain text and unknown commands are ignored.
 * Every reply goes back to the chat that sent the command.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BotCommandService {

    private final AllocationService allocationService;
    private final AllocationApiClient allocationApiClient;
    private final NumberMappingStore mappingStore;
    private final SubscriberNotifier notifier;
    private final OtpRelayProperties properties;

    public void handle(TelegramUpdate update) {
        if (update == null || !update.hasText()) {
            return;
        }
        String text = update.getMessage().getText().trim();
        if (!text.startsWith("/")) {
            return;
        }

        long chatId = update.getMessage().getChat().getId();
        String[] tokens = text.split("\\s+");
        String command = commandName(tokens[0]);
        List<String> args = Arrays.asList(tokens).subList(1, tokens.length);

        log.info("Command /{} from chat {}", command, chatId);

        switch (command) {
            case "start" -> reply(chatId, OtpRelayConstants.MSG_START);
            case "range" -> handleRange(chatId, args);
            case "my" -> handleMy(chatId);
            case "allocations" -> handleAllocations(chatId, args);
            default -> log.debug("Ignoring unknown command /{} from chat {}", command, chatId);
        }
    }

    // ───────────────────────────────────────────────────────────
    // COMMANDS
    // ───────────────────────────────────────────────────────────

    private void handleRange(long chatId, List<String> args) {
        if (args.isEmpty()) {
            reply(chatId, OtpRelayConstants.MSG_RANGE_USAGE);
            return;
        }
        AllocationOutcome outcome = allocationService.allocate(chatId, args.get(0));
        reply(chatId, outcome.getReplyText());
    }

    private void handleMy(long chatId) {
        List<String> numbers = mappingStore.numbersOwnedBy(chatId);
        if (numbers.isEmpty()) {
            reply(chatId, OtpRelayConstants.MSG_NO_NUMBERS);
            return;
        }
        String listing = numbers.stream()
                .map(PhoneNumberNormalizer::toDisplay)
                .collect(Collectors.joining("\n"));
        reply(chatId, "Your numbers:\n" + listing);
    }

    private void handleAllocations(long chatId, List<String> args) {
        if (properties.hasAdmin() && properties.getAdminChatId() != chatId) {
            log.warn("Chat {} tried /allocations without admin rights", chatId);
            reply(chatId, OtpRelayConstants.MSG_NOT_AUTHORIZED);
            return;
        }

        String date = argOrDefault(args, 0, "");
        String page = argOrDefault(args, 1, OtpRelayConstants.DEFAULT_INFO_PAGE);
        String status = argOrDefault(args, 2, OtpRelayConstants.DEFAULT_INFO_STATUS);

        try {
            String info = allocationApiClient.fetchAllocationInfo(date, page, "", status);
            reply(chatId, CandidateFields.truncate(info, OtpRelayConstants.INFO_DISPLAY_LIMIT));
        } catch (AllocationApiException ex) {
            log.error("Failed to fetch allocations: {}", ex.getMessage(), ex);
            reply(chatId, OtpRelayConstants.MSG_FETCH_FAILED);
        }
    }

    // ───────────────────────────────────────────────────────────
    // PRIVATE HELPERS
    // ───────────────────────────────────────────────────────────

    /** "/Range@OtpBot" → "range" */
    private String commandName(String token) {
        String name = token.substring(1);
        int at = name.indexOf('@');
        if (at >= 0) {
            name = name.substring(0, at);
        }
        return name.toLowerCase(Locale.ROOT);
    }

    private String argOrDefault(List<String> args, int index, String fallback) {
        return args.size() > index ? args.get(index) : fallback;
    }

    private void reply(long chatId, String text) {
        notifier.notify(chatId, text);
    }
}
