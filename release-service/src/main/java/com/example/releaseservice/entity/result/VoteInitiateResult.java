package com.example.releaseservice.entity.result;

import java.time.Instant;
import java.util.List;

/**
 * Result of sending a vote announcement. {@code mid} is the message id of the
 * vote thread, used later to reply with the vote resolution.
 */
public record VoteInitiateResult(
    String message,
    String emailTo,
    Instant voteEnd,
    String subject,
    String mid,
    List<String> mailSendWarnings
) implements TaskResult {
}
