package de.alive.otpfetch.domain;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.List;

/**
 * A message pulled from a folder that passed the sender and recipient filters.
 * Lives only until it has been parsed.
 */
public record CandidateMessage(
        @NotNull String folder,
        long uid,
        @NotNull String subject,
        @NotNull String body,
        @NotNull String from,
        @NotNull List<String> recipients,
        @NotNull Instant receivedAt,
        boolean seen
) {

    public CandidateMessage {
        if (folder == null || folder.isEmpty()) {
            throw new IllegalArgumentException("Folder cannot be null or empty");
        }
        subject = subject == null ? "" : subject;
        body = body == null ? "" : body;
        from = from == null ? "" : from;
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
        if (receivedAt == null) {
            throw new IllegalArgumentException("Received date cannot be null");
        }
    }
}
