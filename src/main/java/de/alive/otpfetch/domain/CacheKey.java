package de.alive.otpfetch.domain;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;

/**
 * Identifies one cached or in-flight fetch: the target recipient and the expected sender,
 * both lower-cased and trimmed.
 */
public record CacheKey(@NotNull String recipient, @NotNull String sender) {

    public CacheKey {
        if (recipient == null || recipient.trim().isEmpty()) {
            throw new IllegalArgumentException("Recipient cannot be null or empty");
        }
        if (sender == null || sender.trim().isEmpty()) {
            throw new IllegalArgumentException("Sender cannot be null or empty");
        }
        recipient = normalize(recipient);
        sender = normalize(sender);
    }

    public static String normalize(String address) {
        return address.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return recipient + ":" + sender;
    }
}
