package de.alive.otpfetch.domain;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.Comparator;

/**
 * A message that yielded an OTP. Candidates of one round are ranked with {@link #RANKING}.
 */
public record OtpCandidate(
        @NotNull String otp,
        @NotNull String folder,
        @NotNull String subject,
        long uid,
        @NotNull Instant receivedAt
) {

    /**
     * Earliest received first, then the lexicographically smaller folder, then the smaller UID.
     */
    public static final Comparator<OtpCandidate> RANKING = Comparator
            .comparing(OtpCandidate::receivedAt)
            .thenComparing(OtpCandidate::folder)
            .thenComparingLong(OtpCandidate::uid);

    public static OtpCandidate of(@NotNull String otp, @NotNull CandidateMessage message) {
        return new OtpCandidate(otp, message.folder(), message.subject(), message.uid(), message.receivedAt());
    }

    public FetchResult toResult(long fetchTimeMillis) {
        return new FetchResult(otp, folder, subject, false, fetchTimeMillis);
    }
}
