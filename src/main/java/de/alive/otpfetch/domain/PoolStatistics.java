package de.alive.otpfetch.domain;

public record PoolStatistics(
        int maxSize,
        int live,
        int idle,
        int leased,
        long totalCreated,
        long totalReused,
        long totalDiscarded
) {

    public String getSummary() {
        return String.format("Pool[max=%d, live=%d, idle=%d, leased=%d, created=%d, reused=%d, discarded=%d]",
                maxSize, live, idle, leased, totalCreated, totalReused, totalDiscarded);
    }
}
