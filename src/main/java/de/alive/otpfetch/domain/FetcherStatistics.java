package de.alive.otpfetch.domain;

public record FetcherStatistics(
        PoolStatistics pool,
        int cacheSize,
        int inFlightPolls,
        long totalRequests
) {

    public String getSummary() {
        return String.format("%s, Cache[size=%d], Polls[inFlight=%d, total=%d]",
                pool.getSummary(), cacheSize, inFlightPolls, totalRequests);
    }
}
