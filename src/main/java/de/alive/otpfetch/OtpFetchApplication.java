package de.alive.otpfetch;

import de.alive.otpfetch.domain.ErrorKind;
import de.alive.otpfetch.domain.FetchOutcome;
import de.alive.otpfetch.domain.FetchRequest;
import de.alive.otpfetch.domain.FetchResult;
import de.alive.otpfetch.exception.ConfigurationException;
import de.alive.otpfetch.service.ConfigurationService;
import de.alive.otpfetch.service.config.FetchConfiguration;
import de.alive.otpfetch.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.io.PrintStream;
import java.time.Duration;

/**
 * Command line: {@code OtpFetchApplication <targetRecipient> [sender] [maxWaitSeconds]}.
 * Credentials and mailbox settings come from the environment, see {@link ConfigurationService}.
 */
@Slf4j
public class OtpFetchApplication {

    static final String DEFAULT_SENDER = "noreply@tm.openai.com";

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_TIMEOUT = 1;
    static final int EXIT_ERROR = 2;
    static final int EXIT_USAGE = 64;

    private static final String USAGE = "Usage: OtpFetchApplication <targetRecipient> [sender] [maxWaitSeconds]";

    private final ConfigurationService configurationService;

    public OtpFetchApplication(@NotNull ConfigurationService configurationService) {
        this.configurationService = configurationService;
    }

    public static void main(String[] args) {
        int exitCode = new OtpFetchApplication(new ConfigurationService()).run(args, System.out);
        System.exit(exitCode);
    }

    public int run(@NotNull String[] args, @NotNull PrintStream out) {
        FetchRequest request;
        try {
            request = parseArguments(args);
        } catch (IllegalArgumentException e) {
            out.println("Error: " + e.getMessage());
            out.println(USAGE);
            return EXIT_USAGE;
        }

        Configuration configuration;
        try {
            configuration = configurationService.loadConfiguration();
        } catch (ConfigurationException e) {
            log.error("{} Invalid configuration ({}): {}", LogUtils.ERROR_EMOJI, e.getConfigKey(), e.getMessage());
            out.println("Error: " + ErrorKind.CONFIGURATION + " " + e.getMessage());
            return EXIT_ERROR;
        }

        log.info("{} Fetching OTP for {}...", LogUtils.ROCKET_EMOJI, LogUtils.maskEmail(request.targetRecipient()));
        try (OtpFetcher fetcher = new OtpFetcher(configuration)) {
            FetchOutcome outcome = fetcher.fetchOtp(request).block();
            if (outcome == null) {
                out.println("Error: " + ErrorKind.INTERNAL + " no outcome");
                return EXIT_ERROR;
            }
            return report(outcome, out);
        }
    }

    /**
     * Prints {@code outcome} in the line format scripts parse and returns the matching exit code.
     */
    static int report(@NotNull FetchOutcome outcome, @NotNull PrintStream out) {
        if (outcome.isSuccess()) {
            FetchResult result = outcome.getResult().orElseThrow();
            out.println("Code: " + result.otp());
            out.println("Folder: " + result.folder());
            out.println("Subject: " + result.subject());
            out.println("Cached: " + result.cached());
            out.println("Fetch Time: " + result.fetchTimeMillis() + "ms");
            return EXIT_SUCCESS;
        }
        if (outcome.isTimeout()) {
            out.println("Timeout");
            return EXIT_TIMEOUT;
        }
        out.println("Error: " + outcome.getErrorKind().orElse(ErrorKind.INTERNAL) + " " + outcome.getMessage());
        return EXIT_ERROR;
    }

    static FetchRequest parseArguments(String[] args) {
        if (args.length < 1 || args.length > 3) {
            throw new IllegalArgumentException("expected 1 to 3 arguments, got " + args.length);
        }
        String sender = args.length >= 2 ? args[1] : DEFAULT_SENDER;
        Duration maxWait = args.length == 3 ? parseSeconds(args[2]) : FetchConfiguration.DEFAULT_DEADLINE;
        return new FetchRequest(args[0], sender, maxWait);
    }

    private static Duration parseSeconds(String value) {
        try {
            long seconds = Long.parseLong(value.trim());
            if (seconds < 0) {
                throw new IllegalArgumentException("maxWaitSeconds cannot be negative");
            }
            return Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("maxWaitSeconds must be a number, got '" + value + "'", e);
        }
    }
}
