package de.alive.otpfetch.service;

import de.alive.otpfetch.Configuration;
import de.alive.otpfetch.exception.ConfigurationException;
import de.alive.otpfetch.service.config.FetchConfiguration;
import de.alive.otpfetch.util.LogUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds a {@link Configuration} from environment variables. Only the application entry point uses this;
 * the engine itself receives its configuration by value.
 */
@Slf4j
public class ConfigurationService {

    static final String USER_ENV = "OTP_IMAP_USER";
    static final String PASSWORD_ENV = "OTP_IMAP_PASSWORD";
    static final String HOST_ENV = "OTP_IMAP_HOST";
    static final String PORT_ENV = "OTP_IMAP_PORT";
    static final String FOLDERS_ENV = "OTP_IMAP_FOLDERS";
    static final String POOL_SIZE_ENV = "OTP_POOL_SIZE";
    static final String SCAN_LIMIT_ENV = "OTP_SCAN_LIMIT";
    static final String CACHE_TTL_ENV = "OTP_CACHE_TTL_SECONDS";
    static final String BACKOFF_ENV = "OTP_BACKOFF_MILLIS";
    static final String RECIPIENT_FILTER_ENV = "OTP_RECIPIENT_FILTER";
    static final String MAX_AGE_ENV = "OTP_MAX_AGE_HOURS";

    private final Function<String, String> environment;

    public ConfigurationService() {
        this(System::getenv);
    }

    public ConfigurationService(Function<String, String> environment) {
        this.environment = environment;
    }

    public Configuration loadConfiguration() {
        log.info("{} Loading mailbox configuration...", LogUtils.PROCESS_EMOJI);

        String user = getRequiredEnvironmentVariable(USER_ENV);
        String password = getRequiredEnvironmentVariable(PASSWORD_ENV);
        validateEmailFormat(user);
        validatePasswordSecurity(password);

        FetchConfiguration.FetchConfigurationBuilder builder = FetchConfiguration.forProduction().toBuilder();
        getEnvironmentVariable(HOST_ENV).ifPresent(builder::host);
        getEnvironmentVariable(PORT_ENV).ifPresent(value -> builder.port(parseInt(PORT_ENV, value)));
        getEnvironmentVariable(FOLDERS_ENV).ifPresent(value -> builder.folders(parseFolders(value)));
        getEnvironmentVariable(POOL_SIZE_ENV).ifPresent(value -> builder.poolSize(parseInt(POOL_SIZE_ENV, value)));
        getEnvironmentVariable(SCAN_LIMIT_ENV).ifPresent(value -> builder.scanLimit(parseInt(SCAN_LIMIT_ENV, value)));
        getEnvironmentVariable(CACHE_TTL_ENV).ifPresent(value ->
                builder.cacheTtl(Duration.ofSeconds(parseInt(CACHE_TTL_ENV, value))));
        getEnvironmentVariable(BACKOFF_ENV).ifPresent(value ->
                builder.backoffInterval(Duration.ofMillis(parseInt(BACKOFF_ENV, value))));
        getEnvironmentVariable(RECIPIENT_FILTER_ENV).ifPresent(value ->
                builder.recipientFilterEnabled(Boolean.parseBoolean(value.trim())));
        getEnvironmentVariable(MAX_AGE_ENV).ifPresent(value ->
                builder.maxMessageAge(Duration.ofHours(parseInt(MAX_AGE_ENV, value))));

        FetchConfiguration fetchConfig = builder.build();
        try {
            fetchConfig.validate();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), "fetch",
                    ConfigurationException.ConfigurationType.INVALID_VALUE, e);
        }

        log.info("{} Configuration loaded for {}: {}", LogUtils.SUCCESS_EMOJI,
                LogUtils.maskEmail(user), fetchConfig.getConfigurationSummary());
        return new Configuration(user, password, fetchConfig);
    }

    private String getRequiredEnvironmentVariable(String key) {
        return getEnvironmentVariable(key)
                .orElseThrow(() -> new ConfigurationException(
                        String.format("Required environment variable '%s' is not set", key),
                        key,
                        ConfigurationException.ConfigurationType.MISSING_ENVIRONMENT_VARIABLE
                ));
    }

    private Optional<String> getEnvironmentVariable(String key) {
        return Optional.ofNullable(environment.apply(key))
                .filter(v -> !v.trim().isEmpty());
    }

    private int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    String.format("Environment variable '%s' must be a number, got '%s'", key, value),
                    key,
                    ConfigurationException.ConfigurationType.INVALID_VALUE,
                    e
            );
        }
    }

    private List<String> parseFolders(String value) {
        List<String> folders = Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(folder -> !folder.isEmpty())
                .collect(Collectors.toList());
        if (folders.isEmpty()) {
            throw new ConfigurationException("At least one folder must be configured", FOLDERS_ENV,
                    ConfigurationException.ConfigurationType.INVALID_VALUE);
        }
        return folders;
    }

    private void validateEmailFormat(String email) {
        if (!email.contains("@") || !email.contains(".")) {
            throw new ConfigurationException(
                    String.format("Invalid email format: %s", LogUtils.maskEmail(email)),
                    USER_ENV,
                    ConfigurationException.ConfigurationType.INVALID_VALUE
            );
        }
    }

    private void validatePasswordSecurity(String password) {
        if (password.length() < 16) {
            log.warn("{} App password seems short - ensure it's a valid app-specific password",
                    LogUtils.WARNING_EMOJI);
        }
    }
}
