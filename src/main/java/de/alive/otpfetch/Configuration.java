package de.alive.otpfetch;

import de.alive.otpfetch.service.config.FetchConfiguration;

/**
 * Mailbox credentials plus the fetch settings. Credentials are passed in explicitly, never read from the environment here.
 */
public record Configuration(
        String username,
        String password,
        FetchConfiguration fetchConfig
) {

    public Configuration(String username, String password) {
        this(username, password, FetchConfiguration.forProduction());
    }

    public Configuration {
        if (username == null || username.trim().isEmpty()) {
            throw new IllegalArgumentException("Username cannot be null or empty");
        }
        if (password == null || password.trim().isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }
        if (fetchConfig == null) {
            throw new IllegalArgumentException("Fetch configuration cannot be null");
        }
        fetchConfig.validate();
    }

    @Override
    public String toString() {
        return "Configuration[username=" + username + ", password=***, fetchConfig="
                + fetchConfig.getConfigurationSummary() + "]";
    }
}
