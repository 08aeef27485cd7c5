package de.alive.otpfetch.infrastructure;

import org.jetbrains.annotations.NotNull;

import javax.mail.Store;

/**
 * An authenticated mailbox session handed out by the {@link ConnectionPool}.
 */
public interface IConnection {

    int getId();

    @NotNull Store getStore();

    boolean isConnected();
}
