package de.alive.otpfetch.infrastructure;

import org.jetbrains.annotations.NotNull;
import reactor.core.publisher.Mono;

public interface ConnectionManager {

    @NotNull Mono<IConnection> createConnection();
    @NotNull Mono<Boolean> closeConnection(@NotNull IConnection connection);
}
