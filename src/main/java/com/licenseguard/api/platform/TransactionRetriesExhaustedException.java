package com.licenseguard.api.platform;

import lombok.Getter;

/**
 * Thrown by {@link TransactionRetryExecutor} when a unit of work keeps conflicting with concurrent
 * writers after the configured number of attempts. The caller may safely retry the request.
 */
@Getter
public class TransactionRetriesExhaustedException extends RuntimeException {

    private final int attempts;

    public TransactionRetriesExhaustedException(int attempts, Throwable cause) {
        super(String.format("transaction failed after %d attempts", attempts), cause);
        this.attempts = attempts;
    }
}
