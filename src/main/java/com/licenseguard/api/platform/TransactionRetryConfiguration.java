package com.licenseguard.api.platform;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for {@link TransactionRetryExecutor}.
 */
@Validated
@ConfigurationProperties("app.platform.transaction-retry")
@Data
public class TransactionRetryConfiguration {

    /**
     * Total number of attempts, including the first one.
     */
    @Min(1)
    private final int maxAttempts;

    /**
     * Base delay between two attempts. The actual delay grows linearly with the attempt number
     * and carries up to 100% random jitter.
     */
    @NotNull
    private final Duration backoff;
}
