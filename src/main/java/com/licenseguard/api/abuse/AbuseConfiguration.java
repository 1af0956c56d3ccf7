package com.licenseguard.api.abuse;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties used by the abuse mitigation components.
 */
@Validated
@ConfigurationProperties("app.abuse")
@Data
public class AbuseConfiguration {

    /**
     * Device cap for users that don't have an override of their own.
     */
    @Min(1)
    private final int defaultMaxDevicesPerUser;

    @NotNull
    private final EnforcementMode deviceCapMode;

    /**
     * Length of a rate limit window. Windows are aligned to the Unix epoch.
     */
    @NotNull
    private final Duration rateLimitWindow;

    @Min(1)
    private final int maxDevicesPerIpPerWindow;

    @Min(1)
    private final int maxDevicesPerUserPerWindow;

    @NotNull
    private final EnforcementMode rateLimitMode;

    /**
     * Number of devices linked to a user within {@link #churnWindow} that counts as churn.
     */
    @Min(1)
    private final int churnThreshold;

    @NotNull
    private final Duration churnWindow;

    /**
     * Number of devices created from one ip address within a rate limit window that counts as rapid
     * creation.
     */
    @Min(1)
    private final int rapidCreationThreshold;

    /**
     * Whether to take the client address from the first {@code X-Forwarded-For} entry. Enable it
     * only behind a proxy that overwrites the header.
     */
    private final boolean trustForwardedHeader;

    @NotNull
    private final Duration rateLimitWindowRetention;

    @NotNull
    private final Duration riskEventRetention;
}
