package com.licenseguard.api.identity;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties used by the lease token components in the identity package.
 */
@Validated
@ConfigurationProperties("app.auth")
@Data
class AuthConfiguration {

    /**
     * HMAC secret to sign lease tokens.
     */
    @NotBlank
    private final String hmacSecret;

    /**
     * Validity of a lease token after it is issued. Clients must refresh their lease before it
     * runs out.
     */
    @NotNull
    private final Duration leaseTokenExpiry;

    /**
     * Maximum number of device id to fingerprint mappings kept in memory while verifying leases.
     */
    private final long deviceHashCacheSize;
}
