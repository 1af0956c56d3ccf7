package com.licenseguard.api.subscription;

import com.licenseguard.api.subscription.models.PlanTier;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration properties used by various components in the subscription package.
 */
@Validated
@ConfigurationProperties("app.subscriptions")
@Data
class SubscriptionConfiguration {

    @NotBlank
    private final String stripeApiKey;

    @NotBlank
    private final String stripeWebhookSecret;

    /**
     * Maps Stripe price ids to the plans they sell. It may be {@literal null} if no price is
     * mapped.
     */
    private final Map<String, PlanTier> pricePlans;

    /**
     * Plan of a paid subscription whose price isn't listed in {@link #pricePlans}.
     */
    @NotNull
    private final PlanTier defaultPlan;

    @NotNull
    private final Duration planCacheTtl;
}
