package com.licenseguard.api.subscription;

import com.licenseguard.api.subscription.exceptions.BillingProviderUnavailableException;
import com.licenseguard.api.subscription.exceptions.WebhookEventException;
import com.licenseguard.api.subscription.exceptions.WebhookPayloadException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for subscription related '{@code /v1/subscriptions}' routes.
 */
@Validated
@RestController
@RequestMapping("/v1/subscriptions")
@Slf4j
@Tag(name = "subscription")
class SubscriptionController {

    private final SubscriptionService subscriptionService;

    @Autowired
    SubscriptionController(@NonNull SubscriptionService subscriptionService) {
        this.subscriptionService = subscriptionService;
    }

    /**
     * <p>
     * Receives Stripe webhook events and applies the subscription lifecycle changes they carry.
     * Each event is applied at most once, so replays are acknowledged without side effects.</p>
     *
     * @return <ul>
     * <li>{@code HTTP 200} on successfully processing (or skipping a replay of) the event.</li>
     * <li>{@code HTTP 400} if the server was unable to verify or parse the event payload.</li>
     * <li>{@code HTTP 422} if the server was unable to process the event.</li>
     * <li>{@code HTTP 503} if Stripe couldn't be reached while processing the event.</li>
     * <li>{@code HTTP 500} on internal server errors.</li>
     * </ul>
     */
    @Operation(hidden = true)
    @NonNull
    @PostMapping("/stripe/webhook")
    ResponseEntity<Void> stripeWebhook(
        @Valid @NotBlank @RequestHeader("Stripe-Signature") String payloadSignature,
        @Valid @NotBlank @RequestBody String body
    ) {
        try {
            subscriptionService.handleStripeWebhookEvent(body, payloadSignature);
            return ResponseEntity.ok(null);
        } catch (WebhookPayloadException e) {
            log.info("failed to parse the event payload", e);
            return ResponseEntity.badRequest().build();
        } catch (WebhookEventException e) {
            log.info("failed to process the event payload", e);
            return ResponseEntity.unprocessableEntity().build();
        } catch (BillingProviderUnavailableException e) {
            log.warn("failed to reach stripe while processing the event", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }
}
