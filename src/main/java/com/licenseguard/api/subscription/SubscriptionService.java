package com.licenseguard.api.subscription;

import com.licenseguard.api.contracts.SubscriptionServiceContract;
import com.licenseguard.api.platform.TransactionRetriesExhaustedException;
import com.licenseguard.api.platform.TransactionRetryExecutor;
import com.licenseguard.api.subscription.entities.Subscription;
import com.licenseguard.api.subscription.entities.SubscriptionRepository;
import com.licenseguard.api.subscription.exceptions.BillingProviderUnavailableException;
import com.licenseguard.api.subscription.exceptions.WebhookEventException;
import com.licenseguard.api.subscription.exceptions.WebhookPayloadException;
import com.licenseguard.api.subscription.models.PlanFeatures;
import com.licenseguard.api.subscription.models.PlanTier;
import com.licenseguard.api.subscription.models.SubscriptionSnapshot;
import com.licenseguard.api.subscription.models.SubscriptionState;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.exception.StripeException;
import com.stripe.model.Event;
import com.stripe.model.checkout.Session;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Optional;

/**
 * Ingests billing events and exposes the resulting subscription state.
 */
@Service
@Slf4j
class SubscriptionService implements SubscriptionServiceContract {

    private final SubscriptionConfiguration subscriptionConfig;
    private final SubscriptionRepository subscriptionRepository;
    private final PlanCatalog planCatalog;
    private final StripeApi stripeApi;
    private final WebhookIdempotencyLedger ledger;
    private final SubscriptionReconciler reconciler;
    private final TransactionRetryExecutor retryExecutor;

    @Autowired
    SubscriptionService(
        @NonNull SubscriptionConfiguration subscriptionConfig,
        @NonNull SubscriptionRepository subscriptionRepository,
        @NonNull PlanCatalog planCatalog,
        @NonNull StripeApi stripeApi,
        @NonNull WebhookIdempotencyLedger ledger,
        @NonNull SubscriptionReconciler reconciler,
        @NonNull TransactionRetryExecutor retryExecutor
    ) {
        this.subscriptionConfig = subscriptionConfig;
        this.subscriptionRepository = subscriptionRepository;
        this.planCatalog = planCatalog;
        this.stripeApi = stripeApi;
        this.ledger = ledger;
        this.reconciler = reconciler;
        this.retryExecutor = retryExecutor;
    }

    /**
     * Verifies and decodes a Stripe webhook payload and ingests the event it carries.
     *
     * @param payload   raw request body.
     * @param signature value of the {@code Stripe-Signature} header.
     * @throws WebhookPayloadException             if the signature doesn't match or the payload is
     *                                              malformed.
     * @throws WebhookEventException                if the event can't be applied to the local state.
     * @throws BillingProviderUnavailableException if Stripe couldn't be reached to resolve the
     *                                              subscription that the event refers to.
     */
    public void handleStripeWebhookEvent(
        @NonNull String payload,
        @NonNull String signature
    ) throws WebhookPayloadException, WebhookEventException, BillingProviderUnavailableException {
        final Event event;
        try {
            event = stripeApi.decodeWebhookPayload(payload, signature, subscriptionConfig.getStripeWebhookSecret());
        } catch (SignatureVerificationException e) {
            throw new WebhookPayloadException("failed to verify payload signature", e);
        }

        // replays are acknowledged without resolving their payload.
        if (ledger.isProcessed(event.getId())) {
            log.info("ignoring replayed stripe event: id={} type={}", event.getId(), event.getType());
            return;
        }

        final SubscriptionSnapshot snapshot;
        switch (event.getType()) {
            case SubscriptionReconciler.CHECKOUT_SESSION_COMPLETED:
                val session = (Session) event.getDataObjectDeserializer().getObject()
                    .orElseThrow(() -> new WebhookPayloadException("failed to get session object from the event payload"));

                snapshot = snapshotOfCheckoutSession(session);
                break;
            case SubscriptionReconciler.SUBSCRIPTION_UPDATED:
            case SubscriptionReconciler.SUBSCRIPTION_DELETED:
                val stripeSubscription = (com.stripe.model.Subscription) event.getDataObjectDeserializer().getObject()
                    .orElseThrow(() -> new WebhookPayloadException("failed to get subscription object from the event payload"));

                snapshot = StripeSnapshots.fromSubscription(stripeSubscription, null);
                break;
            default:
                snapshot = null;
                break;
        }

        ingestBillingEvent(event.getId(), event.getType(), snapshot);
    }

    /**
     * Applies a billing event at most once. Replays and concurrent duplicates are successful
     * no-ops.
     *
     * @param eventId   provider assigned id of the event.
     * @param eventType provider assigned type of the event.
     * @param snapshot  subscription state carried by the event, {@literal null} for event types
     *                  that don't affect subscriptions.
     * @return {@code true} if the event was applied, {@code false} if it had already been applied.
     * @throws WebhookEventException if the event can't be applied to the local state.
     */
    public boolean ingestBillingEvent(
        @NonNull String eventId,
        @NonNull String eventType,
        SubscriptionSnapshot snapshot
    ) throws WebhookEventException {
        return retryExecutor.execute(() -> ledger.processExternalEvent(
            eventId, eventType, () -> reconciler.apply(eventId, eventType, snapshot)));
    }

    /**
     * Expires active subscriptions whose current billing period has ended without a renewal.
     */
    void expireLapsedSubscriptions() {
        val count = subscriptionRepository.expireAllLapsedBefore(OffsetDateTime.now());
        log.info("expired {} lapsed subscriptions", count);
    }

    /**
     * Compares every locally known Stripe subscription with its provider state and corrects the
     * drifted ones. Subscriptions that can't be fetched are skipped until the next run.
     */
    void reconcileWithStripe() {
        var corrected = 0;
        for (val stripeSubscriptionId : subscriptionRepository.findAllStripeSubscriptionIds()) {
            try {
                val snapshot = StripeSnapshots.fromSubscription(stripeApi.getSubscription(stripeSubscriptionId), null);
                if (retryExecutor.execute(() -> reconciler.reconcile(snapshot))) {
                    corrected++;
                }
            } catch (StripeException e) {
                log.warn("failed to retrieve stripe subscription {}, skipping it", stripeSubscriptionId, e);
            } catch (TransactionRetriesExhaustedException e) {
                log.warn("failed to reconcile stripe subscription {}, skipping it", stripeSubscriptionId, e);
            }
        }

        log.info("reconciled {} subscriptions with stripe", corrected);
    }

    @NonNull
    @Override
    @Transactional(readOnly = true)
    public Optional<SubscriptionState> findCurrentSubscription(@NonNull Collection<Long> userIds, @NonNull OffsetDateTime now) {
        if (userIds.isEmpty()) {
            return Optional.empty();
        }

        val states = subscriptionRepository.findAllByUserIds(userIds).stream()
            .map(Subscription::toState)
            .toList();

        return states.stream()
            .filter(s -> s.isActiveAt(now))
            .findFirst()
            .or(() -> states.stream().findFirst());
    }

    @NonNull
    @Override
    public PlanFeatures getPlanFeatures(@NonNull PlanTier tier) {
        return planCatalog.getPlan(tier).getFeatures();
    }

    @NonNull
    private SubscriptionSnapshot snapshotOfCheckoutSession(
        @NonNull Session session
    ) throws WebhookPayloadException, BillingProviderUnavailableException {
        if (!"subscription".equals(session.getMode())) {
            throw new WebhookPayloadException("checkout session mode is not subscription");
        } else if (session.getSubscription() == null) {
            throw new WebhookPayloadException("checkout session subscription id is null");
        }

        val userId = StripeSnapshots.userIdOf(session);
        if (userId == null) {
            throw new WebhookPayloadException("checkout session doesn't identify its user");
        }

        final com.stripe.model.Subscription stripeSubscription;
        try {
            stripeSubscription = stripeApi.getSubscription(session.getSubscription());
        } catch (StripeException e) {
            throw new BillingProviderUnavailableException("failed to retrieve stripe subscription", e);
        }

        return StripeSnapshots.fromSubscription(stripeSubscription, userId);
    }
}
