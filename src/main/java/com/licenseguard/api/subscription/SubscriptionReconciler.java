package com.licenseguard.api.subscription;

import com.licenseguard.api.abuse.RiskEventRecorder;
import com.licenseguard.api.abuse.entities.RiskEventType;
import com.licenseguard.api.identity.entities.UserRepository;
import com.licenseguard.api.subscription.entities.Subscription;
import com.licenseguard.api.subscription.entities.SubscriptionRepository;
import com.licenseguard.api.subscription.exceptions.WebhookEventException;
import com.licenseguard.api.subscription.models.SubscriptionSnapshot;
import com.licenseguard.api.subscription.models.SubscriptionStatus;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Optional;

/**
 * <p>
 * Applies subscription lifecycle events to the local {@link Subscription} rows.</p>
 *
 * <p>
 * Every effect converges: applying it again to its own result produces the same row values.
 * Ordering across events of the same subscription isn't guaranteed by the provider. A deleted
 * event always forces {@link SubscriptionStatus#EXPIRED}. A later updated event is still applied,
 * and if it moves a canceled subscription back to {@link SubscriptionStatus#ACTIVE}, the
 * regression is recorded as a risk event for audit.</p>
 */
@Component
@Slf4j
class SubscriptionReconciler {

    static final String CHECKOUT_SESSION_COMPLETED = "checkout.session.completed";
    static final String SUBSCRIPTION_UPDATED = "customer.subscription.updated";
    static final String SUBSCRIPTION_DELETED = "customer.subscription.deleted";

    private final SubscriptionRepository subscriptionRepository;
    private final UserRepository userRepository;
    private final PlanCatalog planCatalog;
    private final RiskEventRecorder riskEventRecorder;

    @Autowired
    SubscriptionReconciler(
        @NonNull SubscriptionRepository subscriptionRepository,
        @NonNull UserRepository userRepository,
        @NonNull PlanCatalog planCatalog,
        @NonNull RiskEventRecorder riskEventRecorder
    ) {
        this.subscriptionRepository = subscriptionRepository;
        this.userRepository = userRepository;
        this.planCatalog = planCatalog;
        this.riskEventRecorder = riskEventRecorder;
    }

    /**
     * Applies the effect of a billing event. Event types other than the subscription lifecycle
     * events pass through untouched.
     *
     * @param eventId   id of the event, for the audit trail.
     * @param eventType provider assigned type of the event.
     * @param snapshot  subscription state carried by the event. It may only be {@literal null} for
     *                  pass-through event types.
     * @throws WebhookEventException if the event refers to an unknown subscription or user.
     */
    @Transactional(propagation = Propagation.MANDATORY, rollbackFor = Throwable.class)
    public void apply(@NonNull String eventId, @NonNull String eventType, SubscriptionSnapshot snapshot) throws WebhookEventException {
        switch (eventType) {
            case CHECKOUT_SESSION_COMPLETED:
                subscriptionCreated(eventId, Objects.requireNonNull(snapshot));
                break;
            case SUBSCRIPTION_UPDATED:
                subscriptionUpdated(eventId, Objects.requireNonNull(snapshot));
                break;
            case SUBSCRIPTION_DELETED:
                subscriptionDeleted(Objects.requireNonNull(snapshot));
                break;
            default:
                log.info("event type has no effect on subscriptions: id={} type={}", eventId, eventType);
                break;
        }
    }

    /**
     * Compares a subscription with the state fetched from the provider and corrects the local row
     * if they disagree. Corrections are recorded as risk events. Access is never granted without a
     * provider object to back it.
     *
     * @return {@code true} if the local row was corrected.
     */
    @Transactional(rollbackFor = Throwable.class)
    public boolean reconcile(@NonNull SubscriptionSnapshot snapshot) {
        val subscription = subscriptionRepository.findByStripeSubscriptionId(snapshot.getStripeSubscriptionId())
            .orElse(null);

        if (subscription == null) {
            log.warn("skipping reconciliation of an unknown subscription: {}", snapshot.getStripeSubscriptionId());
            return false;
        }

        val expectedStatus = SubscriptionStatus.fromStripeStatus(snapshot.getProviderStatus());
        if (subscription.getStatus() == expectedStatus
            && Objects.equals(instantOf(subscription.getCurrentPeriodEnd()), instantOf(snapshot.getCurrentPeriodEnd()))) {
            return false;
        }

        val metadata = new LinkedHashMap<String, Object>();
        metadata.put("reason", "PROVIDER_MISMATCH");
        metadata.put("stripeSubscriptionId", snapshot.getStripeSubscriptionId());
        metadata.put("previousStatus", subscription.getStatus().name());
        metadata.put("newStatus", expectedStatus.name());
        metadata.put("previousPeriodEnd", Objects.toString(subscription.getCurrentPeriodEnd(), null));
        metadata.put("newPeriodEnd", Objects.toString(snapshot.getCurrentPeriodEnd(), null));

        subscription.setStatus(expectedStatus);
        copyBillingFields(subscription, snapshot);
        subscriptionRepository.save(subscription);
        riskEventRecorder.record(RiskEventType.RECONCILIATION_PERFORMED, subscription.getUserId(), null, null, metadata);
        log.info("reconciled subscription {} with stripe: {}", subscription.getId(), metadata);
        return true;
    }

    private void subscriptionCreated(@NonNull String eventId, @NonNull SubscriptionSnapshot snapshot) throws WebhookEventException {
        val existing = subscriptionRepository.findByStripeSubscriptionId(snapshot.getStripeSubscriptionId());
        final Subscription subscription;
        if (existing.isPresent()) {
            subscription = existing.get();
        } else {
            val userId = snapshot.getUserId();
            if (userId == null) {
                throw new WebhookEventException("checkout session doesn't identify its user");
            }

            if (!userRepository.existsById(userId)) {
                throw new WebhookEventException("checkout session refers to an unknown user: " + userId);
            }

            subscription = findReturningCustomer(snapshot, userId)
                .orElseGet(() -> Subscription.builder().userId(userId).build());
        }

        transition(eventId, subscription, SubscriptionStatus.ACTIVE);
        subscription.setStripeSubscriptionId(snapshot.getStripeSubscriptionId());
        subscription.setPlan(planCatalog.getPlanForPrice(snapshot.getPriceId()));
        copyBillingFields(subscription, snapshot);
        subscriptionRepository.save(subscription);
        log.info("activated subscription for stripe subscription {}", snapshot.getStripeSubscriptionId());
    }

    private void subscriptionUpdated(@NonNull String eventId, @NonNull SubscriptionSnapshot snapshot) throws WebhookEventException {
        val subscription = findExisting(snapshot);
        transition(eventId, subscription, SubscriptionStatus.fromStripeStatus(snapshot.getProviderStatus()));
        if (snapshot.getPriceId() != null) {
            subscription.setPlan(planCatalog.getPlanForPrice(snapshot.getPriceId()));
        }

        copyBillingFields(subscription, snapshot);
        subscriptionRepository.save(subscription);
    }

    private void subscriptionDeleted(@NonNull SubscriptionSnapshot snapshot) throws WebhookEventException {
        val subscription = findExisting(snapshot);
        subscription.setStatus(SubscriptionStatus.EXPIRED);
        copyBillingFields(subscription, snapshot);
        if (subscription.getCanceledAt() == null) {
            subscription.setCanceledAt(OffsetDateTime.now());
        }

        subscriptionRepository.save(subscription);
        log.info("expired deleted stripe subscription {}", snapshot.getStripeSubscriptionId());
    }

    /**
     * A customer owns at most one subscription row. When a returning customer checks out again, the
     * row is re-pointed at the new Stripe subscription and its cancellation state is cleared.
     */
    @NonNull
    private Optional<Subscription> findReturningCustomer(
        @NonNull SubscriptionSnapshot snapshot,
        long userId
    ) throws WebhookEventException {
        if (snapshot.getStripeCustomerId() == null) {
            return Optional.empty();
        }

        val returning = subscriptionRepository.findByStripeCustomerId(snapshot.getStripeCustomerId());
        if (returning.isEmpty()) {
            return Optional.empty();
        }

        val subscription = returning.get();
        if (subscription.getUserId() != userId) {
            throw new WebhookEventException("stripe customer " + snapshot.getStripeCustomerId() + " belongs to another user");
        }

        log.info("re-pointing subscription {} of stripe customer {} from {} to {}", subscription.getId(),
            snapshot.getStripeCustomerId(), subscription.getStripeSubscriptionId(), snapshot.getStripeSubscriptionId());

        subscription.setCanceledAt(null);
        subscription.setTrialEnd(null);
        return Optional.of(subscription);
    }

    @NonNull
    private Subscription findExisting(@NonNull SubscriptionSnapshot snapshot) throws WebhookEventException {
        return subscriptionRepository.findByStripeSubscriptionId(snapshot.getStripeSubscriptionId())
            .orElseThrow(() -> new WebhookEventException(
                "subscription not found: " + snapshot.getStripeSubscriptionId()));
    }

    private void transition(@NonNull String eventId, @NonNull Subscription subscription, @NonNull SubscriptionStatus newStatus) {
        val regressed = subscription.getStatus() == SubscriptionStatus.EXPIRED
            && subscription.getCanceledAt() != null
            && newStatus == SubscriptionStatus.ACTIVE;

        if (regressed) {
            val metadata = new LinkedHashMap<String, Object>();
            metadata.put("reason", "STATUS_REGRESSION");
            metadata.put("eventId", eventId);
            metadata.put("stripeSubscriptionId", subscription.getStripeSubscriptionId());
            metadata.put("canceledAt", subscription.getCanceledAt().toString());
            riskEventRecorder.record(RiskEventType.RECONCILIATION_PERFORMED, subscription.getUserId(), null, null, metadata);
        }

        subscription.setStatus(newStatus);
    }

    private static void copyBillingFields(@NonNull Subscription subscription, @NonNull SubscriptionSnapshot snapshot) {
        if (snapshot.getStripeCustomerId() != null) {
            subscription.setStripeCustomerId(snapshot.getStripeCustomerId());
        }

        subscription.setCurrentPeriodStart(orElse(snapshot.getCurrentPeriodStart(), subscription.getCurrentPeriodStart()));
        subscription.setCurrentPeriodEnd(orElse(snapshot.getCurrentPeriodEnd(), subscription.getCurrentPeriodEnd()));
        subscription.setCancelAtPeriodEnd(snapshot.isCancelAtPeriodEnd());
        subscription.setCanceledAt(orElse(snapshot.getCanceledAt(), subscription.getCanceledAt()));
        subscription.setTrialEnd(orElse(snapshot.getTrialEnd(), subscription.getTrialEnd()));
    }

    /**
     * @return {@code value} if it is present, else {@code fallback}, which may be {@literal null}.
     */
    private static OffsetDateTime orElse(OffsetDateTime value, OffsetDateTime fallback) {
        return value != null ? value : fallback;
    }

    private static Object instantOf(OffsetDateTime time) {
        return time == null ? null : time.toInstant();
    }
}
