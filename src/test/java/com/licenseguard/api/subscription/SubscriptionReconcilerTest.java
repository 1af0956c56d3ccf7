package com.licenseguard.api.subscription;

import com.licenseguard.api.abuse.RiskEventRecorder;
import com.licenseguard.api.abuse.entities.RiskEventType;
import com.licenseguard.api.identity.entities.UserRepository;
import com.licenseguard.api.subscription.entities.Plan;
import com.licenseguard.api.subscription.entities.Subscription;
import com.licenseguard.api.subscription.entities.SubscriptionRepository;
import com.licenseguard.api.subscription.exceptions.WebhookEventException;
import com.licenseguard.api.subscription.models.PlanTier;
import com.licenseguard.api.subscription.models.SubscriptionSnapshot;
import com.licenseguard.api.subscription.models.SubscriptionStatus;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SubscriptionReconcilerTest {

    private static final String STRIPE_SUBSCRIPTION_ID = "sub_test_1";
    private static final OffsetDateTime PERIOD_START = OffsetDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.SECONDS);
    private static final OffsetDateTime PERIOD_END = PERIOD_START.plusDays(30);

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private PlanCatalog planCatalog;

    @Mock
    private RiskEventRecorder riskEventRecorder;

    private SubscriptionReconciler reconciler;

    @BeforeEach
    void setUp() {
        reconciler = new SubscriptionReconciler(subscriptionRepository, userRepository, planCatalog, riskEventRecorder);
    }

    @Test
    void apply_checkoutCompletedForNewSubscription() throws WebhookEventException {
        val proPlan = buildPlan(PlanTier.PRO);
        when(subscriptionRepository.findByStripeSubscriptionId(STRIPE_SUBSCRIPTION_ID)).thenReturn(Optional.empty());
        when(userRepository.existsById(5L)).thenReturn(true);
        when(planCatalog.getPlanForPrice("price_pro_monthly")).thenReturn(proPlan);

        reconciler.apply("evt_1", SubscriptionReconciler.CHECKOUT_SESSION_COMPLETED, buildSnapshot("active", 5L, "price_pro_monthly"));

        val saved = captureSavedSubscription();
        assertEquals(5L, saved.getUserId());
        assertEquals(SubscriptionStatus.ACTIVE, saved.getStatus());
        assertEquals(STRIPE_SUBSCRIPTION_ID, saved.getStripeSubscriptionId());
        assertEquals("cus_test_1", saved.getStripeCustomerId());
        assertSame(proPlan, saved.getPlan());
        assertEquals(PERIOD_START, saved.getCurrentPeriodStart());
        assertEquals(PERIOD_END, saved.getCurrentPeriodEnd());
        assertNull(saved.getCanceledAt());
        assertNull(saved.getTrialEnd());
        assertFalse(saved.isCancelAtPeriodEnd());
    }

    @Test
    void apply_checkoutCompletedWithoutUser() {
        when(subscriptionRepository.findByStripeSubscriptionId(STRIPE_SUBSCRIPTION_ID)).thenReturn(Optional.empty());
        val snapshot = buildSnapshot("active", null, "price_pro_monthly");

        assertThrows(WebhookEventException.class,
            () -> reconciler.apply("evt_1", SubscriptionReconciler.CHECKOUT_SESSION_COMPLETED, snapshot));
        verify(subscriptionRepository, never()).save(any());
    }

    @Test
    void apply_checkoutCompletedWithUnknownUser() {
        when(subscriptionRepository.findByStripeSubscriptionId(STRIPE_SUBSCRIPTION_ID)).thenReturn(Optional.empty());
        when(userRepository.existsById(404L)).thenReturn(false);
        val snapshot = buildSnapshot("active", 404L, "price_pro_monthly");

        assertThrows(WebhookEventException.class,
            () -> reconciler.apply("evt_1", SubscriptionReconciler.CHECKOUT_SESSION_COMPLETED, snapshot));
        verify(subscriptionRepository, never()).save(any());
    }

    @Test
    void apply_checkoutCompletedForReturningCustomer() throws WebhookEventException {
        val previous = buildSubscription(SubscriptionStatus.EXPIRED, PERIOD_START.minusDays(40));
        previous.setStripeSubscriptionId("sub_test_old");
        previous.setStripeCustomerId("cus_test_1");
        when(subscriptionRepository.findByStripeSubscriptionId(STRIPE_SUBSCRIPTION_ID)).thenReturn(Optional.empty());
        when(subscriptionRepository.findByStripeCustomerId("cus_test_1")).thenReturn(Optional.of(previous));
        when(userRepository.existsById(5L)).thenReturn(true);
        when(planCatalog.getPlanForPrice("price_pro_monthly")).thenReturn(buildPlan(PlanTier.PRO));

        reconciler.apply("evt_1", SubscriptionReconciler.CHECKOUT_SESSION_COMPLETED, buildSnapshot("active", 5L, "price_pro_monthly"));

        val saved = captureSavedSubscription();
        assertSame(previous, saved);
        assertEquals(STRIPE_SUBSCRIPTION_ID, saved.getStripeSubscriptionId());
        assertEquals(SubscriptionStatus.ACTIVE, saved.getStatus());
        assertNull(saved.getCanceledAt());
        verifyNoInteractions(riskEventRecorder);
    }

    @Test
    void apply_checkoutCompletedForCustomerOfAnotherUser() {
        val foreign = buildSubscription(SubscriptionStatus.ACTIVE, null);
        foreign.setStripeSubscriptionId("sub_test_other");
        when(subscriptionRepository.findByStripeSubscriptionId(STRIPE_SUBSCRIPTION_ID)).thenReturn(Optional.empty());
        when(subscriptionRepository.findByStripeCustomerId("cus_test_1")).thenReturn(Optional.of(foreign));
        when(userRepository.existsById(6L)).thenReturn(true);
        val snapshot = buildSnapshot("active", 6L, "price_pro_monthly");

        assertThrows(WebhookEventException.class,
            () -> reconciler.apply("evt_1", SubscriptionReconciler.CHECKOUT_SESSION_COMPLETED, snapshot));
        verify(subscriptionRepository, never()).save(any());
    }

    @Test
    void apply_updatedForUnknownSubscription() {
        when(subscriptionRepository.findByStripeSubscriptionId(STRIPE_SUBSCRIPTION_ID)).thenReturn(Optional.empty());
        val snapshot = buildSnapshot("active", null, null);

        assertThrows(WebhookEventException.class,
            () -> reconciler.apply("evt_2", SubscriptionReconciler.SUBSCRIPTION_UPDATED, snapshot));
    }

    @Test
    void apply_updatedToPastDue() throws WebhookEventException {
        val basicPlan = buildPlan(PlanTier.BASIC);
        val existing = buildSubscription(SubscriptionStatus.ACTIVE, null);
        existing.setPlan(basicPlan);
        when(subscriptionRepository.findByStripeSubscriptionId(STRIPE_SUBSCRIPTION_ID)).thenReturn(Optional.of(existing));

        reconciler.apply("evt_2", SubscriptionReconciler.SUBSCRIPTION_UPDATED, buildSnapshot("past_due", null, null));

        val saved = captureSavedSubscription();
        assertEquals(SubscriptionStatus.EXPIRED, saved.getStatus());
        assertSame(basicPlan, saved.getPlan());
        verify(planCatalog, never()).getPlanForPrice(anyString());
        verifyNoInteractions(riskEventRecorder);
    }

    @Test
    void apply_deleted() throws WebhookEventException {
        val existing = buildSubscription(SubscriptionStatus.ACTIVE, null);
        when(subscriptionRepository.findByStripeSubscriptionId(STRIPE_SUBSCRIPTION_ID)).thenReturn(Optional.of(existing));

        // a deleted event expires the subscription regardless of the status it carries
        reconciler.apply("evt_3", SubscriptionReconciler.SUBSCRIPTION_DELETED, buildSnapshot("active", null, null));

        val saved = captureSavedSubscription();
        assertEquals(SubscriptionStatus.EXPIRED, saved.getStatus());
        assertNotNull(saved.getCanceledAt());
    }

    @Test
    void apply_updatedAfterDeleted() throws WebhookEventException {
        val existing = buildSubscription(SubscriptionStatus.EXPIRED, PERIOD_START.plusDays(1));
        when(subscriptionRepository.findByStripeSubscriptionId(STRIPE_SUBSCRIPTION_ID)).thenReturn(Optional.of(existing));
        when(planCatalog.getPlanForPrice("price_basic_monthly")).thenReturn(buildPlan(PlanTier.BASIC));

        reconciler.apply("evt_4", SubscriptionReconciler.SUBSCRIPTION_UPDATED, buildSnapshot("active", null, "price_basic_monthly"));

        assertEquals(SubscriptionStatus.ACTIVE, captureSavedSubscription().getStatus());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);
        verify(riskEventRecorder).record(eq(RiskEventType.RECONCILIATION_PERFORMED), eq(5L), isNull(), isNull(), metadata.capture());
        assertEquals("STATUS_REGRESSION", metadata.getValue().get("reason"));
        assertEquals("evt_4", metadata.getValue().get("eventId"));
    }

    @Test
    void apply_unhandledEventType() throws WebhookEventException {
        reconciler.apply("evt_5", "invoice.paid", null);
        verifyNoInteractions(subscriptionRepository, userRepository, planCatalog, riskEventRecorder);
    }

    @Test
    void reconcile_withMismatch() {
        val existing = buildSubscription(SubscriptionStatus.ACTIVE, null);
        existing.setCurrentPeriodEnd(PERIOD_END);
        when(subscriptionRepository.findByStripeSubscriptionId(STRIPE_SUBSCRIPTION_ID)).thenReturn(Optional.of(existing));

        assertTrue(reconciler.reconcile(buildSnapshot("canceled", null, null)));
        assertEquals(SubscriptionStatus.EXPIRED, captureSavedSubscription().getStatus());
        verify(riskEventRecorder).record(eq(RiskEventType.RECONCILIATION_PERFORMED), eq(5L), isNull(), isNull(), anyMap());
    }

    @Test
    void reconcile_withoutMismatch() {
        val existing = buildSubscription(SubscriptionStatus.ACTIVE, null);
        existing.setCurrentPeriodEnd(PERIOD_END.withOffsetSameInstant(ZoneOffset.ofHours(5)));
        when(subscriptionRepository.findByStripeSubscriptionId(STRIPE_SUBSCRIPTION_ID)).thenReturn(Optional.of(existing));

        assertFalse(reconciler.reconcile(buildSnapshot("trialing", null, null)));
        verify(subscriptionRepository, never()).save(any());
        verifyNoInteractions(riskEventRecorder);
    }

    @Test
    void reconcile_withUnknownSubscription() {
        when(subscriptionRepository.findByStripeSubscriptionId(STRIPE_SUBSCRIPTION_ID)).thenReturn(Optional.empty());
        assertFalse(reconciler.reconcile(buildSnapshot("active", null, null)));
        verifyNoInteractions(riskEventRecorder);
    }

    private Subscription captureSavedSubscription() {
        val captor = ArgumentCaptor.forClass(Subscription.class);
        verify(subscriptionRepository).save(captor.capture());
        return captor.getValue();
    }

    private static SubscriptionSnapshot buildSnapshot(String status, Long userId, String priceId) {
        return SubscriptionSnapshot.builder()
            .stripeSubscriptionId(STRIPE_SUBSCRIPTION_ID)
            .stripeCustomerId("cus_test_1")
            .providerStatus(status)
            .userId(userId)
            .priceId(priceId)
            .currentPeriodStart(PERIOD_START)
            .currentPeriodEnd(PERIOD_END)
            .build();
    }

    private static Subscription buildSubscription(SubscriptionStatus status, OffsetDateTime canceledAt) {
        return Subscription.builder()
            .id(1L)
            .userId(5L)
            .stripeSubscriptionId(STRIPE_SUBSCRIPTION_ID)
            .status(status)
            .canceledAt(canceledAt)
            .build();
    }

    private static Plan buildPlan(PlanTier tier) {
        return Plan.builder()
            .id((short) (tier.ordinal() + 1))
            .name(tier)
            .build();
    }
}
