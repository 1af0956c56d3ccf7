package com.licenseguard.api.subscription;

import com.licenseguard.api.abuse.entities.RiskEvent;
import com.licenseguard.api.abuse.entities.RiskEventRepository;
import com.licenseguard.api.abuse.entities.RiskEventType;
import com.licenseguard.api.identity.entities.UserRepository;
import com.licenseguard.api.subscription.entities.PlanRepository;
import com.licenseguard.api.subscription.entities.Subscription;
import com.licenseguard.api.subscription.entities.SubscriptionRepository;
import com.licenseguard.api.subscription.entities.WebhookEventRepository;
import com.licenseguard.api.subscription.models.PlanTier;
import com.licenseguard.api.subscription.models.SubscriptionSnapshot;
import com.licenseguard.api.subscription.models.SubscriptionStatus;
import com.stripe.exception.ApiConnectionException;
import lombok.NonNull;
import lombok.val;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.licenseguard.api.subscription.SubscriptionTestUtils.buildStripeSubscription;
import static com.licenseguard.api.subscription.SubscriptionTestUtils.randomStripeId;
import static com.licenseguard.api.testing.LicenseTestUtils.randomEmail;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@SpringBootTest
@ActiveProfiles("test")
public class SubscriptionServiceTest {

    private static final int CONCURRENCY = 8;

    @Autowired
    private SubscriptionService subscriptionService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private PlanRepository planRepository;

    @Autowired
    private SubscriptionRepository subscriptionRepository;

    @Autowired
    private WebhookEventRepository webhookEventRepository;

    @Autowired
    private RiskEventRepository riskEventRepository;

    @MockBean
    private StripeApi stripeApi;

    @Test
    void ingestBillingEvent_concurrently() throws Exception {
        val subscription = createSubscription(SubscriptionStatus.ACTIVE, OffsetDateTime.now().plusDays(10));
        val eventId = randomStripeId("evt");
        val snapshot = SubscriptionSnapshot.builder()
            .stripeSubscriptionId(subscription.getStripeSubscriptionId())
            .providerStatus("past_due")
            .build();

        val executor = Executors.newFixedThreadPool(CONCURRENCY);
        try {
            val ready = new CountDownLatch(CONCURRENCY);
            val start = new CountDownLatch(1);
            final Callable<Boolean> task = () -> {
                ready.countDown();
                start.await();
                return subscriptionService.ingestBillingEvent(eventId, SubscriptionReconciler.SUBSCRIPTION_UPDATED, snapshot);
            };

            val futures = new ArrayList<Future<Boolean>>();
            for (int i = 0; i < CONCURRENCY; i++) {
                futures.add(executor.submit(task));
            }

            ready.await();
            start.countDown();

            var applied = 0;
            for (val future : futures) {
                if (future.get(60, TimeUnit.SECONDS)) {
                    applied++;
                }
            }

            assertEquals(1, applied);
        } finally {
            executor.shutdownNow();
        }

        assertTrue(webhookEventRepository.existsById(eventId));
        assertEquals(SubscriptionStatus.EXPIRED,
            subscriptionRepository.findById(subscription.getId()).orElseThrow().getStatus());
    }

    @Test
    void expireLapsedSubscriptions() {
        val lapsed = createSubscription(SubscriptionStatus.ACTIVE, OffsetDateTime.now().minusMinutes(1));
        val running = createSubscription(SubscriptionStatus.ACTIVE, OffsetDateTime.now().plusDays(1));

        subscriptionService.expireLapsedSubscriptions();

        assertEquals(SubscriptionStatus.EXPIRED, subscriptionRepository.findById(lapsed.getId()).orElseThrow().getStatus());
        assertEquals(SubscriptionStatus.ACTIVE, subscriptionRepository.findById(running.getId()).orElseThrow().getStatus());
    }

    @Test
    void reconcileWithStripe() throws Exception {
        val periodEnd = OffsetDateTime.now().plusDays(10).truncatedTo(ChronoUnit.SECONDS);
        val drifted = createSubscription(SubscriptionStatus.ACTIVE, periodEnd);
        val inSync = createSubscription(SubscriptionStatus.ACTIVE, periodEnd);
        val unreachable = createSubscription(SubscriptionStatus.ACTIVE, periodEnd);

        // subscriptions created by other tests share the database. stripe doesn't know them.
        doThrow(new ApiConnectionException("stripe is unreachable")).when(stripeApi).getSubscription(anyString());

        val canceled = buildStripeSubscription(drifted.getStripeSubscriptionId(), "canceled", null);
        canceled.setCurrentPeriodEnd(periodEnd.toEpochSecond());
        doReturn(canceled).when(stripeApi).getSubscription(drifted.getStripeSubscriptionId());

        val active = buildStripeSubscription(inSync.getStripeSubscriptionId(), "active", null);
        active.setCurrentPeriodEnd(periodEnd.toEpochSecond());
        doReturn(active).when(stripeApi).getSubscription(inSync.getStripeSubscriptionId());

        subscriptionService.reconcileWithStripe();

        verify(stripeApi).getSubscription(drifted.getStripeSubscriptionId());
        verify(stripeApi).getSubscription(inSync.getStripeSubscriptionId());
        verify(stripeApi).getSubscription(unreachable.getStripeSubscriptionId());

        assertEquals(SubscriptionStatus.EXPIRED, subscriptionRepository.findById(drifted.getId()).orElseThrow().getStatus());
        assertEquals(SubscriptionStatus.ACTIVE, subscriptionRepository.findById(inSync.getId()).orElseThrow().getStatus());
        assertEquals(SubscriptionStatus.ACTIVE, subscriptionRepository.findById(unreachable.getId()).orElseThrow().getStatus());
        assertEquals(1, countReconciliations(drifted.getUserId()));
        assertEquals(0, countReconciliations(inSync.getUserId()));
        assertEquals(0, countReconciliations(unreachable.getUserId()));
    }

    @Test
    void findCurrentSubscription() {
        val expired = createSubscription(SubscriptionStatus.EXPIRED, OffsetDateTime.now().minusDays(3));
        val active = createSubscription(SubscriptionStatus.ACTIVE, OffsetDateTime.now().plusDays(3));

        val current = subscriptionService.findCurrentSubscription(
            List.of(expired.getUserId(), active.getUserId()), OffsetDateTime.now());

        assertEquals(active.getId(), current.orElseThrow().getId());
        assertEquals(PlanTier.BASIC, current.get().getPlan());
        assertTrue(subscriptionService.findCurrentSubscription(List.of(), OffsetDateTime.now()).isEmpty());
    }

    private long countReconciliations(long userId) {
        return riskEventRepository.findAllByUserId(userId).stream()
            .filter(e -> e.getEventType() == RiskEventType.RECONCILIATION_PERFORMED)
            .map(RiskEvent::getMetadata)
            .filter(m -> "PROVIDER_MISMATCH".equals(m.get("reason")))
            .count();
    }

    @NonNull
    private Subscription createSubscription(@NonNull SubscriptionStatus status, @NonNull OffsetDateTime periodEnd) {
        val email = randomEmail();
        userRepository.insert(email);
        val userId = userRepository.findByEmail(email).orElseThrow().getId();
        return subscriptionRepository.save(Subscription.builder()
            .userId(userId)
            .plan(planRepository.findByName(PlanTier.BASIC).orElseThrow())
            .stripeSubscriptionId(randomStripeId("sub"))
            .status(status)
            .currentPeriodStart(periodEnd.minusDays(30))
            .currentPeriodEnd(periodEnd)
            .build());
    }
}
