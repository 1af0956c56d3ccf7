package com.licenseguard.api.subscription;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Collection of scheduled tasks for {@link SubscriptionService}.
 */
@Component
@Slf4j
class SubscriptionScheduledTasks {

    private final SubscriptionService subscriptionService;

    @Autowired
    SubscriptionScheduledTasks(@NonNull SubscriptionService subscriptionService) {
        this.subscriptionService = subscriptionService;
    }

    @Scheduled(cron = "${app.subscriptions.expiration-schedule}")
    void expireLapsedSubscriptions() {
        log.info("expiring lapsed subscriptions");
        subscriptionService.expireLapsedSubscriptions();
    }

    @Scheduled(cron = "${app.subscriptions.reconciliation-schedule}")
    void reconcileWithStripe() {
        log.info("reconciling subscriptions with stripe");
        subscriptionService.reconcileWithStripe();
    }
}
