package com.licenseguard.api.subscription;

import com.licenseguard.api.subscription.entities.Plan;
import com.licenseguard.api.subscription.entities.PlanRepository;
import com.licenseguard.api.subscription.models.PlanTier;
import lombok.NonNull;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.Cache;
import org.springframework.stereotype.Component;

/**
 * Resolves plans by tier and by Stripe price id. Plan rows are seeded reference data, so they are
 * cached.
 */
@Component
class PlanCatalog {

    private final SubscriptionConfiguration subscriptionConfig;
    private final PlanRepository planRepository;
    private final Cache cache;

    @Autowired
    PlanCatalog(
        @NonNull SubscriptionConfiguration subscriptionConfig,
        @NonNull PlanRepository planRepository,
        @NonNull @Qualifier(SubscriptionBeans.PLAN_CACHE) Cache cache
    ) {
        this.subscriptionConfig = subscriptionConfig;
        this.planRepository = planRepository;
        this.cache = cache;
    }

    /**
     * @throws IllegalStateException if the plan wasn't seeded.
     */
    @NonNull
    Plan getPlan(@NonNull PlanTier tier) {
        return cache.get(tier, () -> planRepository.findByName(tier)
            .orElseThrow(() -> new IllegalStateException("plan not seeded: " + tier)));
    }

    /**
     * @param priceId a Stripe price id, or {@literal null}.
     * @return the plan sold at the given price, or the default paid plan if the price isn't mapped.
     */
    @NonNull
    Plan getPlanForPrice(String priceId) {
        val pricePlans = subscriptionConfig.getPricePlans();
        var tier = priceId == null || pricePlans == null ? null : pricePlans.get(priceId);
        if (tier == null) {
            tier = subscriptionConfig.getDefaultPlan();
        }

        return getPlan(tier);
    }
}
