package com.licenseguard.api.subscription;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.NonNull;
import org.springframework.cache.Cache;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Beans used by the subscription package.
 */
@Configuration
class SubscriptionBeans {

    static final String PLAN_CACHE = "plan_cache";

    @NonNull
    @Bean
    StripeApi stripeApi(@NonNull SubscriptionConfiguration config) {
        return new StripeApi(config.getStripeApiKey());
    }

    @NonNull
    @Bean(name = PLAN_CACHE)
    Cache planCache(@NonNull SubscriptionConfiguration config) {
        return new CaffeineCache(PLAN_CACHE, Caffeine.newBuilder()
            .expireAfterWrite(config.getPlanCacheTtl())
            .maximumSize(10)
            .build());
    }
}
