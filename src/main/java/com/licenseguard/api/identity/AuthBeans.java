package com.licenseguard.api.identity;


import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.NonNull;
import lombok.val;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Beans used by the lease token components in the identity package.
 */
@Configuration
class AuthBeans {

    static final String DEVICE_HASH_CACHE = "device_hashes";

    /**
     * Prevents Spring Web from automatically adding the auth filter bean to its filter chain
     * because it has to be added to Spring Security's filter chain and not Spring Web's.
     */
    @NonNull
    @Bean
    public FilterRegistrationBean<LeaseTokenAuthFilter> leaseTokenAuthFilterRegistration(LeaseTokenAuthFilter filter) {
        val registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    /**
     * Device fingerprints never change once a device row exists, so the cache needs no expiry.
     */
    @NonNull
    @Bean(DEVICE_HASH_CACHE)
    public Cache<Long, String> deviceHashCache(@NonNull AuthConfiguration authConfig) {
        return Caffeine.newBuilder()
            .maximumSize(authConfig.getDeviceHashCacheSize())
            .build();
    }
}
