package com.licenseguard.api.device;

import com.licenseguard.api.abuse.AbuseConfiguration;
import com.licenseguard.api.abuse.AbuseSignalDetector;
import com.licenseguard.api.abuse.DeviceCreationRateLimiter;
import com.licenseguard.api.abuse.RateLimitDecision;
import com.licenseguard.api.abuse.entities.IdentifierType;
import com.licenseguard.api.device.entities.DeviceRepository;
import com.licenseguard.api.device.entities.DeviceUserRepository;
import com.licenseguard.api.device.exceptions.DeviceCapExceededException;
import com.licenseguard.api.device.exceptions.DeviceCreationRateLimitException;
import com.licenseguard.api.identity.entities.User;
import com.licenseguard.api.identity.entities.UserRepository;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;

/**
 * <p>
 * Registers a (user, device) pair as one all-or-nothing unit: user and device create-or-fetch,
 * rate limiting, trial start, device cap and association.</p>
 *
 * <p>
 * Creations rely on unique constraints. A unit that loses a race fails with a
 * {@link org.springframework.dao.DataIntegrityViolationException} and rolls back entirely, so the
 * caller must run it through {@link com.licenseguard.api.platform.TransactionRetryExecutor}.</p>
 */
@Component
@Slf4j
class DeviceRegistrar {

    private final AbuseConfiguration abuseConfig;
    private final UserRepository userRepository;
    private final DeviceRepository deviceRepository;
    private final DeviceUserRepository deviceUserRepository;
    private final DeviceCreationRateLimiter rateLimiter;
    private final AbuseSignalDetector signalDetector;
    private final TrialService trialService;
    private final DeviceCapEnforcer capEnforcer;

    @Autowired
    DeviceRegistrar(
        @NonNull AbuseConfiguration abuseConfig,
        @NonNull UserRepository userRepository,
        @NonNull DeviceRepository deviceRepository,
        @NonNull DeviceUserRepository deviceUserRepository,
        @NonNull DeviceCreationRateLimiter rateLimiter,
        @NonNull AbuseSignalDetector signalDetector,
        @NonNull TrialService trialService,
        @NonNull DeviceCapEnforcer capEnforcer
    ) {
        this.abuseConfig = abuseConfig;
        this.userRepository = userRepository;
        this.deviceRepository = deviceRepository;
        this.deviceUserRepository = deviceUserRepository;
        this.rateLimiter = rateLimiter;
        this.signalDetector = signalDetector;
        this.trialService = trialService;
        this.capEnforcer = capEnforcer;
    }

    /**
     * @param email      email of the user, as submitted.
     * @param deviceHash fingerprint of the device.
     * @param ipAddress  source address of the request, if known.
     * @return the registered pair and the trial of the device.
     * @throws DeviceCreationRateLimitException if a rate limit is breached in blocking mode.
     * @throws DeviceCapExceededException       if the device cap is exceeded in blocking mode.
     */
    @NonNull
    @Transactional(rollbackFor = Throwable.class)
    public Registration register(
        @NonNull String email,
        @NonNull String deviceHash,
        String ipAddress
    ) throws DeviceCreationRateLimitException, DeviceCapExceededException {
        val user = findOrCreateUser(User.normaliseEmail(email));
        var device = deviceRepository.findByDeviceHash(deviceHash).orElse(null);
        val newAssociation = device == null || !deviceUserRepository.existsByUserIdAndDeviceId(user.getId(), device.getId());
        if (newAssociation) {
            // the user-scoped window stays locked until commit, which serialises the cap check below.
            enforce(rateLimiter.checkAndIncrement(String.valueOf(user.getId()), IdentifierType.USER), user, ipAddress);
            if (ipAddress != null) {
                val ipDecision = rateLimiter.checkAndIncrement(ipAddress, IdentifierType.IP);
                signalDetector.ipCreationCounted(ipDecision, user.getId(), ipAddress);
                enforce(ipDecision, user, ipAddress);
            }
        }

        if (device == null) {
            deviceRepository.insert(deviceHash);
            device = deviceRepository.findByDeviceHash(deviceHash)
                .orElseThrow(() -> new IllegalStateException("device vanished within its transaction"));
        } else {
            deviceRepository.touchLastSeen(device.getId(), OffsetDateTime.now());
        }

        device = trialService.startTrialIfEligible(device);
        if (newAssociation) {
            capEnforcer.checkNewAssociation(user, device.getId(), ipAddress);
            deviceUserRepository.insert(user.getId(), device.getId());
            val recent = deviceUserRepository.countByUserIdCreatedSince(
                user.getId(), OffsetDateTime.now().minus(abuseConfig.getChurnWindow()));

            signalDetector.deviceLinked(user.getId(), device.getId(), ipAddress, recent);
            log.info("linked device {} to user {}", device.getId(), user.getId());
        }

        return Registration.builder()
            .userId(user.getId())
            .deviceId(device.getId())
            .trialStartedAt(device.getTrialStartedAt())
            .trialEndedAt(device.getTrialEndedAt())
            .newAssociation(newAssociation)
            .build();
    }

    @NonNull
    private User findOrCreateUser(@NonNull String email) {
        return userRepository.findByEmail(email).orElseGet(() -> {
            userRepository.insert(email);
            return userRepository.findByEmail(email)
                .orElseThrow(() -> new IllegalStateException("user vanished within its transaction"));
        });
    }

    private void enforce(
        @NonNull RateLimitDecision decision,
        @NonNull User user,
        String ipAddress
    ) throws DeviceCreationRateLimitException {
        if (!decision.isExceeded()) {
            return;
        }

        signalDetector.rateLimitBreached(decision, user.getId(), ipAddress);
        if (abuseConfig.getRateLimitMode().isBlocking()) {
            throw new DeviceCreationRateLimitException(decision);
        }

        log.info("device creation rate limit exceeded in detection mode: user={} ip={}", user.getId(), ipAddress);
    }

    /**
     * Outcome of a successful {@link #register(String, String, String)} call.
     */
    @Value
    @Builder
    static class Registration {

        long userId;
        long deviceId;
        OffsetDateTime trialStartedAt;
        OffsetDateTime trialEndedAt;

        /**
         * Whether the call linked the device to the user for the first time.
         */
        boolean newAssociation;
    }
}
