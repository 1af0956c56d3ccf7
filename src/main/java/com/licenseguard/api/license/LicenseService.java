package com.licenseguard.api.license;

import com.licenseguard.api.contracts.LeaseTokenServiceContract;
import com.licenseguard.api.contracts.LicenseServiceContract;
import com.licenseguard.api.contracts.SubscriptionServiceContract;
import com.licenseguard.api.device.entities.Device;
import com.licenseguard.api.device.entities.DeviceRepository;
import com.licenseguard.api.device.entities.DeviceUserRepository;
import com.licenseguard.api.license.exceptions.DeviceNotFoundException;
import com.licenseguard.api.license.models.EntitlementSnapshot;
import com.licenseguard.api.license.payload.LicenseStatusResponse;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;

/**
 * Evaluates device licenses and refreshes their leases.
 */
@Service
@Slf4j
class LicenseService implements LicenseServiceContract {

    private final DeviceRepository deviceRepository;
    private final DeviceUserRepository deviceUserRepository;
    private final SubscriptionServiceContract subscriptionServiceContract;
    private final LeaseTokenServiceContract leaseTokenServiceContract;
    private final LicenseStatusEvaluator evaluator;

    @Autowired
    LicenseService(
        @NonNull DeviceRepository deviceRepository,
        @NonNull DeviceUserRepository deviceUserRepository,
        @NonNull SubscriptionServiceContract subscriptionServiceContract,
        @NonNull LeaseTokenServiceContract leaseTokenServiceContract,
        @NonNull LicenseStatusEvaluator evaluator
    ) {
        this.deviceRepository = deviceRepository;
        this.deviceUserRepository = deviceUserRepository;
        this.subscriptionServiceContract = subscriptionServiceContract;
        this.leaseTokenServiceContract = leaseTokenServiceContract;
        this.evaluator = evaluator;
    }

    /**
     * Evaluates the current entitlement of the device with the given fingerprint. It doesn't
     * modify any state.
     *
     * @throws DeviceNotFoundException if the fingerprint was never registered.
     */
    @NonNull
    @Transactional(readOnly = true)
    public EntitlementSnapshot evaluateLicense(@NonNull String deviceHash) throws DeviceNotFoundException {
        val device = deviceRepository.findByDeviceHash(deviceHash)
            .orElseThrow(() -> new DeviceNotFoundException("device not found"));

        return evaluate(device);
    }

    @NonNull
    @Override
    @Transactional(readOnly = true)
    public EntitlementSnapshot evaluateLicense(long deviceId) throws DeviceNotFoundException {
        val device = deviceRepository.findById(deviceId)
            .orElseThrow(() -> new DeviceNotFoundException("device not found: " + deviceId));

        return evaluate(device);
    }

    /**
     * Marks the device as seen, evaluates its license and issues a new lease carrying the result.
     *
     * @param deviceId id of the device holding a valid lease.
     * @throws DeviceNotFoundException if the device no longer exists.
     */
    @NonNull
    @Transactional(rollbackFor = Throwable.class)
    public LicenseStatusResponse refreshLicense(long deviceId) throws DeviceNotFoundException {
        if (deviceRepository.touchLastSeen(deviceId, OffsetDateTime.now()) == 0) {
            throw new DeviceNotFoundException("device not found: " + deviceId);
        }

        val entitlement = evaluateLicense(deviceId);
        val plan = entitlement.getPlan() == null ? null : entitlement.getPlan().name();
        val leaseToken = leaseTokenServiceContract.issueLeaseToken(
            deviceId, entitlement.getLicenseStatus(), entitlement.getExpiresAt(), plan);

        log.debug("refreshed lease of device {}: status={}", deviceId, entitlement.getLicenseStatus());
        return LicenseStatusResponse.from(entitlement, leaseToken);
    }

    @NonNull
    private EntitlementSnapshot evaluate(@NonNull Device device) {
        val now = OffsetDateTime.now();
        val userIds = deviceUserRepository.findUserIdsByDeviceId(device.getId());
        val subscription = subscriptionServiceContract.findCurrentSubscription(userIds, now).orElse(null);
        return evaluator.evaluate(device, subscription, subscriptionServiceContract::getPlanFeatures, now);
    }
}
