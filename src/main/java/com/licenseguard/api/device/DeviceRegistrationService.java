package com.licenseguard.api.device;

import com.licenseguard.api.contracts.LeaseTokenServiceContract;
import com.licenseguard.api.contracts.LicenseServiceContract;
import com.licenseguard.api.device.exceptions.RegistrationRejectedException;
import com.licenseguard.api.device.models.RegistrationResult;
import com.licenseguard.api.license.exceptions.DeviceNotFoundException;
import com.licenseguard.api.license.models.EntitlementSnapshot;
import com.licenseguard.api.platform.TransactionRetryExecutor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Registers devices to users and hands out their first lease.
 */
@Service
@Slf4j
public class DeviceRegistrationService {

    private final DeviceRegistrar registrar;
    private final TransactionRetryExecutor retryExecutor;
    private final LicenseServiceContract licenseServiceContract;
    private final LeaseTokenServiceContract leaseTokenServiceContract;

    @Autowired
    DeviceRegistrationService(
        @NonNull DeviceRegistrar registrar,
        @NonNull TransactionRetryExecutor retryExecutor,
        @NonNull LicenseServiceContract licenseServiceContract,
        @NonNull LeaseTokenServiceContract leaseTokenServiceContract
    ) {
        this.registrar = registrar;
        this.retryExecutor = retryExecutor;
        this.licenseServiceContract = licenseServiceContract;
        this.leaseTokenServiceContract = leaseTokenServiceContract;
    }

    /**
     * <p>
     * Links the device with the given fingerprint to the user with the given email, creating
     * either of them if needed, and starts the device's trial if it never had one.</p>
     *
     * <p>
     * Any number of concurrent calls with the same arguments converge to one user, one device,
     * one association and one trial, and all of them return the same trial timestamps.</p>
     *
     * @param email      email of the user.
     * @param deviceHash fingerprint of the device.
     * @param sourceIp   address the request came from, if known.
     * @return a non-null {@link RegistrationResult}.
     * @throws RegistrationRejectedException either a
     *                                       {@link com.licenseguard.api.device.exceptions.DeviceCreationRateLimitException}
     *                                       if too many devices were registered from the ip address
     *                                       or by the user recently, or a
     *                                       {@link com.licenseguard.api.device.exceptions.DeviceCapExceededException}
     *                                       if the user already reached their device cap.
     */
    @NonNull
    public RegistrationResult registerDeviceUser(
        @NonNull String email,
        @NonNull String deviceHash,
        String sourceIp
    ) throws RegistrationRejectedException {
        final DeviceRegistrar.Registration registration = retryExecutor.execute(() -> registrar.register(email, deviceHash, sourceIp));
        final EntitlementSnapshot entitlement;
        try {
            entitlement = licenseServiceContract.evaluateLicense(registration.getDeviceId());
        } catch (DeviceNotFoundException e) {
            throw new IllegalStateException("registered device disappeared", e);
        }

        val plan = entitlement.getPlan() == null ? null : entitlement.getPlan().name();
        val leaseToken = leaseTokenServiceContract.issueLeaseToken(
            registration.getDeviceId(), entitlement.getLicenseStatus(), entitlement.getExpiresAt(), plan);

        return RegistrationResult.builder()
            .userId(registration.getUserId())
            .deviceId(registration.getDeviceId())
            .trialStartedAt(registration.getTrialStartedAt())
            .trialExpiresAt(registration.getTrialEndedAt())
            .entitlement(entitlement)
            .leaseToken(leaseToken)
            .build();
    }
}
