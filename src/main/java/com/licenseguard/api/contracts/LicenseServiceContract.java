package com.licenseguard.api.contracts;

import com.licenseguard.api.license.exceptions.DeviceNotFoundException;
import com.licenseguard.api.license.models.EntitlementSnapshot;
import lombok.NonNull;

/**
 * Defines a service contract for the license package to evaluate entitlements for the device
 * package.
 */
public interface LicenseServiceContract {

    /**
     * Evaluates the current entitlement of a device. It doesn't modify any state.
     *
     * @param deviceId internal id of the device.
     * @return a non-null {@link EntitlementSnapshot}.
     * @throws DeviceNotFoundException if no device exists with the given {@code deviceId}.
     */
    @NonNull
    EntitlementSnapshot evaluateLicense(long deviceId) throws DeviceNotFoundException;
}
