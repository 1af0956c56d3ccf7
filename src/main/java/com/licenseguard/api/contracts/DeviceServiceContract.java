package com.licenseguard.api.contracts;

import lombok.NonNull;

import java.util.Optional;

/**
 * Defines a service contract for the device package to provide device lookups to the identity
 * package.
 */
public interface DeviceServiceContract {

    /**
     * @param deviceId internal id of a device.
     * @return a non-null {@link Optional}<{@link String}>, with the fingerprint of the device with
     * the given {@code deviceId} if it exists.
     */
    @NonNull
    Optional<String> findDeviceHash(long deviceId);
}
