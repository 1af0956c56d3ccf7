package com.licenseguard.api.device;

import com.licenseguard.api.contracts.DeviceServiceContract;
import com.licenseguard.api.device.entities.DeviceRepository;
import lombok.NonNull;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Device lookups for other packages.
 */
@Service
class DeviceService implements DeviceServiceContract {

    private final DeviceRepository deviceRepository;

    @Autowired
    DeviceService(@NonNull DeviceRepository deviceRepository) {
        this.deviceRepository = deviceRepository;
    }

    @NonNull
    @Override
    public Optional<String> findDeviceHash(long deviceId) {
        return deviceRepository.findDeviceHashById(deviceId);
    }
}
