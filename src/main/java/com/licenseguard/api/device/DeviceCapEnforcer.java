package com.licenseguard.api.device;

import com.licenseguard.api.abuse.AbuseConfiguration;
import com.licenseguard.api.abuse.RiskEventRecorder;
import com.licenseguard.api.abuse.entities.RiskEventType;
import com.licenseguard.api.device.entities.DeviceUserRepository;
import com.licenseguard.api.device.exceptions.DeviceCapExceededException;
import com.licenseguard.api.identity.entities.User;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;

import static java.util.Objects.requireNonNullElse;

/**
 * Refuses to link a new device to a user that already reached their device cap, unless the cap is
 * configured in detection mode.
 */
@Component
@Slf4j
class DeviceCapEnforcer {

    private final AbuseConfiguration abuseConfig;
    private final DeviceUserRepository deviceUserRepository;
    private final RiskEventRecorder riskEventRecorder;

    @Autowired
    DeviceCapEnforcer(
        @NonNull AbuseConfiguration abuseConfig,
        @NonNull DeviceUserRepository deviceUserRepository,
        @NonNull RiskEventRecorder riskEventRecorder
    ) {
        this.abuseConfig = abuseConfig;
        this.deviceUserRepository = deviceUserRepository;
        this.riskEventRecorder = riskEventRecorder;
    }

    /**
     * Checks whether the given user may link one more device. It must only be called for new
     * (user, device) pairs.
     *
     * @param user      the user about to link a device.
     * @param deviceId  id of the device about to be linked.
     * @param ipAddress source address of the registration, if known.
     * @throws DeviceCapExceededException if the user is at or above their cap, and the cap is
     *                                    enforced in blocking mode.
     */
    void checkNewAssociation(@NonNull User user, long deviceId, String ipAddress) throws DeviceCapExceededException {
        val max = requireNonNullElse(user.getMaxDevices(), abuseConfig.getDefaultMaxDevicesPerUser());
        val current = deviceUserRepository.countByUserId(user.getId());
        if (current < max) {
            return;
        }

        val mode = abuseConfig.getDeviceCapMode();
        val metadata = new LinkedHashMap<String, Object>();
        metadata.put("current", current);
        metadata.put("max", max);
        metadata.put("mode", mode.name());
        riskEventRecorder.record(RiskEventType.DEVICE_CAP_EXCEEDED, user.getId(), deviceId, ipAddress, metadata);
        if (mode.isBlocking()) {
            throw new DeviceCapExceededException(current, max);
        }

        log.info("device cap of user {} exceeded in detection mode: current={} max={}", user.getId(), current, max);
    }
}
