package com.licenseguard.api.device;

import com.licenseguard.api.abuse.RiskEventRecorder;
import com.licenseguard.api.abuse.entities.RiskEventType;
import com.licenseguard.api.device.entities.Device;
import com.licenseguard.api.device.entities.DeviceRepository;
import com.licenseguard.api.device.exceptions.TrialIntegrityViolationException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;

/**
 * <p>
 * The trial state machine of a device: {@code NO_TRIAL -> TRIAL_CONSUMED}. A device consumes its
 * one trial at the instant the trial starts, and nothing ever reverts that.</p>
 *
 * <p>
 * The transition is a single conditional update, so no read-then-write race is possible. Under any
 * number of concurrent callers for the same device, exactly one update takes effect, and every
 * caller returns the same trial timestamps.</p>
 */
@Service
@Slf4j
class TrialService {

    private final DeviceRepository deviceRepository;
    private final RiskEventRecorder riskEventRecorder;

    @Autowired
    TrialService(@NonNull DeviceRepository deviceRepository, @NonNull RiskEventRecorder riskEventRecorder) {
        this.deviceRepository = deviceRepository;
        this.riskEventRecorder = riskEventRecorder;
    }

    /**
     * Starts the trial of the given device unless it already consumed one.
     *
     * @param device a device row read in the caller's transaction.
     * @return the device as stored after the call, carrying the trial timestamps of whichever
     * caller started the trial.
     * @throws TrialIntegrityViolationException if the stored trial breaks its invariants.
     */
    @NonNull
    @Transactional(propagation = Propagation.MANDATORY)
    public Device startTrialIfEligible(@NonNull Device device) {
        if (device.isTrialConsumed()) {
            return verified(device);
        }

        val startedAt = OffsetDateTime.now().truncatedTo(ChronoUnit.MICROS);
        val endedAt = startedAt.plus(Device.TRIAL_DURATION);
        val updated = deviceRepository.startTrialIfNotConsumed(device.getId(), startedAt, endedAt);
        if (updated == 1) {
            log.info("started trial of device {} until {}", device.getId(), endedAt);
        } else {
            log.debug("trial of device {} was started by a concurrent request", device.getId());
        }

        val stored = deviceRepository.findById(device.getId())
            .orElseThrow(() -> new IllegalStateException("device vanished within its transaction"));

        return verified(stored);
    }

    @NonNull
    private Device verified(@NonNull Device device) {
        if (!device.isTrialConsumed() || device.getTrialStartedAt() == null || device.getTrialEndedAt() == null) {
            throw violation(device, "trial state is incomplete");
        }

        val duration = Duration.between(device.getTrialStartedAt(), device.getTrialEndedAt());
        if (!Device.TRIAL_DURATION.equals(duration)) {
            throw violation(device, "trial duration is " + duration);
        }

        return device;
    }

    @NonNull
    private TrialIntegrityViolationException violation(@NonNull Device device, @NonNull String problem) {
        val metadata = new LinkedHashMap<String, Object>();
        metadata.put("reason", "TRIAL_INTEGRITY_VIOLATION");
        metadata.put("problem", problem);
        metadata.put("trialConsumed", device.isTrialConsumed());
        metadata.put("trialStartedAt", device.getTrialStartedAt() == null ? null : device.getTrialStartedAt().toString());
        metadata.put("trialEndedAt", device.getTrialEndedAt() == null ? null : device.getTrialEndedAt().toString());
        riskEventRecorder.record(RiskEventType.SUSPICIOUS_PATTERN, null, device.getId(), null, metadata);
        return new TrialIntegrityViolationException(String.format("device %d: %s", device.getId(), problem));
    }
}
