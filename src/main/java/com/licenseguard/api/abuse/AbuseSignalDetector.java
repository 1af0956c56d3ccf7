package com.licenseguard.api.abuse;

import com.licenseguard.api.abuse.entities.RiskEventRepository;
import com.licenseguard.api.abuse.entities.RiskEventType;
import lombok.NonNull;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns abuse signals observed during device registration into risk events. It only records,
 * deciding whether to reject is up to the caller's {@link EnforcementMode}.
 */
@Component
public class AbuseSignalDetector {

    private final AbuseConfiguration abuseConfig;
    private final RiskEventRecorder riskEventRecorder;
    private final RiskEventRepository riskEventRepository;

    @Autowired
    AbuseSignalDetector(
        @NonNull AbuseConfiguration abuseConfig,
        @NonNull RiskEventRecorder riskEventRecorder,
        @NonNull RiskEventRepository riskEventRepository
    ) {
        this.abuseConfig = abuseConfig;
        this.riskEventRecorder = riskEventRecorder;
        this.riskEventRepository = riskEventRepository;
    }

    /**
     * Records a {@link RiskEventType#DEVICE_CREATION_RATE_LIMIT} event for a breached window.
     */
    public void rateLimitBreached(@NonNull RateLimitDecision decision, long userId, String ipAddress) {
        val metadata = new LinkedHashMap<String, Object>();
        metadata.put("identifierType", decision.getIdentifierType().name().toLowerCase());
        metadata.put("current", decision.getCurrent());
        metadata.put("max", decision.getMax());
        metadata.put("windowStart", decision.getWindowStart().toString());
        metadata.put("mode", abuseConfig.getRateLimitMode().name());
        riskEventRecorder.record(RiskEventType.DEVICE_CREATION_RATE_LIMIT, userId, null, ipAddress, metadata);
    }

    /**
     * Records a {@link RiskEventType#RAPID_DEVICE_CREATION} event, at most once per window, when an
     * ip address reaches the rapid creation threshold.
     */
    public void ipCreationCounted(@NonNull RateLimitDecision decision, long userId, @NonNull String ipAddress) {
        if (decision.getCurrent() < abuseConfig.getRapidCreationThreshold()) {
            return;
        }

        val type = RiskEventType.RAPID_DEVICE_CREATION;
        if (riskEventRepository.existsByTypeAndIpAddressSince(type, ipAddress, decision.getWindowStart())) {
            return;
        }

        riskEventRecorder.record(type, userId, null, ipAddress, Map.of(
            "deviceCount", decision.getCurrent(),
            "threshold", abuseConfig.getRapidCreationThreshold(),
            "windowStart", decision.getWindowStart().toString()));
    }

    /**
     * Records a {@link RiskEventType#DEVICE_CHURN_DETECTED} event when a user linked too many
     * devices within the churn window. Churn never blocks a registration.
     *
     * @param recentAssociations number of devices linked to the user within the churn window,
     *                           including the one just linked.
     */
    public void deviceLinked(long userId, long deviceId, String ipAddress, long recentAssociations) {
        if (recentAssociations < abuseConfig.getChurnThreshold()) {
            return;
        }

        riskEventRecorder.record(RiskEventType.DEVICE_CHURN_DETECTED, userId, deviceId, ipAddress, Map.of(
            "deviceCount", recentAssociations,
            "timeWindow", abuseConfig.getChurnWindow().getSeconds()));
    }
}
