package com.licenseguard.api.abuse;

import com.licenseguard.api.abuse.entities.DeviceCreationLimitRepository;
import com.licenseguard.api.abuse.entities.RiskEventRepository;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;

/**
 * Applies the retention policy to rate limit windows and risk events.
 */
@Service
@Slf4j
class AbuseMaintenanceService {

    private final AbuseConfiguration abuseConfig;
    private final DeviceCreationLimitRepository limitRepository;
    private final RiskEventRepository riskEventRepository;

    @Autowired
    AbuseMaintenanceService(
        @NonNull AbuseConfiguration abuseConfig,
        @NonNull DeviceCreationLimitRepository limitRepository,
        @NonNull RiskEventRepository riskEventRepository
    ) {
        this.abuseConfig = abuseConfig;
        this.limitRepository = limitRepository;
        this.riskEventRepository = riskEventRepository;
    }

    /**
     * Deletes rate limit windows and risk events that are older than their retention periods.
     */
    @Transactional(rollbackFor = Throwable.class)
    public void performCleanup() {
        val now = OffsetDateTime.now();
        val windows = limitRepository.deleteAllWindowsStartedBefore(now.minus(abuseConfig.getRateLimitWindowRetention()));
        val events = riskEventRepository.deleteAllCreatedBefore(now.minus(abuseConfig.getRiskEventRetention()));
        log.info("removed {} rate limit windows and {} risk events", windows, events);
    }
}
