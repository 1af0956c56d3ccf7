package com.licenseguard.api.abuse;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Collection of scheduled tasks for {@link AbuseMaintenanceService}.
 */
@Component
@Slf4j
class AbuseScheduledTasks {

    private final AbuseMaintenanceService maintenanceService;

    @Autowired
    AbuseScheduledTasks(@NonNull AbuseMaintenanceService maintenanceService) {
        this.maintenanceService = maintenanceService;
    }

    @Scheduled(cron = "${app.abuse.cleanup-schedule}")
    void cleanup() {
        log.info("performing abuse data cleanup");
        maintenanceService.performCleanup();
    }
}
