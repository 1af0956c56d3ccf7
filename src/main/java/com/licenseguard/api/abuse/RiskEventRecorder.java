package com.licenseguard.api.abuse;

import com.licenseguard.api.abuse.entities.RiskEvent;
import com.licenseguard.api.abuse.entities.RiskEventRepository;
import com.licenseguard.api.abuse.entities.RiskEventType;
import com.licenseguard.api.platform.TransactionRetryExecutor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <p>
 * Appends abuse-relevant events to the risk event log. Recording never blocks the operation that
 * triggered it.</p>
 *
 * <p>
 * Inside a unit of work of {@link TransactionRetryExecutor}, an event is written once the unit
 * settles. It is kept if the unit is rejected and rolls back, and it is dropped if the unit is
 * re-run after losing a race, so that the re-run records it again only if it still applies.
 * Elsewhere, the event is written immediately in a transaction of its own.</p>
 */
@Service
@Slf4j
public class RiskEventRecorder {

    private final RiskEventRepository riskEventRepository;
    private final TransactionRetryExecutor retryExecutor;
    private final TransactionTemplate requiresNewTemplate;

    @Autowired
    RiskEventRecorder(
        @NonNull RiskEventRepository riskEventRepository,
        @NonNull TransactionRetryExecutor retryExecutor,
        @NonNull PlatformTransactionManager transactionManager
    ) {
        this.riskEventRepository = riskEventRepository;
        this.retryExecutor = retryExecutor;
        this.requiresNewTemplate = new TransactionTemplate(transactionManager);
        this.requiresNewTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Records a risk event.
     *
     * @param type      type of the event.
     * @param userId    id of the related user, if any.
     * @param deviceId  id of the related device, if any.
     * @param ipAddress source address of the triggering request, if known.
     * @param metadata  structured details of the event. Values must be JSON-serialisable scalars.
     */
    public void record(
        @NonNull RiskEventType type,
        Long userId,
        Long deviceId,
        String ipAddress,
        @NonNull Map<String, Object> metadata
    ) {
        val event = RiskEvent.builder()
            .eventType(type)
            .userId(userId)
            .deviceId(deviceId)
            .ipAddress(ipAddress)
            .metadata(new LinkedHashMap<>(metadata))
            .build();

        if (!retryExecutor.deferUntilSettled(() -> persist(event))) {
            persist(event);
        }
    }

    private void persist(@NonNull RiskEvent event) {
        log.warn("risk event: type={} user={} device={} ip={} metadata={}",
            event.getEventType(), event.getUserId(), event.getDeviceId(), event.getIpAddress(), event.getMetadata());

        requiresNewTemplate.executeWithoutResult(status -> riskEventRepository.save(event));
    }
}
