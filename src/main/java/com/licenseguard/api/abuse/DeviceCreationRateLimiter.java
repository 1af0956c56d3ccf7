package com.licenseguard.api.abuse;

import com.licenseguard.api.abuse.entities.DeviceCreationLimitRepository;
import com.licenseguard.api.abuse.entities.IdentifierType;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Counts device creations per identifier (ip address or user) in fixed windows aligned to the Unix
 * epoch, e.g. 24 hour buckets starting at midnight UTC.
 */
@Service
@Slf4j
public class DeviceCreationRateLimiter {

    private final AbuseConfiguration abuseConfig;
    private final DeviceCreationLimitRepository limitRepository;

    @Autowired
    DeviceCreationRateLimiter(
        @NonNull AbuseConfiguration abuseConfig,
        @NonNull DeviceCreationLimitRepository limitRepository
    ) {
        this.abuseConfig = abuseConfig;
        this.limitRepository = limitRepository;
    }

    /**
     * <p>
     * Counts one device creation for the given identifier in the current window and reports
     * whether the window's threshold is now exceeded.</p>
     *
     * <p>
     * The increment is a single conditional update, so concurrent callers never lose an update.
     * If the window doesn't exist yet, it is inserted. Two callers that open the same window
     * concurrently collide on the window's unique constraint, and the loser fails with a
     * {@link org.springframework.dao.DataIntegrityViolationException} that the caller's retry
     * resolves.</p>
     *
     * <p>
     * It must run inside the transaction of the creation it counts, so that a rolled back creation
     * isn't counted.</p>
     *
     * @param identifier     an ip address or a user id.
     * @param identifierType kind of the {@code identifier}.
     * @return a non-null {@link RateLimitDecision}.
     */
    @NonNull
    @Transactional(propagation = Propagation.MANDATORY)
    public RateLimitDecision checkAndIncrement(@NonNull String identifier, @NonNull IdentifierType identifierType) {
        val now = Instant.now();
        val windowStart = windowStartOf(now, abuseConfig.getRateLimitWindow());
        if (limitRepository.increment(identifier, identifierType, windowStart) == 0) {
            limitRepository.insertOpenWindow(identifier, identifierType.name(), windowStart);
        }

        val current = limitRepository.findDeviceCount(identifier, identifierType, windowStart)
            .orElseThrow(() -> new IllegalStateException("rate limit window vanished within its transaction"));

        val decision = RateLimitDecision.builder()
            .identifierType(identifierType)
            .current(current)
            .max(maxFor(identifierType))
            .windowStart(windowStart)
            .retryAfter(Duration.between(now, windowStart.toInstant().plus(abuseConfig.getRateLimitWindow())))
            .build();

        log.trace("device creation counted: identifier={} type={} count={}", identifier, identifierType, current);
        return decision;
    }

    private int maxFor(@NonNull IdentifierType identifierType) {
        switch (identifierType) {
            case IP:
                return abuseConfig.getMaxDevicesPerIpPerWindow();
            case USER:
                return abuseConfig.getMaxDevicesPerUserPerWindow();
            default:
                throw new IllegalArgumentException("unsupported identifier type: " + identifierType);
        }
    }

    /**
     * @return start of the epoch-aligned window of the given {@code length} that contains
     * {@code instant}.
     */
    @NonNull
    static OffsetDateTime windowStartOf(@NonNull Instant instant, @NonNull Duration length) {
        val lengthSeconds = length.getSeconds();
        val startSeconds = Math.floorDiv(instant.getEpochSecond(), lengthSeconds) * lengthSeconds;
        return OffsetDateTime.ofInstant(Instant.ofEpochSecond(startSeconds), ZoneOffset.UTC);
    }
}
