package com.licenseguard.api.device.entities;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link Device} entity.
 */
@Repository
public interface DeviceRepository extends CrudRepository<Device, Long> {

    /**
     * @param deviceHash fingerprint of the device.
     * @return an optional {@link Device} with the given fingerprint.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Device e where e.deviceHash = ?1")
    Optional<Device> findByDeviceHash(@NonNull String deviceHash);

    /**
     * @return the fingerprint of the device with the given {@code id}, if it exists.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e.deviceHash from Device e where e.id = ?1")
    Optional<String> findDeviceHashById(long id);

    /**
     * Inserts a device row for a fingerprint seen for the first time. It fails with a
     * {@link org.springframework.dao.DataIntegrityViolationException} if a concurrent transaction
     * inserted the same fingerprint first.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional(propagation = Propagation.MANDATORY)
    @Query(value = "insert into devices (device_hash, first_seen_at, last_seen_at, trial_consumed) " +
        "values (?1, current_timestamp, current_timestamp, false)", nativeQuery = true)
    void insert(@NonNull String deviceHash);

    /**
     * Starts the trial of a device unless it ever had one. This conditional update is the only
     * write path of the trial columns. Concurrent callers for the same device are serialised by
     * the row lock, and all but the first one update no rows.
     *
     * @return the number of updated rows, i.e. {@code 1} for the caller that started the trial
     * and {@code 0} otherwise.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional(propagation = Propagation.MANDATORY)
    @Query("update Device e set e.trialStartedAt = ?2, e.trialEndedAt = ?3, e.trialConsumed = true " +
        "where e.id = ?1 and e.trialConsumed = false and e.trialStartedAt is null")
    int startTrialIfNotConsumed(long id, @NonNull OffsetDateTime trialStartedAt, @NonNull OffsetDateTime trialEndedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update Device e set e.lastSeenAt = ?2 where e.id = ?1")
    int touchLastSeen(long id, @NonNull OffsetDateTime lastSeenAt);
}
