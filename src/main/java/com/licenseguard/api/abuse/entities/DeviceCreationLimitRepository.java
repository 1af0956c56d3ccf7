package com.licenseguard.api.abuse.entities;

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
 * A JPA {@link Repository} declaration for database interactions of {@link DeviceCreationLimit}
 * entity.
 */
@Repository
public interface DeviceCreationLimitRepository extends CrudRepository<DeviceCreationLimit, Long> {

    /**
     * Atomically increments the counter of an existing window. The updated row stays locked until
     * the surrounding transaction ends, which serialises concurrent creations for the same
     * identifier.
     *
     * @return the number of updated rows, i.e. {@code 0} if the window doesn't exist yet.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional(propagation = Propagation.MANDATORY)
    @Query("update DeviceCreationLimit e set e.deviceCount = e.deviceCount + 1 where " +
        "e.identifier = ?1 and e.identifierType = ?2 and e.windowStart = ?3")
    int increment(@NonNull String identifier, @NonNull IdentifierType identifierType, @NonNull OffsetDateTime windowStart);

    /**
     * Opens a window with its counter set to {@code 1}. It fails with a
     * {@link org.springframework.dao.DataIntegrityViolationException} if a concurrent transaction
     * opened the same window first.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional(propagation = Propagation.MANDATORY)
    @Query(value = "insert into device_creation_limits (identifier, identifier_type, window_start, device_count, created_at) " +
        "values (?1, ?2, ?3, 1, current_timestamp)", nativeQuery = true)
    void insertOpenWindow(@NonNull String identifier, @NonNull String identifierType, @NonNull OffsetDateTime windowStart);

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e.deviceCount from DeviceCreationLimit e where " +
        "e.identifier = ?1 and e.identifierType = ?2 and e.windowStart = ?3")
    Optional<Integer> findDeviceCount(@NonNull String identifier, @NonNull IdentifierType identifierType, @NonNull OffsetDateTime windowStart);

    /**
     * Removes windows that started before the given instant.
     *
     * @return the number of deleted windows.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("delete from DeviceCreationLimit e where e.windowStart < ?1")
    int deleteAllWindowsStartedBefore(@NonNull OffsetDateTime windowStartBefore);
}
