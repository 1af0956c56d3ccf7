package com.licenseguard.api.abuse.entities;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link RiskEvent} entity.
 */
@Repository
public interface RiskEventRepository extends CrudRepository<RiskEvent, Long> {

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from RiskEvent e where e.eventType = ?1 order by e.createdAt asc, e.id asc")
    List<RiskEvent> findAllByEventType(@NonNull RiskEventType eventType);

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from RiskEvent e where e.userId = ?1 order by e.createdAt asc, e.id asc")
    List<RiskEvent> findAllByUserId(long userId);

    /**
     * Checks whether an event of the given type was recorded for the given ip address after the
     * given instant.
     */
    @Transactional(readOnly = true)
    @Query("select case when count(e) > 0 then true else false end from RiskEvent e where " +
        "e.eventType = ?1 and e.ipAddress = ?2 and e.createdAt >= ?3")
    boolean existsByTypeAndIpAddressSince(@NonNull RiskEventType eventType, @NonNull String ipAddress, @NonNull OffsetDateTime since);

    /**
     * Prunes events that are older than the retention period.
     *
     * @return the number of deleted events.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("delete from RiskEvent e where e.createdAt < ?1")
    int deleteAllCreatedBefore(@NonNull OffsetDateTime createdBefore);
}
