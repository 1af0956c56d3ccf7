package com.licenseguard.api.device.entities;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link DeviceUser} entity.
 */
@Repository
public interface DeviceUserRepository extends CrudRepository<DeviceUser, Long> {

    @Transactional(readOnly = true)
    boolean existsByUserIdAndDeviceId(long userId, long deviceId);

    /**
     * @return the number of distinct devices linked to the given user.
     */
    @Transactional(readOnly = true)
    @Query("select count(e) from DeviceUser e where e.userId = ?1")
    long countByUserId(long userId);

    /**
     * @return the number of devices linked to the given user since {@code since}.
     */
    @Transactional(readOnly = true)
    @Query("select count(e) from DeviceUser e where e.userId = ?1 and e.createdAt >= ?2")
    long countByUserIdCreatedSince(long userId, @NonNull OffsetDateTime since);

    /**
     * @return ids of all users that registered the given device.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e.userId from DeviceUser e where e.deviceId = ?1 order by e.createdAt")
    List<Long> findUserIdsByDeviceId(long deviceId);

    /**
     * Links a device to a user. It fails with a
     * {@link org.springframework.dao.DataIntegrityViolationException} if a concurrent transaction
     * linked the same pair first.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional(propagation = Propagation.MANDATORY)
    @Query(value = "insert into device_users (user_id, device_id, created_at) values (?1, ?2, current_timestamp)", nativeQuery = true)
    void insert(long userId, long deviceId);
}
