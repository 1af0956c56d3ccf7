package com.licenseguard.api.identity.entities;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link User} entity.
 */
@Repository
public interface UserRepository extends CrudRepository<User, Long> {

    /**
     * @param email a normalised email address.
     * @return an optional {@link User} with the given {@code email}.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from User e where e.email = ?1")
    Optional<User> findByEmail(@NonNull String email);

    /**
     * Inserts a user row with the given {@code email}. It fails with a
     * {@link org.springframework.dao.DataIntegrityViolationException} if a concurrent transaction
     * inserted the same email first.
     *
     * @param email a normalised email address.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query(value = "insert into users (email, created_at) values (?1, current_timestamp)", nativeQuery = true)
    void insert(@NonNull String email);

    /**
     * Sets or clears the device cap override of a user.
     *
     * @param id         id of the user.
     * @param maxDevices the new override, or {@literal null} to fall back to the system default.
     * @return the number of updated rows.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update User e set e.maxDevices = ?2 where e.id = ?1")
    int updateMaxDevices(long id, Integer maxDevices);
}
