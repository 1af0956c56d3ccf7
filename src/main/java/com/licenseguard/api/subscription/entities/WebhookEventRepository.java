package com.licenseguard.api.subscription.entities;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link WebhookEvent} entity.
 */
@Repository
public interface WebhookEventRepository extends CrudRepository<WebhookEvent, String> {

    /**
     * Inserts a ledger row. Unlike {@link #save(Object)}, which merges an existing row, it fails
     * with a {@link org.springframework.dao.DataIntegrityViolationException} if the event id is
     * already recorded, including by a concurrent transaction that hasn't committed yet.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional(propagation = Propagation.MANDATORY)
    @Query(value = "insert into webhook_events (stripe_event_id, event_type, processed_at) values (?1, ?2, current_timestamp)", nativeQuery = true)
    void insert(@NonNull String stripeEventId, @NonNull String eventType);
}
