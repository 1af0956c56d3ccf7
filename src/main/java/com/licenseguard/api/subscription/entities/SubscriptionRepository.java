package com.licenseguard.api.subscription.entities;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link Subscription} entity.
 */
@Repository
public interface SubscriptionRepository extends CrudRepository<Subscription, Long> {

    /**
     * Find a {@link Subscription} entity by its Stripe assigned subscription id.
     *
     * @param stripeSubscriptionId it must be a non-null Stripe assigned subscription id.
     * @return an optional {@link Subscription} entity.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Subscription e where e.stripeSubscriptionId = ?1")
    Optional<Subscription> findByStripeSubscriptionId(@NonNull String stripeSubscriptionId);

    /**
     * Find a {@link Subscription} entity by its Stripe assigned customer id. A customer owns at most
     * one subscription row.
     *
     * @param stripeCustomerId it must be a non-null Stripe assigned customer id.
     * @return an optional {@link Subscription} entity.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Subscription e where e.stripeCustomerId = ?1")
    Optional<Subscription> findByStripeCustomerId(@NonNull String stripeCustomerId);

    /**
     * Retrieves all subscriptions owned by any of the given users, most recently created first.
     *
     * @param userIds a non-empty collection of user ids.
     * @return a guaranteed to be not {@literal null} {@link List} of {@link Subscription}s.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Subscription e where e.userId in ?1 order by e.createdAt desc, e.id desc")
    List<Subscription> findAllByUserIds(@NonNull Collection<Long> userIds);

    /**
     * @return Stripe ids of all subscriptions linked to a Stripe subscription.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e.stripeSubscriptionId from Subscription e where e.stripeSubscriptionId is not null order by e.id")
    List<String> findAllStripeSubscriptionIds();

    /**
     * Marks active subscriptions whose current billing period ended before {@code now} as expired.
     *
     * @return the number of expired subscriptions.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update Subscription e set e.status = com.licenseguard.api.subscription.models.SubscriptionStatus.EXPIRED, " +
        "e.updatedAt = ?1, e.version = e.version + 1 " +
        "where e.status = com.licenseguard.api.subscription.models.SubscriptionStatus.ACTIVE " +
        "and e.currentPeriodEnd is not null and e.currentPeriodEnd < ?1")
    int expireAllLapsedBefore(@NonNull OffsetDateTime now);
}
