package com.licenseguard.api.subscription.entities;

import com.licenseguard.api.subscription.models.SubscriptionState;
import com.licenseguard.api.subscription.models.SubscriptionStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.OffsetDateTime;

/**
 * A data access object that maps to the {@code subscriptions} table in the database. Only the
 * subscription reconciler mutates it, in response to idempotency-checked billing events.
 */
@Entity
@Table(name = "subscriptions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Subscription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private long id;

    @NonNull
    @Column(updatable = false)
    @Builder.Default
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @NonNull
    @Builder.Default
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    @Version
    private long version;

    private long userId;

    @ManyToOne
    private Plan plan;

    private String stripeCustomerId;

    private String stripeSubscriptionId;

    @NonNull
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private SubscriptionStatus status = SubscriptionStatus.TRIAL;

    private OffsetDateTime currentPeriodStart, currentPeriodEnd;

    private boolean cancelAtPeriodEnd;

    private OffsetDateTime canceledAt;

    private OffsetDateTime trialEnd;

    @PreUpdate
    void touch() {
        this.updatedAt = OffsetDateTime.now();
    }

    @NonNull
    public SubscriptionState toState() {
        return SubscriptionState.builder()
            .id(id)
            .status(status)
            .currentPeriodEnd(currentPeriodEnd)
            .plan(plan == null ? null : plan.getName())
            .build();
    }
}
