package com.licenseguard.api.subscription.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.OffsetDateTime;

/**
 * A data access object that maps to the {@code webhook_events} table in the database. A row's
 * existence marks an external event as applied.
 */
@Entity
@Table(name = "webhook_events")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookEvent {

    @Id
    @NonNull
    private String stripeEventId;

    @NonNull
    @Column(updatable = false)
    private String eventType;

    @NonNull
    @Column(updatable = false)
    private OffsetDateTime processedAt;
}
