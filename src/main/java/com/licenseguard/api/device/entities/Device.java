package com.licenseguard.api.device.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * <p>
 * A data access object that maps to the {@code devices} table in the database.</p>
 *
 * <p>
 * Trial columns are written only by {@link DeviceRepository#startTrialIfNotConsumed}. They are
 * declared read-only here so that saving a detached copy of the entity can never reset them.</p>
 */
@Entity
@Table(name = "devices")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Device {

    /**
     * Exact length of the one trial a device may ever have.
     */
    public static final Duration TRIAL_DURATION = Duration.ofDays(14);

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private long id;

    @NonNull
    @Column(updatable = false)
    private String deviceHash;

    @NonNull
    @Column(updatable = false)
    @Builder.Default
    private OffsetDateTime firstSeenAt = OffsetDateTime.now();

    private OffsetDateTime lastSeenAt;

    @Column(insertable = false, updatable = false)
    private OffsetDateTime trialStartedAt;

    @Column(insertable = false, updatable = false)
    private OffsetDateTime trialEndedAt;

    @Column(insertable = false, updatable = false)
    private boolean trialConsumed;

    /**
     * @return whether the device's trial is running at {@code now}.
     */
    public boolean isTrialActiveAt(@NonNull OffsetDateTime now) {
        return trialStartedAt != null && trialEndedAt != null
            && !now.isBefore(trialStartedAt) && !now.isAfter(trialEndedAt);
    }
}
