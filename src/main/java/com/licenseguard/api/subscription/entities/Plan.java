package com.licenseguard.api.subscription.entities;

import com.licenseguard.api.subscription.models.PlanFeatures;
import com.licenseguard.api.subscription.models.PlanTier;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

/**
 * A data access object that maps to the {@code plans} table in the database. Plans are reference
 * data seeded by the schema migrations and never written by the application.
 */
@Entity
@Table(name = "plans")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Plan {

    @Id
    private short id;

    @NonNull
    @Enumerated(EnumType.STRING)
    @Column(updatable = false)
    private PlanTier name;

    private int maxCameras;

    private boolean pdfExport;

    private int fpsLimit;

    private boolean cloudBackup;

    @NonNull
    public PlanFeatures getFeatures() {
        return PlanFeatures.builder()
            .maxCameras(maxCameras)
            .pdfExport(pdfExport)
            .fpsLimit(fpsLimit)
            .cloudBackup(cloudBackup)
            .build();
    }
}
