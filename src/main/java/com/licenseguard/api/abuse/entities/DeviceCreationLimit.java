package com.licenseguard.api.abuse.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.OffsetDateTime;

/**
 * A data access object that maps to the {@code device_creation_limits} table in the database. The
 * table holds at most one row per (identifier, identifier type, window start), which the database
 * enforces with a unique constraint.
 */
@Entity
@Table(name = "device_creation_limits")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceCreationLimit {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private long id;

    @NonNull
    @Column(updatable = false)
    @Builder.Default
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @NonNull
    @Column(updatable = false)
    private String identifier;

    @NonNull
    @Enumerated(EnumType.STRING)
    @Column(updatable = false)
    private IdentifierType identifierType;

    @NonNull
    @Column(updatable = false)
    private OffsetDateTime windowStart;

    private int deviceCount;
}
