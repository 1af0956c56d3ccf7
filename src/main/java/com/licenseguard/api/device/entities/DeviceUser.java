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

import java.time.OffsetDateTime;

/**
 * A data access object that maps to the {@code device_users} table in the database. Rows are never
 * updated. The database holds at most one row per (user, device) pair.
 */
@Entity
@Table(name = "device_users")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceUser {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private long id;

    @NonNull
    @Column(updatable = false)
    @Builder.Default
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(updatable = false)
    private long userId;

    @Column(updatable = false)
    private long deviceId;
}
