package com.licenseguard.api.abuse.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A data access object that maps to the append-only {@code risk_events} table in the database.
 * User and device references are plain ids, since events outlive the transactions (and rows) that
 * triggered them.
 */
@Entity
@Table(name = "risk_events")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private long id;

    @NonNull
    @Column(updatable = false)
    @Builder.Default
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(updatable = false)
    private Long userId;

    @Column(updatable = false)
    private Long deviceId;

    @Column(updatable = false)
    private String ipAddress;

    @NonNull
    @Enumerated(EnumType.STRING)
    @Column(updatable = false)
    private RiskEventType eventType;

    @NonNull
    @Convert(converter = RiskMetadataConverter.class)
    @Column(updatable = false)
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
