package com.licenseguard.api.identity.entities;

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
import java.util.Locale;

/**
 * A data access object that maps to the {@code users} table in the database.
 */
@Entity
@Table(name = "users")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private long id;

    @NonNull
    @Column(updatable = false)
    @Builder.Default
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @NonNull
    @Column(updatable = false)
    private String email;

    /**
     * Per-user override for the maximum number of devices. {@literal null} means that the system
     * default applies.
     */
    private Integer maxDevices;

    /**
     * Normalises an email address to the form in which it is stored.
     */
    @NonNull
    public static String normaliseEmail(@NonNull String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
