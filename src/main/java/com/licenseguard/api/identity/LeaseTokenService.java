package com.licenseguard.api.identity;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.github.benmanes.caffeine.cache.Cache;
import com.licenseguard.api.contracts.DeviceServiceContract;
import com.licenseguard.api.contracts.LeaseTokenServiceContract;
import com.licenseguard.api.identity.exceptions.LeaseTokenVerificationException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Issues and verifies the lease tokens that clients present on authenticated routes. A lease is
 * bound to one device. It carries a snapshot of the device's entitlement so that clients can
 * enforce features while offline, until the lease expires.
 */
@Service
@Slf4j
class LeaseTokenService implements LeaseTokenServiceContract {

    static final String DEVICE_ID_CLAIM = "device_id";
    static final String LICENSE_STATUS_CLAIM = "license_status";
    static final String EXPIRES_AT_CLAIM = "expires_at";
    static final String PLAN_CLAIM = "plan";

    private final AuthConfiguration authConfig;
    private final DeviceServiceContract deviceServiceContract;
    private final Cache<Long, String> deviceHashCache;
    private final Algorithm jwtAlgorithm;
    private final JWTVerifier jwtVerifier;

    @Autowired
    LeaseTokenService(
        @NonNull AuthConfiguration authConfig,
        @NonNull DeviceServiceContract deviceServiceContract,
        @NonNull @Qualifier(AuthBeans.DEVICE_HASH_CACHE) Cache<Long, String> deviceHashCache
    ) {
        this.authConfig = authConfig;
        this.deviceServiceContract = deviceServiceContract;
        this.deviceHashCache = deviceHashCache;
        this.jwtAlgorithm = Algorithm.HMAC256(authConfig.getHmacSecret());
        this.jwtVerifier = JWT.require(this.jwtAlgorithm)
            .withClaimPresence(DEVICE_ID_CLAIM)
            .withClaimPresence(LICENSE_STATUS_CLAIM)
            .build();
    }

    @NonNull
    @Override
    public String issueLeaseToken(long deviceId, @NonNull String licenseStatus, OffsetDateTime expiresAt, String plan) {
        val now = Instant.now();
        return JWT.create()
            .withSubject(String.valueOf(deviceId))
            .withClaim(DEVICE_ID_CLAIM, deviceId)
            .withClaim(LICENSE_STATUS_CLAIM, licenseStatus)
            .withClaim(EXPIRES_AT_CLAIM, expiresAt == null ? null : expiresAt.toInstant().toString())
            .withClaim(PLAN_CLAIM, plan)
            .withIssuedAt(now)
            .withExpiresAt(now.plus(authConfig.getLeaseTokenExpiry()))
            .sign(jwtAlgorithm);
    }

    /**
     * Verifies the signature and expiry of a lease token, and checks that it was issued to the
     * device presenting it.
     *
     * @param token      a lease token.
     * @param deviceHash fingerprint of the device presenting the token.
     * @return a non-null {@link LeaseAuthentication} whose principal is the device id.
     * @throws LeaseTokenVerificationException if the token is invalid or was issued for another
     *                                         device.
     */
    @NonNull
    LeaseAuthentication verifyLeaseToken(@NonNull String token, @NonNull String deviceHash) throws LeaseTokenVerificationException {
        final long deviceId;
        try {
            deviceId = Objects.requireNonNull(jwtVerifier.verify(token).getClaim(DEVICE_ID_CLAIM).asLong());
        } catch (JWTVerificationException | NullPointerException e) {
            throw new LeaseTokenVerificationException("failed to verify lease token", e);
        }

        final String expectedHash = deviceHashCache.get(deviceId, id -> deviceServiceContract.findDeviceHash(id).orElse(null));
        if (expectedHash == null || !expectedHash.equals(deviceHash)) {
            throw new LeaseTokenVerificationException("lease token was issued to a different device");
        }

        return new LeaseAuthentication(token, deviceId);
    }

    /**
     * Same as {@link #verifyLeaseToken(String, String)} but returns {@literal null} instead of
     * throwing if the token is not valid.
     */
    Authentication verifyLeaseTokenOrNull(@NonNull String token, @NonNull String deviceHash) {
        try {
            return verifyLeaseToken(token, deviceHash);
        } catch (LeaseTokenVerificationException e) {
            log.trace("lease token verification failed", e);
            return null;
        }
    }

    /**
     * An authenticated lease. Its principal is the internal id of the leased device.
     */
    static class LeaseAuthentication extends AbstractAuthenticationToken {

        private final String token;
        private final long deviceId;

        private LeaseAuthentication(@NonNull String token, long deviceId) {
            super(List.of());
            this.token = token;
            this.deviceId = deviceId;
            setAuthenticated(true);
        }

        @Override
        public Object getCredentials() {
            return token;
        }

        @Override
        public Object getPrincipal() {
            return deviceId;
        }
    }
}
