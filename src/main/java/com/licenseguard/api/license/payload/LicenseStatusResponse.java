package com.licenseguard.api.license.payload;

import com.licenseguard.api.license.models.EntitlementSnapshot;
import com.licenseguard.api.subscription.models.PlanFeatures;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.OffsetDateTime;

/**
 * A data transfer object to send the license status of a device along with a refreshed lease.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "LicenseStatus")
public class LicenseStatusResponse {

    @Schema(required = true, allowableValues = {"active", "trial", "expired"}, description = "license status of the device")
    @NonNull
    private String status;

    @Schema(required = true, description = "detailed outcome of the license evaluation")
    @NonNull
    private String outcome;

    @Schema(description = "plan that the features derive from (absent if the license is expired)")
    private String plan;

    @Schema(required = true, description = "features the device may use")
    @NonNull
    private PlanFeatures features;

    @Schema(description = "when the current entitlement ends")
    private OffsetDateTime expiresAt;

    @Schema(description = "whole days left until the entitlement ends")
    private Long daysLeft;

    @Schema(required = true, description = "a new lease token to replace the presented one")
    @NonNull
    private String leaseToken;

    @NonNull
    public static LicenseStatusResponse from(@NonNull EntitlementSnapshot entitlement, @NonNull String leaseToken) {
        return LicenseStatusResponse.builder()
            .status(entitlement.getLicenseStatus())
            .outcome(entitlement.getOutcome().name())
            .plan(entitlement.getPlan() == null ? null : entitlement.getPlan().name())
            .features(entitlement.getFeatures())
            .expiresAt(entitlement.getExpiresAt())
            .daysLeft(entitlement.getDaysLeft())
            .leaseToken(leaseToken)
            .build();
    }
}
