package com.licenseguard.api.device.payload;

import com.licenseguard.api.device.models.RegistrationResult;
import com.licenseguard.api.subscription.models.PlanFeatures;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.OffsetDateTime;

/**
 * A data transfer object to send the result of a device registration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "Registration")
public class RegistrationResponse {

    @Schema(required = true, allowableValues = {"active", "trial", "expired"}, description = "license status of the device")
    @NonNull
    private String licenseStatus;

    @Schema(required = true, description = "detailed outcome of the license evaluation")
    @NonNull
    private String outcome;

    @Schema(description = "when the trial of the device started")
    private OffsetDateTime trialStartedAt;

    @Schema(description = "when the trial of the device ends (or ended)")
    private OffsetDateTime trialExpiresAt;

    @Schema(description = "whole days left until the current entitlement ends")
    private Long daysLeft;

    @Schema(required = true, description = "features the device may use")
    @NonNull
    private PlanFeatures features;

    @Schema(required = true, description = "lease token to present on authenticated routes")
    @NonNull
    private String leaseToken;

    @NonNull
    public static RegistrationResponse from(@NonNull RegistrationResult result) {
        return RegistrationResponse.builder()
            .licenseStatus(result.getEntitlement().getLicenseStatus())
            .outcome(result.getEntitlement().getOutcome().name())
            .trialStartedAt(result.getTrialStartedAt())
            .trialExpiresAt(result.getTrialExpiresAt())
            .daysLeft(result.getEntitlement().getDaysLeft())
            .features(result.getEntitlement().getFeatures())
            .leaseToken(result.getLeaseToken())
            .build();
    }
}
