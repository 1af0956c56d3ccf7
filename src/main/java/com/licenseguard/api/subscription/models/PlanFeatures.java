package com.licenseguard.api.subscription.models;

import lombok.Builder;
import lombok.Value;

/**
 * Feature bundle that a plan grants.
 */
@Value
@Builder
public class PlanFeatures {

    /**
     * Features of an expired license.
     */
    public static final PlanFeatures NONE = PlanFeatures.builder().build();

    int maxCameras;

    boolean pdfExport;

    int fpsLimit;

    boolean cloudBackup;
}
