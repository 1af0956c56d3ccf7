package com.licenseguard.api.license;

import com.licenseguard.api.license.exceptions.DeviceNotFoundException;
import com.licenseguard.api.license.payload.LicenseStatusResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for license related '{@code /v1/license}' routes.
 */
@Validated
@RestController
@RequestMapping("/v1/license")
@Slf4j
@Tag(name = "license")
class LicenseController {

    private final LicenseService licenseService;

    @Autowired
    LicenseController(@NonNull LicenseService licenseService) {
        this.licenseService = licenseService;
    }

    /**
     * <p>
     * Evaluates the license of the device holding the presented lease, and returns it along with a
     * refreshed lease. The request must carry the lease as a bearer token and the device
     * fingerprint in the {@code X-Device-Id} header.</p>
     *
     * @return <ul>
     * <li>{@code HTTP 200} with the license status and a new lease.</li>
     * <li>{@code HTTP 401} if the lease is missing, invalid, expired, or issued to another
     * device.</li>
     * <li>{@code HTTP 404} if the device no longer exists.</li>
     * <li>{@code HTTP 500} on internal server errors.</li>
     * </ul>
     */
    @Operation(summary = "Get the license status of the device")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "401", content = @Content(schema = @Schema(hidden = true))),
        @ApiResponse(responseCode = "404", content = @Content(schema = @Schema(hidden = true))),
        @ApiResponse(responseCode = "500", content = @Content(schema = @Schema(hidden = true))),
    })
    @NonNull
    @GetMapping("/status")
    ResponseEntity<LicenseStatusResponse> getStatus(@Parameter(hidden = true) @NonNull @AuthenticationPrincipal Long deviceId) {
        try {
            return ResponseEntity.ok(licenseService.refreshLicense(deviceId));
        } catch (DeviceNotFoundException e) {
            log.trace("license status request failed", e);
            return ResponseEntity.notFound().build();
        }
    }
}
