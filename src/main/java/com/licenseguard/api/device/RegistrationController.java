package com.licenseguard.api.device;

import com.licenseguard.api.abuse.AbuseConfiguration;
import com.licenseguard.api.device.exceptions.DeviceCapExceededException;
import com.licenseguard.api.device.exceptions.DeviceCreationRateLimitException;
import com.licenseguard.api.device.exceptions.RegistrationRejectedException;
import com.licenseguard.api.device.payload.RegistrationErrorResponse;
import com.licenseguard.api.device.payload.RegistrationParams;
import com.licenseguard.api.device.payload.RegistrationResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.headers.Header;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirements;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for device registration on the '{@code /v1/auth}' routes.
 */
@Validated
@RestController
@RequestMapping("/v1/auth")
@Slf4j
@Tag(name = "auth")
class RegistrationController {

    static final String RETRY_AFTER_HEADER = "Retry-After";
    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    private final AbuseConfiguration abuseConfig;
    private final DeviceRegistrationService registrationService;

    @Autowired
    RegistrationController(
        @NonNull AbuseConfiguration abuseConfig,
        @NonNull DeviceRegistrationService registrationService
    ) {
        this.abuseConfig = abuseConfig;
        this.registrationService = registrationService;
    }

    /**
     * <p>
     * Registers a device to a user. Users are identified by their email and devices by their
     * fingerprint; either is created on first sight. A device gets its one 14-day trial on its
     * first registration, and never again.</p>
     *
     * <p>
     * If the registration is rejected, the response body explains why. A rejection due to rate
     * limiting carries a {@code Retry-After} header with the number of seconds after which the
     * request may succeed.</p>
     *
     * @return <ul>
     * <li>{@code HTTP 200} with the license status of the device and a lease token.</li>
     * <li>{@code HTTP 400} if the request is not valid.</li>
     * <li>{@code HTTP 409} if the user already reached their device cap.</li>
     * <li>{@code HTTP 429} if too many devices were registered recently.</li>
     * <li>{@code HTTP 503} if the registration kept conflicting with concurrent requests.</li>
     * <li>{@code HTTP 500} on internal server errors.</li>
     * </ul>
     */
    @Operation(summary = "Register a device")
    @SecurityRequirements
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", content = @Content(schema = @Schema(hidden = true))),
        @ApiResponse(responseCode = "409", content = @Content(schema = @Schema(implementation = RegistrationErrorResponse.class))),
        @ApiResponse(
            responseCode = "429",
            headers = @Header(name = RETRY_AFTER_HEADER, description = "seconds after which the request may succeed"),
            content = @Content(schema = @Schema(implementation = RegistrationErrorResponse.class))),
        @ApiResponse(responseCode = "503", content = @Content(schema = @Schema(hidden = true))),
        @ApiResponse(responseCode = "500", content = @Content(schema = @Schema(hidden = true))),
    })
    @NonNull
    @PostMapping("/register")
    ResponseEntity<?> register(@Valid @NotNull @RequestBody RegistrationParams params, @NonNull HttpServletRequest request) {
        try {
            val result = registrationService.registerDeviceUser(params.getEmail(), params.getDeviceHash(), sourceIpOf(request));
            return ResponseEntity.ok(RegistrationResponse.from(result));
        } catch (DeviceCreationRateLimitException e) {
            log.trace("registration request rate limited", e);
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(RETRY_AFTER_HEADER, String.valueOf(Math.max(1, e.getRetryAfter().toSeconds())))
                .body(RegistrationErrorResponse.from(e));
        } catch (DeviceCapExceededException e) {
            log.trace("registration request exceeded the device cap", e);
            return ResponseEntity.status(HttpStatus.CONFLICT).body(RegistrationErrorResponse.from(e));
        } catch (RegistrationRejectedException e) {
            throw new IllegalStateException("unsupported registration rejection", e);
        }
    }

    private String sourceIpOf(@NonNull HttpServletRequest request) {
        if (abuseConfig.isTrustForwardedHeader()) {
            val forwardedFor = request.getHeader(FORWARDED_FOR_HEADER);
            if (forwardedFor != null && !forwardedFor.isBlank()) {
                return forwardedFor.split(",")[0].trim();
            }
        }

        return request.getRemoteAddr();
    }
}
