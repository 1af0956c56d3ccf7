package com.licenseguard.api.device.payload;

import com.licenseguard.api.device.exceptions.RegistrationRejectedException;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.util.Map;

/**
 * A data transfer object to explain why a device registration was rejected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "RegistrationError")
public class RegistrationErrorResponse {

    @Schema(required = true, allowableValues = {"DEVICE_CAP_EXCEEDED", "RATE_LIMIT_EXCEEDED"})
    @NonNull
    private String error;

    @Schema(required = true, description = "human readable explanation")
    @NonNull
    private String message;

    @Schema(required = true, description = "whether the same registration may succeed later")
    private boolean retryable;

    @Schema(required = true, description = "current count, maximum allowed and the kind of limit")
    @NonNull
    private Map<String, Object> details;

    @NonNull
    public static RegistrationErrorResponse from(@NonNull RegistrationRejectedException e) {
        return RegistrationErrorResponse.builder()
            .error(e.getReason().name())
            .message(e.getMessage())
            .retryable(e.isRetryable())
            .details(e.getDetails())
            .build();
    }
}
