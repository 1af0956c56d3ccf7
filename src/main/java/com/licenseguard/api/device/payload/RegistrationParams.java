package com.licenseguard.api.device.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A data transfer object to hold the body of device registration requests.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegistrationParams {

    @Schema(required = true, description = "email address of the user")
    @NotBlank
    @Email
    @Size(max = 255)
    private String email;

    @Schema(required = true, description = "fingerprint of the installation, derived by the client")
    @NotBlank
    @Size(min = 64, max = 255)
    private String deviceHash;
}
