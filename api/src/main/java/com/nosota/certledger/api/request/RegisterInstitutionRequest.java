package com.nosota.certledger.api.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request for registering an institution on the ledger.
 *
 * <p>A wallet address is generated for the institution; it is not supplied by the caller.
 */
public record RegisterInstitutionRequest(
        @NotBlank(message = "Institution name is required")
        String name,

        @NotBlank(message = "Contact address is required")
        String contactAddress,

        @NotBlank(message = "Email is required")
        @Email(message = "Email must be a well-formed address")
        String email,

        @PositiveOrZero(message = "Gas limit must be non-negative")
        Long gasLimit
) {
}
