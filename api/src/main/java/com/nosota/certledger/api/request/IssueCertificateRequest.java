package com.nosota.certledger.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.LocalDate;

/**
 * Request for issuing a certificate.
 *
 * <p>Only recipientName, courseName, completionDate and institutionId identify the
 * certificate; grade is carried as metadata and does not affect the certificate hash.
 * When issuerWalletAddress is omitted the institution's own wallet signs the issuance.
 */
public record IssueCertificateRequest(
        @NotBlank(message = "Recipient name is required")
        String recipientName,

        @NotBlank(message = "Course name is required")
        String courseName,

        @NotNull(message = "Completion date is required")
        LocalDate completionDate,

        String grade,

        @NotBlank(message = "Institution ID is required")
        String institutionId,

        String issuerWalletAddress,

        @PositiveOrZero(message = "Gas limit must be non-negative")
        Long gasLimit
) {
}
