package com.nosota.certledger.api.response;

import com.nosota.certledger.api.dto.CertificateDTO;

/**
 * Response for certificate verification.
 *
 * <p>verificationTransactionHash and blockNumber identify the audit transaction
 * recorded for this verification call.
 */
public record CertificateVerificationResponse(
        CertificateDTO certificate,
        boolean verified,
        String verificationTransactionHash,
        Long blockNumber
) {}
