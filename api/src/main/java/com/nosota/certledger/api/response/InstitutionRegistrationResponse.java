package com.nosota.certledger.api.response;

/**
 * Response for institution registration.
 */
public record InstitutionRegistrationResponse(
        String institutionId,
        String walletAddress,
        String transactionHash,
        Long blockNumber,
        Long gasUsed
) {}
