package com.nosota.certledger.api.response;

/**
 * Response for certificate issuance.
 */
public record CertificateIssueResponse(
        String certificateId,
        String certificateHash,
        String transactionHash,
        Long blockNumber,
        Long gasUsed
) {}
