package com.nosota.certledger.api.dto;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class InstitutionDTO {
    private String institutionId;
    private String name;
    private String contactAddress;
    private String email;
    private String walletAddress;

    /**
     * Reserved: no ledger operation sets this flag yet.
     */
    private boolean verified;
    private LocalDateTime registeredAt;
    private String transactionHash;
    private long certificatesIssued;
}
