package com.nosota.certledger.api.dto;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class CertificateDTO {
    private String certificateHash;
    private String certificateId;
    private String recipientName;
    private String courseName;
    private LocalDate completionDate;
    private String grade;
    private String institutionId;
    private String institutionName;
    private String issuerAddress;
    private String transactionHash;
    private Long blockNumber;
    private LocalDateTime issuedAt;
    private boolean valid;
}
