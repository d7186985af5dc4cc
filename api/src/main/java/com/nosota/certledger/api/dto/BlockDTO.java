package com.nosota.certledger.api.dto;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.List;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class BlockDTO {
    private Long number;
    private Instant timestamp;
    private String previousHash;
    private String hash;
    private List<TransactionDTO> transactions;
    private Long gasUsed;
    private Long gasLimit;
}
