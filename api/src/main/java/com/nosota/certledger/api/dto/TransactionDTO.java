package com.nosota.certledger.api.dto;

import com.nosota.certledger.api.model.OperationType;
import com.nosota.certledger.api.model.TransactionStatus;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Map;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class TransactionDTO {
    private String hash;
    private String from;
    private String to;
    private OperationType operation;
    private Map<String, Object> payload;
    private Long gasLimit;
    private Long gasUsed;
    private Long gasPrice;

    /**
     * Fee paid in wei: gasUsed × gasPrice.
     */
    private BigInteger fee;
    private Long nonce;
    private Instant timestamp;
    private Long blockNumber;
    private TransactionStatus status;
}
