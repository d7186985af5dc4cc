package com.nosota.certledger.chain;

import com.nosota.certledger.api.model.OperationType;
import com.nosota.certledger.api.model.TransactionStatus;
import com.nosota.certledger.chain.payload.TransactionPayload;
import lombok.Getter;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single ledger operation.
 *
 * <p>Everything except status and block number is fixed at construction. Status and block
 * number change together, once, when the transaction is sealed into a block; that change
 * is made by {@link Chain} under its write lock, which is also what publishes it to readers.
 *
 * <p>Instances are created through {@link Chain#newTransaction}, which assigns the nonce,
 * charged gas, timestamp and hash.
 */
@Getter
public class ChainTransaction {

    private final String hash;
    private final String from;
    private final String to;
    private final OperationType operation;
    private final TransactionPayload payload;
    private final long gasLimit;
    private final long gasUsed;
    private final long gasPrice;
    private final long nonce;
    private final Instant timestamp;

    private TransactionStatus status;
    private Long blockNumber;

    ChainTransaction(String hash, String from, String to, TransactionPayload payload,
                     long gasLimit, long gasUsed, long gasPrice, long nonce, Instant timestamp) {
        if (gasUsed > gasLimit) {
            throw new IllegalArgumentException(
                    String.format("Gas used %d exceeds gas limit %d", gasUsed, gasLimit));
        }
        this.hash = Objects.requireNonNull(hash, "hash");
        this.from = from;
        this.to = to;
        this.payload = Objects.requireNonNull(payload, "payload");
        this.operation = payload.operation();
        this.gasLimit = gasLimit;
        this.gasUsed = gasUsed;
        this.gasPrice = gasPrice;
        this.nonce = nonce;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.status = TransactionStatus.PENDING;
    }

    /**
     * Fields covered by the transaction hash.
     */
    static Map<String, Object> hashInput(String from, String to, TransactionPayload payload, long gasLimit,
                                         long gasUsed, long gasPrice, long nonce, Instant timestamp) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("from", from);
        input.put("to", to);
        input.put("operation", payload.operation().name());
        input.put("payload", payload.toCanonicalMap());
        input.put("gas_limit", gasLimit);
        input.put("gas_used", gasUsed);
        input.put("gas_price", gasPrice);
        input.put("nonce", nonce);
        input.put("timestamp", timestamp.toEpochMilli());
        return input;
    }

    /**
     * Full serialized form of the transaction as it appears inside a block hash.
     */
    Map<String, Object> canonicalView() {
        Map<String, Object> view = hashInput(from, to, payload, gasLimit, gasUsed, gasPrice, nonce, timestamp);
        view.put("hash", hash);
        view.put("status", status.name());
        view.put("block_number", blockNumber);
        return view;
    }

    void confirm(long sealedInBlock) {
        this.status = TransactionStatus.CONFIRMED;
        this.blockNumber = sealedInBlock;
    }

    /**
     * Fee paid in wei.
     */
    public BigInteger getFee() {
        return BigInteger.valueOf(gasUsed).multiply(BigInteger.valueOf(gasPrice));
    }

    public boolean isPending() {
        return status == TransactionStatus.PENDING;
    }
}
