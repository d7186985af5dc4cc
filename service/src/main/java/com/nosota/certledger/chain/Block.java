package com.nosota.certledger.chain;

import lombok.Getter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, ordered container of confirmed transactions.
 *
 * <p>previousHash of block N equals the hash of block N-1. The hash of every block except
 * genesis is derived from (number, previousHash, transactions, timestamp); genesis carries
 * fixed sentinel values instead.
 *
 * <p>gasLimit is an advisory capacity figure; it is not checked against the sum of
 * member transaction limits.
 */
@Getter
public final class Block {

    public static final long GENESIS_NUMBER = 0L;

    public static final String GENESIS_PREVIOUS_HASH = "0x" + "0".repeat(64);

    public static final String GENESIS_HASH = "0x" + "0".repeat(62) + "01";

    public static final long DEFAULT_GAS_LIMIT = 8_000_000L;

    private final long number;
    private final Instant timestamp;
    private final String previousHash;
    private final String hash;
    private final List<ChainTransaction> transactions;
    private final long gasUsed;
    private final long gasLimit;

    Block(long number, Instant timestamp, String previousHash, String hash,
          List<ChainTransaction> transactions, long gasLimit) {
        this.number = number;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.previousHash = Objects.requireNonNull(previousHash, "previousHash");
        this.hash = Objects.requireNonNull(hash, "hash");
        this.transactions = List.copyOf(transactions);
        this.gasUsed = this.transactions.stream().mapToLong(ChainTransaction::getGasUsed).sum();
        this.gasLimit = gasLimit;
    }

    static Block genesis(Instant timestamp, long gasLimit) {
        return new Block(GENESIS_NUMBER, timestamp, GENESIS_PREVIOUS_HASH, GENESIS_HASH, List.of(), gasLimit);
    }

    /**
     * Fields covered by the block hash.
     */
    static Map<String, Object> hashInput(long number, String previousHash,
                                         List<ChainTransaction> transactions, Instant timestamp) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("number", number);
        input.put("previous_hash", previousHash);
        input.put("transactions", transactions.stream().map(ChainTransaction::canonicalView).toList());
        input.put("timestamp", timestamp.toEpochMilli());
        return input;
    }

    public boolean isGenesis() {
        return number == GENESIS_NUMBER;
    }
}
