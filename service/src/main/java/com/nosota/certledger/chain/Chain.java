package com.nosota.certledger.chain;

import com.nosota.certledger.api.model.TransactionStatus;
import com.nosota.certledger.chain.payload.TransactionPayload;
import com.nosota.certledger.crypto.ContentHasher;
import com.nosota.certledger.service.GasModel;
import com.nosota.certledger.service.TransactionStatusStateMachine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Append-only sequence of blocks starting from a fixed genesis block.
 *
 * <p>The chain lives for the lifetime of the process; a new instance holds genesis only.
 *
 * <p>Concurrency: a single read/write lock guards the chain and its pool. Building a
 * transaction (nonce assignment), submitting and appending take the write lock,
 * so a submit followed by a seal is atomic from the caller's point of view and no
 * transaction can be sealed twice or lost between pool and block. Lookups take the read
 * lock and may run concurrently with each other.
 *
 * <p>Sealing is deterministic and unconditional: no proof-of-work, no difficulty, no
 * block-size enforcement.
 */
@Slf4j
public class Chain {

    private final TransactionPool pool;
    private final ContentHasher hasher;
    private final GasModel gasModel;
    private final TransactionStatusStateMachine statusStateMachine;
    private final Clock clock;
    private final long gasPrice;
    private final long blockGasLimit;

    private final ReentrantReadWriteLock guard = new ReentrantReadWriteLock();
    private final List<Block> blocks = new ArrayList<>();
    private final Map<String, ChainTransaction> sealedByHash = new HashMap<>();
    private long nextNonce;

    public Chain(TransactionPool pool, ContentHasher hasher, GasModel gasModel,
                 TransactionStatusStateMachine statusStateMachine, Clock clock,
                 long gasPrice, long blockGasLimit) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.gasModel = Objects.requireNonNull(gasModel, "gasModel");
        this.statusStateMachine = Objects.requireNonNull(statusStateMachine, "statusStateMachine");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.gasPrice = gasPrice;
        this.blockGasLimit = blockGasLimit;
        this.blocks.add(Block.genesis(clock.instant(), blockGasLimit));
    }

    // ==================== Mutations ====================

    /**
     * Builds a PENDING transaction without submitting it.
     *
     * <p>Gas used is charged by the {@link GasModel} against the supplied limit. The
     * transaction hash covers sender, recipient, payload, gas figures, nonce and timestamp.
     *
     * @param from     Sender address
     * @param to       Recipient address
     * @param payload  Operation payload
     * @param gasLimit Caller-supplied gas limit, 0 or more
     * @return New pending transaction
     */
    public ChainTransaction newTransaction(String from, String to, TransactionPayload payload, long gasLimit) {
        Objects.requireNonNull(payload, "payload");
        long gasUsed = gasModel.chargedGas(payload.operation(), gasLimit);

        Lock lock = guard.writeLock();
        lock.lock();
        try {
            long nonce = nextNonce++;
            Instant timestamp = clock.instant();
            String hash = hasher.hash(ChainTransaction.hashInput(
                    from, to, payload, gasLimit, gasUsed, gasPrice, nonce, timestamp));
            return new ChainTransaction(hash, from, to, payload, gasLimit, gasUsed, gasPrice, nonce, timestamp);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds a transaction to the pending pool.
     *
     * @throws IllegalStateException if the transaction is already sealed or already pending
     */
    public void submit(ChainTransaction transaction) {
        Objects.requireNonNull(transaction, "transaction");
        Lock lock = guard.writeLock();
        lock.lock();
        try {
            if (!transaction.isPending() || sealedByHash.containsKey(transaction.getHash())) {
                throw new IllegalStateException("Transaction already sealed: " + transaction.getHash());
            }
            if (pool.findByHash(transaction.getHash()).isPresent()) {
                throw new IllegalStateException("Transaction already pending: " + transaction.getHash());
            }
            pool.submit(transaction);
            log.debug("Submitted transaction: hash={}, operation={}, gasUsed={}",
                    transaction.getHash(), transaction.getOperation(), transaction.getGasUsed());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Seals a sequence of pending transactions into the next block.
     *
     * <p>An empty sequence is a normal no-op: no block is created. Otherwise every
     * transaction must still be PENDING and appear once; otherwise nothing is confirmed,
     * the pool is left as it was and an {@link IllegalStateException} is thrown. Sealed
     * transactions that were waiting in the pool are removed from it.
     *
     * @param transactions Transactions in the order they should appear in the block
     * @return The appended block, or empty if there was nothing to seal
     */
    public Optional<Block> append(List<ChainTransaction> transactions) {
        Lock lock = guard.writeLock();
        lock.lock();
        try {
            if (transactions.isEmpty()) {
                return Optional.empty();
            }
            Set<String> seen = new HashSet<>();
            for (ChainTransaction tx : transactions) {
                statusStateMachine.validateTransition(tx.getHash(), tx.getStatus(), TransactionStatus.CONFIRMED);
                if (!seen.add(tx.getHash())) {
                    throw new IllegalStateException("Transaction listed twice in one block: " + tx.getHash());
                }
            }

            Block head = blocks.get(blocks.size() - 1);
            long number = head.getNumber() + 1;
            for (ChainTransaction tx : transactions) {
                tx.confirm(number);
            }

            Instant timestamp = clock.instant();
            String hash = hasher.hash(Block.hashInput(number, head.getHash(), transactions, timestamp));
            Block block = new Block(number, timestamp, head.getHash(), hash, transactions, blockGasLimit);

            blocks.add(block);
            for (ChainTransaction tx : transactions) {
                sealedByHash.put(tx.getHash(), tx);
            }
            pool.removeAll(transactions);

            log.info("Sealed block: number={}, hash={}, transactions={}, gasUsed={}",
                    number, hash, transactions.size(), block.getGasUsed());
            return Optional.of(block);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Seals everything in the pool into the next block. The pool is only emptied once
     * the block is appended.
     *
     * @return The appended block, or empty if the pool was empty
     */
    public Optional<Block> sealPending() {
        Lock lock = guard.writeLock();
        lock.lock();
        try {
            return append(pool.snapshot());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Submits a transaction and seals the pool in one critical section.
     *
     * <p>The returned block contains the transaction, preceded by anything that was
     * already pending.
     */
    public Block submitAndSeal(ChainTransaction transaction) {
        Lock lock = guard.writeLock();
        lock.lock();
        try {
            submit(transaction);
            return sealPending()
                    .orElseThrow(() -> new IllegalStateException(
                            "Pool was empty right after submitting " + transaction.getHash()));
        } finally {
            lock.unlock();
        }
    }

    // ==================== Queries ====================

    /**
     * @return the most recently appended block, genesis if nothing was sealed yet
     */
    public Block latest() {
        return read(() -> blocks.get(blocks.size() - 1));
    }

    public Optional<Block> blockByNumber(long number) {
        return read(() -> number < 0 || number >= blocks.size()
                ? Optional.empty()
                : Optional.of(blocks.get((int) number)));
    }

    public List<Block> blocks() {
        return read(() -> List.copyOf(blocks));
    }

    /**
     * @return number of the latest block; 0 while only genesis exists
     */
    public long height() {
        return read(() -> blocks.get(blocks.size() - 1).getNumber());
    }

    /**
     * Sealed transactions from block 0 upward in sealed order, followed by pending ones.
     */
    public List<ChainTransaction> allTransactions() {
        return read(() -> {
            List<ChainTransaction> all = new ArrayList<>(sealedByHash.size() + pool.size());
            for (Block block : blocks) {
                all.addAll(block.getTransactions());
            }
            all.addAll(pool.snapshot());
            return List.copyOf(all);
        });
    }

    /**
     * Looks a transaction up in sealed blocks first, then in the pending pool.
     */
    public Optional<ChainTransaction> transactionByHash(String hash) {
        return read(() -> {
            ChainTransaction sealed = sealedByHash.get(hash);
            return sealed != null ? Optional.of(sealed) : pool.findByHash(hash);
        });
    }

    public int pendingCount() {
        return read(pool::size);
    }

    public long sealedTransactionCount() {
        return read(() -> (long) sealedByHash.size());
    }

    public long totalGasUsed() {
        return read(() -> blocks.stream().mapToLong(Block::getGasUsed).sum());
    }

    /**
     * Re-derives every block hash and checks numbering and previous-hash linkage.
     *
     * @return Human-readable violations; empty for a sound chain
     */
    public List<String> integrityViolations() {
        return read(() -> {
            List<String> violations = new ArrayList<>();
            Block genesis = blocks.get(0);
            if (!Block.GENESIS_HASH.equals(genesis.getHash())
                    || !Block.GENESIS_PREVIOUS_HASH.equals(genesis.getPreviousHash())) {
                violations.add("Genesis block sentinels were altered");
            }

            for (int i = 1; i < blocks.size(); i++) {
                Block previous = blocks.get(i - 1);
                Block block = blocks.get(i);
                if (block.getNumber() != previous.getNumber() + 1) {
                    violations.add(String.format("Block %d follows block %d", block.getNumber(), previous.getNumber()));
                }
                if (!block.getPreviousHash().equals(previous.getHash())) {
                    violations.add(String.format("Block %d previousHash does not match block %d hash",
                            block.getNumber(), previous.getNumber()));
                }
                String expected = hasher.hash(Block.hashInput(
                        block.getNumber(), block.getPreviousHash(), block.getTransactions(), block.getTimestamp()));
                if (!expected.equals(block.getHash())) {
                    violations.add(String.format("Block %d hash does not match its contents", block.getNumber()));
                }
                for (ChainTransaction tx : block.getTransactions()) {
                    if (!statusStateMachine.isFinalState(tx.getStatus())
                            || !Long.valueOf(block.getNumber()).equals(tx.getBlockNumber())) {
                        violations.add(String.format("Transaction %s in block %d is not confirmed in that block",
                                tx.getHash(), block.getNumber()));
                    }
                }
            }
            return violations;
        });
    }

    public boolean isValid() {
        return integrityViolations().isEmpty();
    }

    private <T> T read(Supplier<T> query) {
        Lock lock = guard.readLock();
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }
}
