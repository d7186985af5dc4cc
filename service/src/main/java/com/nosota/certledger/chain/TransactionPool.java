package com.nosota.certledger.chain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pending transactions in submission order.
 *
 * <p>The pool owns a transaction from submission until it is sealed into a block.
 * Every method is atomic on its own; {@link Chain} additionally serializes submit and
 * removal under its write lock so that submit-then-seal sequences are atomic as a whole.
 */
public class TransactionPool {

    private final List<ChainTransaction> pending = new ArrayList<>();

    public synchronized void submit(ChainTransaction transaction) {
        Objects.requireNonNull(transaction, "transaction");
        pending.add(transaction);
    }

    /**
     * Removes and returns every pending transaction.
     *
     * @return Transactions in submission order; empty if the pool was empty
     */
    public synchronized List<ChainTransaction> drainAll() {
        List<ChainTransaction> drained = List.copyOf(pending);
        pending.clear();
        return drained;
    }

    /**
     * Removes the given transactions, matched by hash. Transactions that are not pending
     * are ignored.
     *
     * @return Number of transactions removed
     */
    public synchronized int removeAll(Collection<ChainTransaction> transactions) {
        int before = pending.size();
        for (ChainTransaction tx : transactions) {
            pending.removeIf(candidate -> candidate.getHash().equals(tx.getHash()));
        }
        return before - pending.size();
    }

    public synchronized List<ChainTransaction> snapshot() {
        return List.copyOf(pending);
    }

    public synchronized Optional<ChainTransaction> findByHash(String hash) {
        return pending.stream()
                .filter(tx -> tx.getHash().equals(hash))
                .findFirst();
    }

    public synchronized int size() {
        return pending.size();
    }
}
