package com.nosota.certledger.api.model;

/**
 * Transaction status in the ledger.
 * A transaction moves through exactly one transition in its lifetime.
 */
public enum TransactionStatus {
    /**
     * PENDING: Submitted to the transaction pool but not yet sealed into a block.
     * This is the initial state for all transactions.
     * Block number is absent in this state.
     */
    PENDING,

    /**
     * CONFIRMED: Sealed into a block.
     * Block number is assigned at the same moment.
     * This is a final state - no further changes possible due to immutability.
     */
    CONFIRMED
}
