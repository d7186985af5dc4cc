package com.nosota.certledger.error;

/**
 * Base class for lookups of unknown institutions, certificates, blocks and transactions.
 */
public abstract class LedgerNotFoundException extends Exception {
    protected LedgerNotFoundException(String message) {
        super(message);
    }
}
