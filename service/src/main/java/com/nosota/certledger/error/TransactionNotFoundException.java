package com.nosota.certledger.error;

public class TransactionNotFoundException extends LedgerNotFoundException {
    public TransactionNotFoundException(String transactionHash) {
        super("Transaction not found: " + transactionHash);
    }
}
