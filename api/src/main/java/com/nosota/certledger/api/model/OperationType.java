package com.nosota.certledger.api.model;

/**
 * Kind of ledger operation carried by a transaction.
 * Determines the nominal gas cost charged for the transaction.
 */
public enum OperationType {
    REGISTER_INSTITUTION,
    ISSUE_CERTIFICATE,
    VERIFY_CERTIFICATE,
    TRANSFER
}
