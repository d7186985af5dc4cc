package com.nosota.certledger.error;

public class BlockNotFoundException extends LedgerNotFoundException {
    public BlockNotFoundException(long blockNumber) {
        super("Block not found: " + blockNumber);
    }
}
