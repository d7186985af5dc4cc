package com.nosota.certledger.chain.payload;

import com.nosota.certledger.api.model.OperationType;

import java.util.Map;

/**
 * Operation-specific content of a ledger transaction.
 *
 * <p>Each variant fixes the operation it belongs to and renders itself as a key→value
 * map with snake_case keys. The same map feeds the transaction hash, the block hash and
 * the API representation.
 */
public interface TransactionPayload {

    OperationType operation();

    Map<String, Object> toCanonicalMap();
}
