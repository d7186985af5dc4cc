package com.nosota.certledger.api.response;

/**
 * Aggregated ledger statistics.
 *
 * <p>blockHeight is the number of the latest block (0 while only genesis exists),
 * totalBlocks counts genesis as well.
 */
public record LedgerStatsResponse(
        long totalInstitutions,
        long totalCertificates,
        long blockHeight,
        long totalBlocks,
        long totalTransactions,
        long pendingTransactions,
        long totalGasUsed,
        String latestBlockHash,
        boolean chainValid,
        String contractAddress
) {}
