package com.nosota.certledger.service;

import com.nosota.certledger.api.model.OperationType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Static gas cost table for ledger operations.
 *
 * <p>A caller supplying a limit below the nominal cost is charged only up to that limit;
 * the operation still succeeds. Operation kinds missing from the table fall back to
 * {@link #DEFAULT_COST}.
 */
@Component
public class GasModel {

    public static final long DEFAULT_COST = 21_000L;

    private static final Map<OperationType, Long> COSTS = new EnumMap<>(Map.of(
            OperationType.REGISTER_INSTITUTION, 150_000L,
            OperationType.ISSUE_CERTIFICATE, 100_000L,
            OperationType.VERIFY_CERTIFICATE, 21_000L,
            OperationType.TRANSFER, 21_000L
    ));

    /**
     * Nominal cost of an operation.
     *
     * @param operation Operation kind, may be null
     * @return Cost in gas units
     */
    public long costOf(OperationType operation) {
        if (operation == null) {
            return DEFAULT_COST;
        }
        return COSTS.getOrDefault(operation, DEFAULT_COST);
    }

    /**
     * Gas actually charged for an operation under a caller-supplied limit.
     *
     * @param operation     Operation kind
     * @param suppliedLimit Gas limit supplied by the caller, 0 or more
     * @return {@code min(suppliedLimit, costOf(operation))}
     * @throws IllegalArgumentException if the limit is negative
     */
    public long chargedGas(OperationType operation, long suppliedLimit) {
        if (suppliedLimit < 0) {
            throw new IllegalArgumentException("Gas limit must be non-negative: " + suppliedLimit);
        }
        return Math.min(suppliedLimit, costOf(operation));
    }
}
