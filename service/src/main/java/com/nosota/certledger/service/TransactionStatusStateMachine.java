package com.nosota.certledger.service;

import com.nosota.certledger.api.model.TransactionStatus;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for validating TransactionStatus transitions.
 *
 * <p>Implements strict validation rules for the transaction lifecycle:
 * <ul>
 *   <li>PENDING is the initial state (set when a transaction is built)</li>
 *   <li>PENDING can transition to CONFIRMED only, when sealed into a block</li>
 *   <li>CONFIRMED is final</li>
 * </ul>
 *
 * <p>State diagram:
 * <pre>
 * PENDING ──seal──▶ CONFIRMED
 * </pre>
 *
 * <p>Unlike a generic state machine, re-entering the same state is rejected: a transaction
 * confirmed twice would mean it was sealed into two blocks.
 */
@Component
public class TransactionStatusStateMachine {

    /**
     * Map of allowed transitions: fromStatus → Set of valid toStatus values.
     */
    private static final Map<TransactionStatus, Set<TransactionStatus>> ALLOWED_TRANSITIONS = Map.of(
            TransactionStatus.PENDING, EnumSet.of(TransactionStatus.CONFIRMED)
            // CONFIRMED is final - no transitions allowed
    );

    /**
     * Validates if a status transition is allowed.
     *
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @return true if transition is allowed, false otherwise
     */
    public boolean isTransitionAllowed(TransactionStatus fromStatus, TransactionStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }

        Set<TransactionStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * Validates if a status transition is allowed, throwing exception if not.
     *
     * @param transactionHash Hash of the transaction, for the error message
     * @param fromStatus      Current status
     * @param toStatus        Target status
     * @throws IllegalStateException if transition is not allowed
     */
    public void validateTransition(String transactionHash, TransactionStatus fromStatus, TransactionStatus toStatus) {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new IllegalStateException(
                    String.format("Invalid transaction status transition for %s: %s → %s. " +
                                    "Allowed transitions from %s: %s",
                            transactionHash, fromStatus, toStatus, fromStatus,
                            ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of()))
            );
        }
    }

    /**
     * Checks if a status is a final state (no further transitions allowed).
     *
     * @param status Status to check
     * @return true if status is final (immutable)
     */
    public boolean isFinalState(TransactionStatus status) {
        return status == TransactionStatus.CONFIRMED;
    }
}
