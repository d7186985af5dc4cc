package com.nosota.certledger.chain.payload;

import com.nosota.certledger.api.model.OperationType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Generic audit record: an explicit ordered key→value map.
 *
 * <p>Used for certificate verifications and for any operation that has no dedicated
 * payload. Entries keep their insertion order for display; hashing sorts them.
 */
public record AuditPayload(OperationType operation, Map<String, Object> entries) implements TransactionPayload {

    public AuditPayload {
        Objects.requireNonNull(operation, "operation");
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * Audit record of a certificate verification.
     */
    public static AuditPayload certificateVerification(String certificateHash, String institutionId, String verifier) {
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put("certificate_hash", certificateHash);
        entries.put("institution_id", institutionId);
        entries.put("verifier", verifier);
        entries.put("verified", true);
        return new AuditPayload(OperationType.VERIFY_CERTIFICATE, entries);
    }

    @Override
    public Map<String, Object> toCanonicalMap() {
        return new LinkedHashMap<>(entries);
    }
}
