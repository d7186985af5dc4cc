package com.nosota.certledger.chain.payload;

import com.nosota.certledger.api.model.OperationType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Public fields of an institution recorded at registration.
 */
public record InstitutionRegistrationPayload(
        String institutionId,
        String name,
        String contactAddress,
        String email,
        String walletAddress
) implements TransactionPayload {

    @Override
    public OperationType operation() {
        return OperationType.REGISTER_INSTITUTION;
    }

    @Override
    public Map<String, Object> toCanonicalMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("institution_id", institutionId);
        map.put("name", name);
        map.put("contact_address", contactAddress);
        map.put("email", email);
        map.put("wallet_address", walletAddress);
        return map;
    }
}
