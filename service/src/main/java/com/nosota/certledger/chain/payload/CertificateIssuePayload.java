package com.nosota.certledger.chain.payload;

import com.nosota.certledger.api.model.OperationType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Certificate issued by an institution.
 *
 * <p>completionDate is kept in its ISO-8601 text form, the same form that is hashed into
 * the certificate fingerprint.
 */
public record CertificateIssuePayload(
        String certificateHash,
        String certificateId,
        String recipientName,
        String courseName,
        String completionDate,
        String grade,
        String institutionId
) implements TransactionPayload {

    @Override
    public OperationType operation() {
        return OperationType.ISSUE_CERTIFICATE;
    }

    @Override
    public Map<String, Object> toCanonicalMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("certificate_hash", certificateHash);
        map.put("certificate_id", certificateId);
        map.put("recipient_name", recipientName);
        map.put("course_name", courseName);
        map.put("completion_date", completionDate);
        map.put("grade", grade);
        map.put("institution_id", institutionId);
        return map;
    }
}
