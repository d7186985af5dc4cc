package com.nosota.certledger.error;

public class CertificateNotFoundException extends LedgerNotFoundException {
    public CertificateNotFoundException(String certificateHash) {
        super("Certificate not found: " + certificateHash);
    }
}
