package com.nosota.certledger.error;

/**
 * Thrown when a certificate with the same identity fields, and therefore the same hash,
 * was already issued. Issued certificates are never overwritten.
 */
public class CertificateAlreadyIssuedException extends Exception {
    public CertificateAlreadyIssuedException(String certificateHash) {
        super("Certificate already issued: " + certificateHash);
    }
}
