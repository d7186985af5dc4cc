package com.nosota.certledger.error;

public class InstitutionNotFoundException extends LedgerNotFoundException {
    public InstitutionNotFoundException(String institutionId) {
        super("Institution not found: " + institutionId);
    }
}
