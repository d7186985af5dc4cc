package com.nosota.certledger.crypto;

/**
 * Source of opaque account identifiers for institution wallets and anonymous verifiers.
 *
 * <p>Addresses only need to be unique; they carry no key material.
 */
@FunctionalInterface
public interface AddressGenerator {

    /**
     * @return a new address, {@code 0x} followed by 40 lowercase hex digits
     */
    String nextAddress();
}
