package com.nosota.certledger.crypto;

import java.util.HexFormat;
import java.util.Objects;
import java.util.Random;

/**
 * Generates 20-byte addresses from a random source.
 */
public class RandomAddressGenerator implements AddressGenerator {

    private static final int ADDRESS_BYTES = 20;

    private static final HexFormat HEX = HexFormat.of();

    private final Random random;

    public RandomAddressGenerator(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public String nextAddress() {
        byte[] bytes = new byte[ADDRESS_BYTES];
        random.nextBytes(bytes);
        return ContentHasher.HEX_PREFIX + HEX.formatHex(bytes);
    }
}
