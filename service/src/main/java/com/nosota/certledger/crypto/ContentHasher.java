package com.nosota.certledger.crypto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.stereotype.Component;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content hash used for certificate fingerprints, transaction hashes and block hashes.
 *
 * <p>Values are first canonicalized to JSON with map keys and bean properties sorted
 * lexicographically at every nesting level, so two structurally equal values built in a
 * different insertion order serialize to the same bytes. The canonical bytes are then
 * digested with SHA-256.
 *
 * <p>The algorithm is fixed: certificate hashes handed out to holders must stay
 * verifiable across restarts, so the digest is not a per-call parameter.
 *
 * <p>Output format: {@code 0x} followed by 64 lowercase hex digits.
 */
@Component
public class ContentHasher {

    public static final String ALGORITHM = "SHA-256";

    public static final String HEX_PREFIX = "0x";

    private static final HexFormat HEX = HexFormat.of();

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .build();

    /**
     * Hashes the canonical form of a value.
     *
     * @param value Map, list, record or scalar to hash
     * @return {@code 0x}-prefixed SHA-256 hex digest
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    public String hash(Object value) {
        byte[] digest = newDigest().digest(canonicalize(value));
        return HEX_PREFIX + HEX.formatHex(digest);
    }

    /**
     * Serializes a value to its canonical JSON bytes.
     *
     * @param value Value to canonicalize
     * @return UTF-8 JSON with sorted keys
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    public byte[] canonicalize(Object value) {
        try {
            return CANONICAL_MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be canonicalized: " + e.getOriginalMessage(), e);
        }
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " is not available in this JVM", e);
        }
    }
}
