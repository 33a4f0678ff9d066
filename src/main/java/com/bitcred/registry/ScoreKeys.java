package com.bitcred.registry;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/**
 * Derives registry identifiers from raw Bitcoin addresses.
 *
 * <p>The identifier is SHA-256 of the UTF-8 address truncated to 31 bytes, so it always fits a
 * felt252, rendered as {@code 0x}-prefixed lowercase hex without leading zeros. The address is
 * hashed byte for byte as given, so padded input yields a different identifier. The raw address
 * never reaches the ledger.
 */
public final class ScoreKeys {

    private static final int FELT_BYTES = 31;

    private ScoreKeys() {}

    public static String fromBtcAddress(String btcAddress) {
        if (btcAddress == null || btcAddress.isBlank()) {
            throw new IllegalArgumentException("Bitcoin address is required");
        }
        byte[] digest = sha256(btcAddress.getBytes(StandardCharsets.UTF_8));
        BigInteger felt = new BigInteger(1, Arrays.copyOf(digest, FELT_BYTES));
        return "0x" + felt.toString(16);
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
