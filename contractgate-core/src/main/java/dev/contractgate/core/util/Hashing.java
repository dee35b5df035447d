package dev.contractgate.core.util;

import org.apache.commons.codec.digest.DigestUtils;

/**
 * SHA-256 helpers used for violation identities, baseline fingerprints and cache keys.
 */
public final class Hashing {

    private Hashing() {
    }

    /**
     * Hash a string and return the lowercase hex digest.
     *
     * @param input the text to hash (UTF-8)
     * @return the 64 character hex digest
     */
    public static String sha256Hex(String input) {
        return DigestUtils.sha256Hex(input);
    }

    public static String sha256Hex(byte[] input) {
        return DigestUtils.sha256Hex(input);
    }

    /**
     * Hash a string and keep the first {@code length} hex characters.
     */
    public static String shortSha256(String input, int length) {
        return sha256Hex(input).substring(0, length);
    }
}
