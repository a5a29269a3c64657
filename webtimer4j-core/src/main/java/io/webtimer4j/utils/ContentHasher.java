package io.webtimer4j.utils;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 of a response body, computed over at most {@code maxBytes} leading bytes.
 */
public final class ContentHasher {

    private final int maxBytes;

    public ContentHasher(int maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
        this.maxBytes = maxBytes;
    }

    public int maxBytes() {
        return maxBytes;
    }

    /**
     * Hex digest. A null body hashes like an empty one.
     */
    public String hash(byte[] body) {
        MessageDigest digest = sha256();
        if (body != null) {
            digest.update(body, 0, Math.min(body.length, maxBytes));
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }
}
