package io.webtimer4j.core;

/**
 * Change-detection output.
 *
 * <p>For the first success of a schedule {@code changed} is true and {@code previousHash} is null.
 * Failed attempts are never compared: {@code currentHash} is null and {@code changed} is false.
 */
public record ChangeResult(
        boolean changed,
        String previousHash,
        String currentHash
) {

    public static ChangeResult notCompared(String previousHash) {
        return new ChangeResult(false, previousHash, null);
    }

    public boolean firstSuccess() {
        return currentHash != null && previousHash == null;
    }
}
