package com.tiktimer.backend.security;

/**
 * One-way, salted digests for login passwords and refresh token fingerprints.
 */
public interface CredentialHasher {

    /**
     * Produces a randomized digest; hashing the same secret twice yields two different digests.
     */
    String hash(String secret);

    /**
     * Whether {@code secret} matches a digest previously produced by {@link #hash(String)}.
     * Returns {@code false} for null input or a malformed digest, never throws.
     */
    boolean verify(String secret, String digest);

    /**
     * Whether {@code secret} fits the digest's input limit, so that {@link #hash(String)} accepts it.
     */
    boolean accepts(String secret);
}
