package com.tiktimer.backend.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

@Slf4j
@Component
@RequiredArgsConstructor
public class BCryptCredentialHasher implements CredentialHasher {

    /** BCrypt ignores everything past this many bytes of input. */
    public static final int MAX_SECRET_BYTES = 72;

    private static final Pattern BCRYPT_PATTERN = Pattern.compile("\\A\\$2([aby])?\\$\\d\\d\\$[./0-9A-Za-z]{53}");

    private final PasswordEncoder passwordEncoder;

    @Override
    public String hash(String secret) {
        if (secret == null) {
            throw new IllegalArgumentException("Secret must not be null");
        }
        if (!accepts(secret)) {
            throw new IllegalArgumentException("Secret must be at most " + MAX_SECRET_BYTES + " bytes in UTF-8");
        }
        return passwordEncoder.encode(secret);
    }

    @Override
    public boolean verify(String secret, String digest) {
        if (!accepts(secret) || digest == null || !BCRYPT_PATTERN.matcher(digest).matches()) {
            return false;
        }
        try {
            return passwordEncoder.matches(secret, digest);
        } catch (IllegalArgumentException ex) {
            log.debug("Digest rejected by encoder: {}", ex.getMessage());
            return false;
        }
    }

    @Override
    public boolean accepts(String secret) {
        return secret != null && secret.getBytes(StandardCharsets.UTF_8).length <= MAX_SECRET_BYTES;
    }
}
