package com.keyforge.node.credential;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Generates unguessable URL-safe tokens for node credentials.
 */
public class SecureTokenGenerator {

    /** 256 bits. */
    static final int TOKEN_BYTES = 32;

    private final SecureRandom secureRandom;

    public SecureTokenGenerator() {
        this(new SecureRandom());
    }

    public SecureTokenGenerator(SecureRandom secureRandom) {
        if (secureRandom == null) {
            throw new IllegalArgumentException("SecureRandom cannot be null");
        }
        this.secureRandom = secureRandom;
    }

    /**
     * @return a 256-bit random token, Base64 URL-encoded without padding (43 characters)
     */
    public String nextToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
