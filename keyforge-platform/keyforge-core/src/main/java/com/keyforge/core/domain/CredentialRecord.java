package com.keyforge.core.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Root credential of a node as held by the shared credential store.
 * Only the hash of the node secret is kept here; the plaintext secret never leaves the node's
 * local credential cache.
 */
public final class CredentialRecord {

    /**
     * Scope granted to every credential issued during node bootstrap.
     */
    public static final String WRITE_ROOT = "write_root";

    private final String userId;
    private final String userKey;
    private final String hashedSecret;
    private final List<String> lastIp;
    private final String scope;
    private final String refreshToken;
    private final Instant createdAt;

    private CredentialRecord(
            String userId,
            String userKey,
            String hashedSecret,
            List<String> lastIp,
            String scope,
            String refreshToken,
            Instant createdAt) {
        this.userId = userId;
        this.userKey = userKey;
        this.hashedSecret = hashedSecret;
        this.lastIp = List.copyOf(lastIp);
        this.scope = scope;
        this.refreshToken = refreshToken;
        this.createdAt = createdAt;
    }

    /**
     * Creates a freshly issued root credential with no recorded addresses.
     *
     * @param userId node identifier the credential belongs to
     * @param userKey public half of the credential
     * @param hashedSecret one-way hash of the node secret
     * @param refreshToken refresh token, prefixed by the user key
     */
    public static CredentialRecord issue(String userId, String userKey, String hashedSecret, String refreshToken) {
        requireText(userId, "User ID is required");
        requireText(userKey, "User key is required");
        requireText(hashedSecret, "Hashed secret is required");
        requireText(refreshToken, "Refresh token is required");
        if (!refreshToken.startsWith(userKey)) {
            throw new IllegalArgumentException("Refresh token must be derived from the user key");
        }
        return new CredentialRecord(userId, userKey, hashedSecret, List.of(), WRITE_ROOT, refreshToken, Instant.now());
    }

    /**
     * Rebuilds a record read back from storage.
     */
    public static CredentialRecord restore(
            String userId,
            String userKey,
            String hashedSecret,
            List<String> lastIp,
            String scope,
            String refreshToken,
            Instant createdAt) {
        requireText(userId, "User ID is required");
        return new CredentialRecord(
                userId,
                userKey,
                hashedSecret,
                lastIp != null ? lastIp : List.of(),
                scope,
                refreshToken,
                Objects.requireNonNull(createdAt, "Creation time is required"));
    }

    private static void requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
    }

    public String getUserId() { return userId; }
    public String getUserKey() { return userKey; }
    public String getHashedSecret() { return hashedSecret; }
    public List<String> getLastIp() { return lastIp; }
    public String getScope() { return scope; }
    public String getRefreshToken() { return refreshToken; }
    public Instant getCreatedAt() { return createdAt; }

    public boolean isRootScoped() {
        return WRITE_ROOT.equals(scope);
    }

    @Override
    public String toString() {
        return "CredentialRecord[userId=" + userId + ", scope=" + scope + ", createdAt=" + createdAt + "]";
    }
}
