package com.keyforge.node.credential;

import com.keyforge.core.domain.CredentialRecord;
import com.keyforge.core.repository.CredentialRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Issues root credentials for nodes, backed by the local cache file and the shared store.
 * <p>
 * A node already present in the cache gets its cached pair back and the shared store is not touched.
 * Otherwise a new key and secret are generated, the node's record in the shared store is superseded
 * (a stale record left behind by lost local credentials is removed first), and the plaintext pair is
 * added to the cache. Only the BCrypt hash of the secret reaches the shared store.
 */
public class NodeCredentialService {

    private static final Logger log = LoggerFactory.getLogger(NodeCredentialService.class);

    private final CredentialCacheFile cache;
    private final CredentialRecordStore store;
    private final SecureTokenGenerator tokens;
    private final PasswordEncoder passwordEncoder;

    public NodeCredentialService(
            CredentialCacheFile cache,
            CredentialRecordStore store,
            SecureTokenGenerator tokens,
            PasswordEncoder passwordEncoder) {
        if (cache == null) {
            throw new IllegalArgumentException("Credential cache cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("Credential store cannot be null");
        }
        this.cache = cache;
        this.store = store;
        this.tokens = tokens != null ? tokens : new SecureTokenGenerator();
        this.passwordEncoder = passwordEncoder != null ? passwordEncoder : new BCryptPasswordEncoder();
    }

    /**
     * Returns the credentials of a node, issuing them on first use.
     *
     * @param nodeId node identifier
     * @return the node's key and plaintext secret
     * @throws CredentialIssueException if the shared store or the cache file cannot be written
     */
    public NodeCredentials resolve(String nodeId) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("Node ID cannot be null or blank");
        }
        return cache.computeIfAbsent(nodeId, this::issue);
    }

    private NodeCredentials issue(String nodeId) {
        log.info("{} credentials not found - creating", nodeId);
        String userKey = tokens.nextToken();
        String userSecret = tokens.nextToken();

        CredentialRecord record = CredentialRecord.issue(
                nodeId,
                userKey,
                passwordEncoder.encode(userSecret),
                userKey + tokens.nextToken());
        try {
            store.supersede(record);
        } catch (RuntimeException e) {
            throw new CredentialIssueException("Failed to store credentials for " + nodeId, e);
        }
        return new NodeCredentials(userKey, userSecret);
    }
}
