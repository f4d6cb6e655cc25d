package com.keyforge.node.bootstrap;

import com.keyforge.core.repository.CredentialRecordStore;
import com.keyforge.core.repository.CredentialRecordStoreFactory;
import com.keyforge.node.credential.CredentialCacheFile;
import com.keyforge.node.credential.CredentialIssueException;
import com.keyforge.node.credential.NodeCredentialService;
import com.keyforge.node.credential.NodeCredentials;
import com.keyforge.node.credential.SecureTokenGenerator;
import com.keyforge.node.key.KeypairMaterial;
import com.keyforge.node.key.SigningKeyManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bootstraps the identity of every node the loader brings up.
 * <p>
 * Per node: wait for the signing keys, hand the keypair to key-consuming nodes, and issue (or look up)
 * root credentials for core nodes that were not given a secret by the operator.
 * <p>
 * The shared database target comes from one distinguished node ({@link BootstrapSettings#authDatabaseNodeId()}),
 * read from its provided {@code databaseUrl} or else its local default. Other core nodes wait until that node
 * has been verified. The wait fails with {@link MissingDatabaseTargetException} when the loader reports
 * {@link #loadingComplete()} without the node having appeared, or when the configured timeout elapses.
 * <p>
 * The loader is expected to verify each node ID once; repeated calls for one ID share the first call's result.
 */
public class BootstrapCoordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BootstrapCoordinator.class);

    private final BootstrapSettings settings;
    private final SigningKeyManager keyManager;
    private final CredentialCacheFile cache;
    private final CredentialRecordStoreFactory storeFactory;
    private final SecureTokenGenerator tokens;
    private final PasswordEncoder passwordEncoder;
    private final Executor executor;

    private final CompletableFuture<String> databaseTarget = new CompletableFuture<>();
    private final AtomicBoolean targetTimerStarted = new AtomicBoolean(false);
    private final Map<String, CompletableFuture<NodeCredentials>> credentials = new ConcurrentHashMap<>();
    private final Map<String, CredentialRecordStore> stores = new ConcurrentHashMap<>();
    private final Map<String, NodeCredentialService> services = new ConcurrentHashMap<>();

    public BootstrapCoordinator(
            BootstrapSettings settings,
            SigningKeyManager keyManager,
            CredentialCacheFile cache,
            CredentialRecordStoreFactory storeFactory,
            SecureTokenGenerator tokens,
            PasswordEncoder passwordEncoder,
            Executor executor) {
        if (settings == null) {
            throw new IllegalArgumentException("Settings cannot be null");
        }
        if (keyManager == null) {
            throw new IllegalArgumentException("Key manager cannot be null");
        }
        if (storeFactory == null) {
            throw new IllegalArgumentException("Store factory cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("Executor cannot be null");
        }
        this.settings = settings;
        this.keyManager = keyManager;
        this.cache = cache != null ? cache : new CredentialCacheFile(settings.certDirectory());
        this.storeFactory = storeFactory;
        this.tokens = tokens != null ? tokens : new SecureTokenGenerator();
        this.passwordEncoder = passwordEncoder != null ? passwordEncoder : new BCryptPasswordEncoder();
        this.executor = executor;
    }

    /**
     * Bootstraps one node. Must complete before the node starts.
     *
     * @param type node type
     * @param nodeId node identifier
     * @param config node configuration; key material and credentials are written to its local values
     * @return future completing once every applicable value is in {@code config.local()}
     */
    public CompletableFuture<Void> verify(NodeType type, String nodeId, NodeConfig config) {
        if (type == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Node type cannot be null"));
        }
        if (nodeId == null || nodeId.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Node ID cannot be null or blank"));
        }
        if (config == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Node config cannot be null"));
        }

        if (isAuthDatabaseNode(nodeId)) {
            supplyDatabaseTarget(type, nodeId, config);
        }

        return keyManager.ready()
                .thenAccept(keys -> injectKeys(type, config, keys))
                .thenCompose(ignored -> verifyCredentials(type, nodeId, config))
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        log.error("Bootstrap of {} node {} failed", type, nodeId, error);
                    } else {
                        log.info("Bootstrapped {} node {}", type, nodeId);
                    }
                });
    }

    /**
     * Convenience overload taking the loader's type name.
     */
    public CompletableFuture<Void> verify(String type, String nodeId, NodeConfig config) {
        try {
            return verify(NodeType.of(type), nodeId, config);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Called by the loader once every node descriptor has been passed to {@link #verify}.
     * Core nodes still waiting for the database target fail instead of waiting forever.
     */
    public void loadingComplete() {
        if (databaseTarget.completeExceptionally(new MissingDatabaseTargetException(
                "Node " + settings.authDatabaseNodeId() + " was never loaded; "
                        + "core nodes cannot be issued credentials without its " + NodeConfig.DATABASE_URL))) {
            log.warn("Loading finished without {} supplying the credential database", settings.authDatabaseNodeId());
        }
    }

    /**
     * Credential issuance started for a node, if any.
     */
    public Optional<CompletableFuture<NodeCredentials>> credentialsFor(String nodeId) {
        return Optional.ofNullable(credentials.get(nodeId));
    }

    /**
     * The shared database target, once supplied.
     */
    public CompletableFuture<String> databaseTarget() {
        return databaseTarget.copy();
    }

    /**
     * Closes every shared store opened by this coordinator.
     */
    @Override
    public void close() {
        services.clear();
        stores.values().forEach(store -> {
            try {
                store.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close credential store", e);
            }
        });
        stores.clear();
    }

    private boolean isAuthDatabaseNode(String nodeId) {
        return settings.authDatabaseNodeId().equals(nodeId);
    }

    private void supplyDatabaseTarget(NodeType type, String nodeId, NodeConfig config) {
        Optional<String> target = config.effectiveString(NodeConfig.DATABASE_URL);
        if (target.isPresent()) {
            if (databaseTarget.complete(target.get())) {
                log.info("Credential database supplied by {}", nodeId);
            }
        } else if (type.receivesRootCredentials()) {
            databaseTarget.completeExceptionally(new MissingDatabaseTargetException(
                    "Node " + nodeId + " has no " + NodeConfig.DATABASE_URL + " to supply the credential database"));
        }
    }

    private static void injectKeys(NodeType type, NodeConfig config, KeypairMaterial keys) {
        if (type.consumesSigningKeys()) {
            config.putLocal(NodeConfig.CERT_PUBLIC, keys.publicKey());
            config.putLocal(NodeConfig.CERT_PRIVATE, keys.privateKey());
        }
    }

    private CompletableFuture<Void> verifyCredentials(NodeType type, String nodeId, NodeConfig config) {
        if (!type.receivesRootCredentials()) {
            return CompletableFuture.completedFuture(null);
        }
        if (config.providedString(NodeConfig.USER_SECRET).isPresent()) {
            log.debug("Using provided credentials for {}", nodeId);
            return CompletableFuture.completedFuture(null);
        }

        return credentials
                .computeIfAbsent(nodeId, id -> targetFor(id, config)
                        .thenApplyAsync(target -> serviceFor(target).resolve(id), executor))
                .thenAccept(issued -> {
                    config.putLocal(NodeConfig.USER_KEY, issued.userKey());
                    config.putLocal(NodeConfig.USER_SECRET, issued.userSecret());
                });
    }

    private CompletableFuture<String> targetFor(String nodeId, NodeConfig config) {
        if (!isAuthDatabaseNode(nodeId)) {
            Optional<String> own = config.providedString(NodeConfig.DATABASE_URL);
            if (own.isPresent()) {
                return CompletableFuture.completedFuture(own.get());
            }
        }
        if (!databaseTarget.isDone()) {
            log.info("{} waiting for {} to supply the credential database", nodeId, settings.authDatabaseNodeId());
            startTargetTimer();
        }
        return databaseTarget;
    }

    private void startTargetTimer() {
        if (settings.waitsIndefinitely() || !targetTimerStarted.compareAndSet(false, true)) {
            return;
        }
        long timeoutMillis = settings.databaseTargetTimeout().toMillis();
        CompletableFuture.delayedExecutor(timeoutMillis, TimeUnit.MILLISECONDS, executor).execute(() ->
                databaseTarget.completeExceptionally(new MissingDatabaseTargetException(
                        "Node " + settings.authDatabaseNodeId() + " did not supply the credential database within "
                                + settings.databaseTargetTimeout())));
    }

    private NodeCredentialService serviceFor(String target) {
        return services.computeIfAbsent(target, t ->
                new NodeCredentialService(cache, openStore(t), tokens, passwordEncoder));
    }

    private CredentialRecordStore openStore(String target) {
        try {
            return stores.computeIfAbsent(target, storeFactory::open);
        } catch (RuntimeException e) {
            throw new CredentialIssueException("Cannot open the shared credential store", e);
        }
    }
}
