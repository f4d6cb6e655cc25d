package com.keyforge.launcher.loader;

import com.keyforge.launcher.config.BootstrapProperties;
import com.keyforge.launcher.config.BootstrapProperties.NodeDefinition;
import com.keyforge.node.bootstrap.BootstrapCoordinator;
import com.keyforge.node.bootstrap.BootstrapException;
import com.keyforge.node.bootstrap.NodeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Loads the configured nodes: every descriptor is bootstrapped before startup finishes.
 * A failed bootstrap aborts startup, since a node cannot run without its keys or credentials.
 */
@Component
public class NodeLoader implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(NodeLoader.class);

    private final BootstrapProperties properties;
    private final BootstrapCoordinator coordinator;
    private final Map<String, NodeConfig> loaded = Collections.synchronizedMap(new LinkedHashMap<>());

    public NodeLoader(BootstrapProperties properties, BootstrapCoordinator coordinator) {
        this.properties = properties;
        this.coordinator = coordinator;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<NodeDefinition> nodes = properties.nodes();
        log.info("Bootstrapping {} node(s)", nodes.size());

        List<CompletableFuture<Void>> pending = new ArrayList<>();
        for (NodeDefinition node : nodes) {
            NodeConfig config = new NodeConfig(node.local(), node.provided());
            pending.add(coordinator.verify(node.type(), node.id(), config)
                    .thenRun(() -> loaded.put(node.id(), config)));
        }
        coordinator.loadingComplete();

        try {
            CompletableFuture.allOf(pending.toArray(CompletableFuture[]::new)).join();
        } catch (CompletionException e) {
            throw new BootstrapException("Node bootstrap failed: " + e.getCause().getMessage(), e.getCause());
        }
        log.info("All {} node(s) bootstrapped", loaded.size());
    }

    /**
     * Configurations of the nodes bootstrapped so far, by node ID.
     */
    public Map<String, NodeConfig> loadedNodes() {
        synchronized (loaded) {
            return Map.copyOf(loaded);
        }
    }
}
