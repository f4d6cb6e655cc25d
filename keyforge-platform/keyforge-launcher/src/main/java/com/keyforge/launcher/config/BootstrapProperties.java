package com.keyforge.launcher.config;

import com.keyforge.node.bootstrap.BootstrapSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Bootstrap configuration bound from {@code keyforge.bootstrap.*}.
 *
 * @param certDirectory directory for signing keys and the credential cache
 * @param authDatabaseNodeId node that supplies the credential database
 * @param databaseTargetTimeout how long core nodes wait for that node; 0 waits forever
 * @param nodes nodes to bootstrap, in load order
 */
@ConfigurationProperties(prefix = "keyforge.bootstrap")
public record BootstrapProperties(
        @DefaultValue("config/certs") Path certDirectory,
        @DefaultValue(BootstrapSettings.DEFAULT_AUTH_DATABASE_NODE_ID) String authDatabaseNodeId,
        @DefaultValue("60s") Duration databaseTargetTimeout,
        List<NodeDefinition> nodes
) {

    public BootstrapProperties {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
    }

    public BootstrapSettings toSettings() {
        return new BootstrapSettings(certDirectory.toAbsolutePath(), authDatabaseNodeId, databaseTargetTimeout);
    }

    /**
     * One node descriptor as handed to the loader.
     *
     * @param type node type name, e.g. {@code core}
     * @param id node identifier
     * @param provided operator overrides
     * @param local node defaults
     */
    public record NodeDefinition(
            String type,
            String id,
            Map<String, String> provided,
            Map<String, String> local
    ) {
        public NodeDefinition {
            provided = provided != null ? Map.copyOf(provided) : Map.of();
            local = local != null ? Map.copyOf(local) : Map.of();
        }
    }
}
