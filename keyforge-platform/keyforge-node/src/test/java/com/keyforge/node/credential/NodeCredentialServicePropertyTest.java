package com.keyforge.node.credential;

import com.keyforge.core.repository.InMemoryCredentialRecordStore;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for node credential issuance.
 */
class NodeCredentialServicePropertyTest {

    @Property(tries = 20)
    void everyNodeGetsOneStableCredential(@ForAll @Size(min = 1, max = 6) Set<@From("nodeIds") String> nodeIds) throws IOException {
        Path dir = Files.createTempDirectory("keyforge-credentials");
        InMemoryCredentialRecordStore store = new InMemoryCredentialRecordStore();
        NodeCredentialService service = new NodeCredentialService(
                new CredentialCacheFile(dir), store, new SecureTokenGenerator(), new BCryptPasswordEncoder(4));

        Map<String, NodeCredentials> first = new HashMap<>();
        for (String id : nodeIds) {
            first.put(id, service.resolve(id));
        }
        for (String id : nodeIds) {
            assertThat(service.resolve(id)).isEqualTo(first.get(id));
        }

        assertThat(store.count()).isEqualTo(nodeIds.size());
        assertThat(store.getInsertCount()).isEqualTo(nodeIds.size());
        Set<String> keys = first.values().stream().map(NodeCredentials::userKey).collect(Collectors.toSet());
        assertThat(keys).hasSize(nodeIds.size());
    }

    @Property(tries = 50)
    void tokensAreUrlSafeUniqueAndCarry256Bits(@ForAll @IntRange(min = 2, max = 32) int count) {
        SecureTokenGenerator generator = new SecureTokenGenerator();

        Set<String> tokens = IntStream.range(0, count)
                .mapToObj(i -> generator.nextToken())
                .collect(Collectors.toSet());

        assertThat(tokens).hasSize(count);
        assertThat(tokens).allSatisfy(token -> assertThat(token).hasSize(43).matches("[A-Za-z0-9_-]+"));
    }

    @Provide
    Arbitrary<String> nodeIds() {
        return Arbitraries.strings().withCharRange('a', 'z').ofMinLength(3).ofMaxLength(12)
                .map(s -> s + "_core");
    }
}
