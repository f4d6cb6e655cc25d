package com.keyforge.node.credential;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Local plaintext mirror of issued node credentials ({@code credentials.json}).
 * <p>
 * The file is one JSON object mapping node ID to {@code {userKey, userSecret}}. Entries are read one by one:
 * extra fields are ignored, and an entry without a usable key and secret counts as missing for its node only.
 * Every update rewrites the whole document through a temporary file and an atomic move, so a crash never
 * leaves a half-written cache behind. Entries this class does not understand are written back unchanged.
 * Updates are serialized per instance; share one instance per file.
 */
public class CredentialCacheFile {

    private static final Logger log = LoggerFactory.getLogger(CredentialCacheFile.class);

    public static final String FILE_NAME = "credentials.json";

    private final Path file;
    private final ObjectMapper objectMapper;

    public CredentialCacheFile(Path certDirectory) {
        this(certDirectory, new ObjectMapper());
    }

    public CredentialCacheFile(Path certDirectory, ObjectMapper objectMapper) {
        if (certDirectory == null) {
            throw new IllegalArgumentException("Certificate directory cannot be null");
        }
        this.file = certDirectory.resolve(FILE_NAME);
        this.objectMapper = (objectMapper != null ? objectMapper : new ObjectMapper()).copy()
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Reads every usable entry. A missing or unparseable file reads as empty.
     */
    public Map<String, NodeCredentials> read() {
        Map<String, NodeCredentials> mapping = new LinkedHashMap<>();
        ObjectNode document = readDocument();
        Iterator<Map.Entry<String, JsonNode>> entries = document.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            toCredentials(entry.getKey(), entry.getValue()).ifPresent(c -> mapping.put(entry.getKey(), c));
        }
        return mapping;
    }

    public Optional<NodeCredentials> find(String nodeId) {
        return toCredentials(nodeId, readDocument().get(nodeId));
    }

    /**
     * Returns the cached credentials for a node, or creates, stores and returns new ones.
     * The creator runs only on a cache miss; if it throws, the file is left untouched.
     *
     * @param nodeId node identifier
     * @param creator issues credentials for a node missing from the cache
     * @return the cached or newly created credentials
     */
    public synchronized NodeCredentials computeIfAbsent(String nodeId, Function<String, NodeCredentials> creator) {
        ObjectNode document = readDocument();
        Optional<NodeCredentials> cached = toCredentials(nodeId, document.get(nodeId));
        if (cached.isPresent()) {
            log.debug("Found cached credentials for {}", nodeId);
            return cached.get();
        }

        NodeCredentials created = creator.apply(nodeId);
        document.set(nodeId, objectMapper.valueToTree(created));
        writeDocument(document);
        return created;
    }

    /**
     * Replaces the file with the given mapping.
     */
    public synchronized void write(Map<String, NodeCredentials> mapping) {
        writeDocument(objectMapper.valueToTree(mapping));
    }

    public Path getFile() {
        return file;
    }

    private ObjectNode readDocument() {
        try (InputStream in = Files.newInputStream(file)) {
            JsonNode root = objectMapper.readTree(in);
            if (root instanceof ObjectNode) {
                return (ObjectNode) root;
            }
            if (root != null && !root.isMissingNode()) {
                log.warn("Ignoring credential cache {}: not a JSON object", file);
            }
        } catch (NoSuchFileException e) {
            log.debug("No credential cache at {}", file);
        } catch (IOException e) {
            log.warn("Ignoring unreadable credential cache {}: {}", file, e.getMessage());
        }
        return objectMapper.createObjectNode();
    }

    private Optional<NodeCredentials> toCredentials(String nodeId, JsonNode entry) {
        if (entry == null || entry.isNull()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.treeToValue(entry, NodeCredentials.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Ignoring unusable cached credentials for {}: {}", nodeId, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeDocument(JsonNode document) {
        try {
            Files.createDirectories(file.getParent());
            Path temp = Files.createTempFile(file.getParent(), FILE_NAME, ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), document);
                restrictToOwner(temp);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new CredentialIssueException("Failed to write credential cache " + file, e);
        }
    }

    private static void restrictToOwner(Path path) throws IOException {
        if (path.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rw-------"));
        }
    }
}
