package com.keyforge.node.key;

import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Owns the cluster-wide signing keypair.
 * <p>
 * The keypair is read from {@code auth.public.pem} / {@code auth.private.pem} in the certificate
 * directory. When either file is missing or unreadable, a new RSA keypair is generated and written
 * there together with a {@code .gitignore} so the directory is never committed. Operators can swap
 * keys by replacing the two files before startup.
 */
public class SigningKeyManager {

    private static final Logger log = LoggerFactory.getLogger(SigningKeyManager.class);

    public static final String PUBLIC_KEY_FILE = "auth.public.pem";
    public static final String PRIVATE_KEY_FILE = "auth.private.pem";
    public static final String IGNORE_FILE = ".gitignore";

    private static final String KEY_ALGORITHM = "RSA";
    private static final int KEY_SIZE = 2048;

    private final Path certDirectory;
    private final Executor executor;

    private CompletableFuture<KeypairMaterial> ready;

    /**
     * @param certDirectory directory holding the PEM files
     * @param executor executor running the load or generation
     */
    public SigningKeyManager(Path certDirectory, Executor executor) {
        if (certDirectory == null) {
            throw new IllegalArgumentException("Certificate directory cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("Executor cannot be null");
        }
        this.certDirectory = certDirectory;
        this.executor = executor;
    }

    /**
     * Readiness signal for the keypair. The first call starts loading or generating the keys;
     * every call returns the same future, which completes once the material is in memory.
     *
     * @return future completing with the keypair, or exceptionally with {@link KeyManagementException}
     */
    public synchronized CompletableFuture<KeypairMaterial> ready() {
        if (ready == null) {
            ready = CompletableFuture.supplyAsync(this::loadOrGenerate, executor);
        }
        return ready;
    }

    private KeypairMaterial loadOrGenerate() {
        try {
            String privateKey = Files.readString(certDirectory.resolve(PRIVATE_KEY_FILE), StandardCharsets.UTF_8);
            String publicKey = Files.readString(certDirectory.resolve(PUBLIC_KEY_FILE), StandardCharsets.UTF_8);
            log.info("Loaded signing keys from {}", certDirectory);
            return new KeypairMaterial(publicKey, privateKey);
        } catch (IOException | IllegalArgumentException e) {
            log.info("No usable signing keys in {} - generating", certDirectory);
        }

        KeypairMaterial material = toPem(generateKeyPair());
        persist(material);
        return material;
    }

    private KeyPair generateKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance(KEY_ALGORITHM);
            generator.initialize(KEY_SIZE, new SecureRandom());
            return generator.generateKeyPair();
        } catch (NoSuchAlgorithmException e) {
            throw new KeyManagementException("Failed to generate RSA keypair", e);
        }
    }

    private static KeypairMaterial toPem(KeyPair keyPair) {
        return new KeypairMaterial(writePem(keyPair.getPublic()), writePem(keyPair.getPrivate()));
    }

    private static String writePem(Object key) {
        StringWriter out = new StringWriter();
        try (JcaPEMWriter writer = new JcaPEMWriter(out)) {
            writer.writeObject(key);
        } catch (IOException e) {
            throw new KeyManagementException("Failed to encode key as PEM", e);
        }
        return out.toString();
    }

    private void persist(KeypairMaterial material) {
        try {
            Files.createDirectories(certDirectory);
            Files.writeString(certDirectory.resolve(PUBLIC_KEY_FILE), material.publicKey(), StandardCharsets.UTF_8);
            Path privateKeyFile = certDirectory.resolve(PRIVATE_KEY_FILE);
            Files.writeString(privateKeyFile, material.privateKey(), StandardCharsets.UTF_8);
            restrictToOwner(privateKeyFile);
            Files.writeString(certDirectory.resolve(IGNORE_FILE), "*.*", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new KeyManagementException("Failed to persist signing keys to " + certDirectory, e);
        }
        log.info("Generated new signing keys in {}", certDirectory);
    }

    /**
     * Limits a file to owner read/write where the file system supports POSIX permissions.
     */
    private static void restrictToOwner(Path file) throws IOException {
        if (file.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        }
    }
}
