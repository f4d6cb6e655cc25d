package com.keyforge.launcher.config;

import com.keyforge.core.repository.CredentialRecordStoreFactory;
import com.keyforge.core.repository.JdbcCredentialRecordStore;
import com.keyforge.node.bootstrap.BootstrapCoordinator;
import com.keyforge.node.bootstrap.BootstrapSettings;
import com.keyforge.node.credential.CredentialCacheFile;
import com.keyforge.node.credential.SecureTokenGenerator;
import com.keyforge.node.key.SigningKeyManager;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the bootstrap components. One coordinator per process.
 */
@Configuration
public class BootstrapConfig {

    @Bean
    public BootstrapSettings bootstrapSettings(BootstrapProperties properties) {
        return properties.toSettings();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService bootstrapExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "keyforge-bootstrap-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(threads);
    }

    @Bean
    public SigningKeyManager signingKeyManager(
            BootstrapSettings settings,
            @Qualifier("bootstrapExecutor") ExecutorService bootstrapExecutor) {
        return new SigningKeyManager(settings.certDirectory(), bootstrapExecutor);
    }

    @Bean
    public CredentialCacheFile credentialCacheFile(BootstrapSettings settings) {
        return new CredentialCacheFile(settings.certDirectory());
    }

    @Bean
    public PasswordEncoder credentialPasswordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public CredentialRecordStoreFactory credentialRecordStoreFactory() {
        return JdbcCredentialRecordStore::connect;
    }

    @Bean(destroyMethod = "close")
    public BootstrapCoordinator bootstrapCoordinator(
            BootstrapSettings settings,
            SigningKeyManager signingKeyManager,
            CredentialCacheFile credentialCacheFile,
            CredentialRecordStoreFactory credentialRecordStoreFactory,
            PasswordEncoder credentialPasswordEncoder,
            @Qualifier("bootstrapExecutor") ExecutorService bootstrapExecutor) {
        return new BootstrapCoordinator(
                settings,
                signingKeyManager,
                credentialCacheFile,
                credentialRecordStoreFactory,
                new SecureTokenGenerator(),
                credentialPasswordEncoder,
                bootstrapExecutor);
    }
}
