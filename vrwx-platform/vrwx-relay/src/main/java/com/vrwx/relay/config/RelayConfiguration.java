package com.vrwx.relay.config;

import com.vrwx.services.module.ServiceModuleRegistry;
import com.vrwx.services.proof.ProofVerifier;
import com.vrwx.services.storage.InMemoryManifestStorage;
import com.vrwx.services.storage.LocalManifestStorage;
import com.vrwx.services.storage.ManifestStorage;
import com.vrwx.services.storage.ManifestStorageException;
import com.vrwx.services.storage.ManifestStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Scoring and storage beans used by the relayer. The services module has no Spring dependency,
 * so its components are wired here.
 */
@Configuration
@EnableConfigurationProperties({RelayProperties.class, StorageProperties.class})
public class RelayConfiguration {

    @Bean
    public ServiceModuleRegistry serviceModuleRegistry(Clock clock) {
        return new ServiceModuleRegistry(clock);
    }

    @Bean
    public ProofVerifier proofVerifier(ServiceModuleRegistry registry) {
        return new ProofVerifier(registry);
    }

    @Bean
    public ManifestStorage manifestStorage(StorageProperties properties) {
        return switch (properties.getProvider()) {
            case MEMORY -> new InMemoryManifestStorage(properties.getBaseUrl());
            case LOCAL -> localStorage(properties);
        };
    }

    @Bean
    public ManifestStore manifestStore(ManifestStorage manifestStorage, StorageProperties properties) {
        return new ManifestStore(manifestStorage, properties.isStrict());
    }

    private static ManifestStorage localStorage(StorageProperties properties) {
        try {
            return new LocalManifestStorage(Path.of(properties.getDataDir()), properties.getBaseUrl());
        } catch (ManifestStorageException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }
}
