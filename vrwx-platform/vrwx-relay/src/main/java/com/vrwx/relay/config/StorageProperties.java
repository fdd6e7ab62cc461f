package com.vrwx.relay.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Manifest storage backend selection.
 */
@Validated
@ConfigurationProperties(prefix = "vrwx.storage")
public class StorageProperties {

    public enum Provider { LOCAL, MEMORY }

    @NotNull
    private Provider provider = Provider.LOCAL;

    private boolean strict = false;

    @NotBlank
    private String dataDir = "./data/manifests";

    @NotBlank
    private String baseUrl = "/manifests";

    public Provider getProvider() { return provider; }
    public void setProvider(Provider provider) { this.provider = provider; }
    public boolean isStrict() { return strict; }
    public void setStrict(boolean strict) { this.strict = strict; }
    public String getDataDir() { return dataDir; }
    public void setDataDir(String dataDir) { this.dataDir = dataDir; }
    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
}
