package com.phillippitts.peercall.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the key-value store backing the missed-call ledger and identity.
 */
@Validated
@ConfigurationProperties(prefix = "store")
public class StoreProperties {

    public enum StoreType { MEMORY, FILE }

    @NotNull
    private StoreType type = StoreType.MEMORY;

    /** JSON file used when {@code type=FILE}. */
    private String path = "./data/peer-call-store.json";

    public StoreType getType() {
        return type;
    }

    public void setType(StoreType type) {
        this.type = type;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }
}
