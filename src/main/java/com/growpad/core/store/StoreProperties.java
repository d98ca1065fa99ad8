package com.growpad.core.store;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Location of the filesystem store.
 */
@Component
@ConfigurationProperties(prefix = "growpad.store")
public class StoreProperties {

    private String dataDir = "./data";

    public String getDataDir() { return dataDir; }
    public void setDataDir(String dataDir) { this.dataDir = dataDir; }
}
