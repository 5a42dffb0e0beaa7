package dev.pekelund.ezexpense.storage;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storage.local")
public class LocalStorageProperties {

    /**
     * Directory receiving uploads when Google Cloud Storage is disabled. Defaults to a folder in the
     * system temporary directory.
     */
    private String directory = System.getProperty("java.io.tmpdir") + "/ez-expense-uploads";

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }
}
