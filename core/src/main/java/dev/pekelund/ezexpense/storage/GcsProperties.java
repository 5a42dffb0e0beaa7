package dev.pekelund.ezexpense.storage;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gcs")
public class GcsProperties {

    /**
     * Flag indicating whether receipt bytes are stored in Google Cloud Storage. When disabled the
     * local temporary-directory store is used instead.
     */
    private boolean enabled;

    /**
     * Optional path or resource string that resolves to the service account credentials file.
     * When omitted, application default credentials will be used.
     */
    private String credentials;

    /**
     * Optional Google Cloud project identifier used when building the storage client.
     */
    private String projectId;

    /**
     * Name of the Google Cloud Storage bucket that stores receipt uploads.
     */
    private String bucket;

    /**
     * Prefix prepended to every receipt object name.
     */
    private String objectPrefix = "receipts/";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getCredentials() {
        return credentials;
    }

    public void setCredentials(String credentials) {
        this.credentials = credentials;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public String getBucket() {
        return bucket;
    }

    public void setBucket(String bucket) {
        this.bucket = bucket;
    }

    public String getObjectPrefix() {
        return objectPrefix;
    }

    public void setObjectPrefix(String objectPrefix) {
        this.objectPrefix = objectPrefix;
    }
}
