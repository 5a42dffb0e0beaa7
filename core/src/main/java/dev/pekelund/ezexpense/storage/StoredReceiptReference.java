package dev.pekelund.ezexpense.storage;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Objects;

/**
 * Stable reference to uploaded receipt bytes. Used for every later scoring, move and retrieval
 * of the receipt, so a receipt that already carries a reference is never uploaded again.
 */
public record StoredReceiptReference(String bucket, String objectName) {

    public static final String LOCAL_BUCKET = "local";

    public StoredReceiptReference {
        Objects.requireNonNull(bucket, "bucket");
        Objects.requireNonNull(objectName, "objectName");
    }

    @JsonIgnore
    public boolean isLocal() {
        return LOCAL_BUCKET.equals(bucket);
    }

    public String location() {
        return isLocal() ? "local:" + objectName : "gs://" + bucket + "/" + objectName;
    }
}
