package dev.pekelund.ezexpense.storage;

import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

public class GcsReceiptStorageService implements ReceiptStorageService {

    private static final Logger LOGGER = LoggerFactory.getLogger(GcsReceiptStorageService.class);

    static final String CONTENT_HASH_METADATA_KEY = "content-sha256";
    static final String ORIGINAL_NAME_METADATA_KEY = "receipt.original-name";

    private final Storage storage;
    private final GcsProperties properties;

    public GcsReceiptStorageService(Storage storage, GcsProperties properties) {
        this.storage = storage;
        this.properties = properties;
        Assert.isTrue(StringUtils.hasText(properties.getBucket()),
            "gcs.bucket must be configured when Google Cloud Storage is enabled");
    }

    @Override
    public StoredReceiptReference store(ReceiptUpload upload) {
        String displayName = StringUtils.hasText(upload.filename()) ? upload.filename() : "file";
        String objectName = objectPrefix() + ReceiptObjectNames.build(upload.filename());

        Map<String, String> metadata = new HashMap<>();
        metadata.put(CONTENT_HASH_METADATA_KEY, ReceiptObjectNames.sha256(upload.content()));
        if (StringUtils.hasText(upload.filename())) {
            metadata.put(ORIGINAL_NAME_METADATA_KEY, upload.filename());
        }

        BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(properties.getBucket(), objectName))
            .setContentType(upload.contentType())
            .setMetadata(metadata)
            .build();

        try {
            storage.create(blobInfo, upload.content());
        } catch (StorageException ex) {
            throw new ReceiptStorageException("Failed to upload file '%s'".formatted(displayName), ex);
        }
        LOGGER.info("Stored receipt '{}' as gs://{}/{} ({} bytes)", displayName, properties.getBucket(), objectName,
            upload.size());
        return new StoredReceiptReference(properties.getBucket(), objectName);
    }

    @Override
    public byte[] load(StoredReceiptReference reference) {
        try {
            Blob blob = storage.get(BlobId.of(reference.bucket(), reference.objectName()));
            if (blob == null) {
                throw new ReceiptStorageException("Receipt object %s does not exist".formatted(reference.location()));
            }
            return blob.getContent();
        } catch (StorageException ex) {
            throw new ReceiptStorageException("Unable to read receipt object " + reference.location(), ex);
        }
    }

    @Override
    public void delete(StoredReceiptReference reference) {
        try {
            boolean deleted = storage.delete(BlobId.of(reference.bucket(), reference.objectName()));
            if (!deleted) {
                LOGGER.debug("Receipt object {} was already gone", reference.location());
            }
        } catch (StorageException ex) {
            throw new ReceiptStorageException("Unable to delete receipt object " + reference.location(), ex);
        }
    }

    private String objectPrefix() {
        String prefix = properties.getObjectPrefix();
        if (!StringUtils.hasText(prefix)) {
            return "";
        }
        return prefix.endsWith("/") ? prefix : prefix + "/";
    }
}
