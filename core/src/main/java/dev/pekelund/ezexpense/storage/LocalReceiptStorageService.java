package dev.pekelund.ezexpense.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Keeps receipt bytes in a local directory. Used when Google Cloud Storage is disabled.
 */
public class LocalReceiptStorageService implements ReceiptStorageService {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalReceiptStorageService.class);

    private final Path directory;

    public LocalReceiptStorageService(LocalStorageProperties properties) {
        this(Paths.get(properties.getDirectory()));
    }

    LocalReceiptStorageService(Path directory) {
        this.directory = directory.toAbsolutePath().normalize();
    }

    @Override
    public StoredReceiptReference store(ReceiptUpload upload) {
        String displayName = StringUtils.hasText(upload.filename()) ? upload.filename() : "file";
        String objectName = ReceiptObjectNames.build(upload.filename());
        try {
            Files.createDirectories(directory);
            Files.write(directory.resolve(objectName), upload.content());
        } catch (IOException ex) {
            throw new ReceiptStorageException("Failed to upload file '%s'".formatted(displayName), ex);
        }
        LOGGER.info("Stored receipt '{}' as {} ({} bytes)", displayName, objectName, upload.size());
        return new StoredReceiptReference(StoredReceiptReference.LOCAL_BUCKET, objectName);
    }

    @Override
    public byte[] load(StoredReceiptReference reference) {
        Path path = resolve(reference);
        try {
            return Files.readAllBytes(path);
        } catch (IOException ex) {
            throw new ReceiptStorageException("Unable to read receipt object " + reference.location(), ex);
        }
    }

    @Override
    public void delete(StoredReceiptReference reference) {
        Path path = resolve(reference);
        try {
            if (!Files.deleteIfExists(path)) {
                LOGGER.debug("Receipt object {} was already gone", reference.location());
            }
        } catch (IOException ex) {
            throw new ReceiptStorageException("Unable to delete receipt object " + reference.location(), ex);
        }
    }

    private Path resolve(StoredReceiptReference reference) {
        if (!reference.isLocal()) {
            throw new ReceiptStorageException("Reference " + reference.location() + " is not held by the local store");
        }
        Path path = directory.resolve(reference.objectName()).normalize();
        if (!path.startsWith(directory)) {
            throw new ReceiptStorageException("Reference " + reference.location() + " points outside the upload directory");
        }
        return path;
    }
}
