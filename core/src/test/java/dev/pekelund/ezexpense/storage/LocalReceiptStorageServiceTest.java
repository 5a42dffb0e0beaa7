package dev.pekelund.ezexpense.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalReceiptStorageServiceTest {

    @TempDir
    Path directory;

    @Test
    void storesLoadsAndDeletes() {
        LocalReceiptStorageService service = new LocalReceiptStorageService(directory);

        StoredReceiptReference reference = service.store(new ReceiptUpload("a.png", "image/png", new byte[] {4, 2}));

        assertThat(reference.isLocal()).isTrue();
        assertThat(reference.location()).startsWith("local:");
        assertThat(Files.exists(directory.resolve(reference.objectName()))).isTrue();
        assertThat(service.load(reference)).containsExactly(4, 2);

        service.delete(reference);

        assertThat(Files.exists(directory.resolve(reference.objectName()))).isFalse();
    }

    @Test
    void deletingTwiceIsHarmless() {
        LocalReceiptStorageService service = new LocalReceiptStorageService(directory);
        StoredReceiptReference reference = service.store(new ReceiptUpload("a.png", "image/png", new byte[] {1}));

        service.delete(reference);
        service.delete(reference);

        assertThat(directory).isEmptyDirectory();
    }

    @Test
    void rejectsReferencesOutsideTheDirectory() {
        LocalReceiptStorageService service = new LocalReceiptStorageService(directory);

        assertThatThrownBy(() -> service.load(new StoredReceiptReference(StoredReceiptReference.LOCAL_BUCKET,
            "../escape.pdf")))
            .isInstanceOf(ReceiptStorageException.class)
            .hasMessageContaining("outside");
        assertThatThrownBy(() -> service.load(new StoredReceiptReference("bucket", "x.pdf")))
            .isInstanceOf(ReceiptStorageException.class);
    }
}
