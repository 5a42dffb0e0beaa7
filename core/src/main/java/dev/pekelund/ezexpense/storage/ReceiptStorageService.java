package dev.pekelund.ezexpense.storage;

public interface ReceiptStorageService {

    /**
     * Persist the bytes of one receipt.
     * @return reference used for all later access to the stored bytes
     * @throws ReceiptStorageException when the backend rejects the file
     */
    StoredReceiptReference store(ReceiptUpload upload);

    byte[] load(StoredReceiptReference reference);

    void delete(StoredReceiptReference reference);
}
