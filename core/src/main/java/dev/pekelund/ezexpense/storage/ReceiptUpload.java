package dev.pekelund.ezexpense.storage;

/**
 * Raw bytes of one uploaded receipt file together with the name and content type the client sent.
 */
public record ReceiptUpload(String filename, String contentType, byte[] content) {

    public ReceiptUpload {
        content = content != null ? content : new byte[0];
    }

    public long size() {
        return content.length;
    }

    public boolean isEmpty() {
        return content.length == 0;
    }

    @Override
    public String toString() {
        return "ReceiptUpload[filename=" + filename + ", contentType=" + contentType + ", size=" + content.length + "]";
    }
}
