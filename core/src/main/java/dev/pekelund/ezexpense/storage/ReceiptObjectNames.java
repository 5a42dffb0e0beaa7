package dev.pekelund.ezexpense.storage;

import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.UUID;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriUtils;

/**
 * Builds collision-free object names for stored receipts. Two uploads with the same file name get
 * distinct objects, so superseding a receipt never overwrites bytes another reference points at.
 */
final class ReceiptObjectNames {

    private static final DateTimeFormatter OBJECT_PREFIX =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS", Locale.US).withZone(ZoneOffset.UTC);
    private static final int MAX_OBJECT_FILENAME_LENGTH = 60;

    private ReceiptObjectNames() {
    }

    static String build(String originalFilename) {
        String filename = StringUtils.hasText(originalFilename) ? originalFilename : "receipt";
        filename = extractFilename(filename);
        filename = shortenFilename(filename, MAX_OBJECT_FILENAME_LENGTH);
        filename = encodeFilename(filename);
        if (!StringUtils.hasText(filename)) {
            filename = "receipt";
        }
        String prefix = OBJECT_PREFIX.format(Instant.now());
        String suffix = UUID.randomUUID().toString().substring(0, 6);
        return prefix + "_" + suffix + "_" + filename;
    }

    static String sha256(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashBytes = digest.digest(content);
            StringBuilder hexString = new StringBuilder(2 * hashBytes.length);
            for (byte b : hashBytes) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException ex) {
            throw new ReceiptStorageException("SHA-256 algorithm not available", ex);
        }
    }

    private static String extractFilename(String filename) {
        try {
            Path path = Paths.get(filename);
            Path fileName = path.getFileName();
            if (fileName != null) {
                return fileName.toString();
            }
        } catch (InvalidPathException ex) {
            // Fall back to manual parsing below when the path contains invalid characters.
        }
        int separatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        if (separatorIndex >= 0 && separatorIndex < filename.length() - 1) {
            return filename.substring(separatorIndex + 1);
        }
        return filename;
    }

    private static String encodeFilename(String filename) {
        if (!StringUtils.hasText(filename)) {
            return filename;
        }
        return UriUtils.encodePathSegment(filename, StandardCharsets.UTF_8);
    }

    private static String shortenFilename(String filename, int maxLength) {
        if (!StringUtils.hasText(filename) || filename.length() <= maxLength) {
            return filename;
        }

        int extensionIndex = filename.lastIndexOf('.');
        if (extensionIndex > 0 && extensionIndex < filename.length() - 1) {
            String baseName = filename.substring(0, extensionIndex);
            String extension = filename.substring(extensionIndex);
            int allowedBaseLength = Math.max(1, maxLength - extension.length() - 1);
            if (baseName.length() > allowedBaseLength) {
                baseName = baseName.substring(0, allowedBaseLength);
            }
            return baseName + "-" + extension;
        }

        int safeLength = Math.max(1, maxLength - 1);
        return filename.substring(0, safeLength) + "-";
    }
}
