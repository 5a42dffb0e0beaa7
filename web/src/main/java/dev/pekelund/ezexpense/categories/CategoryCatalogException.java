package dev.pekelund.ezexpense.categories;

public class CategoryCatalogException extends RuntimeException {

    public CategoryCatalogException(String message) {
        super(message);
    }

    public CategoryCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
