package dev.pekelund.ezexpense.web;

import dev.pekelund.ezexpense.reconciliation.ExpenseNotFoundException;
import dev.pekelund.ezexpense.reconciliation.MatchingServiceException;
import dev.pekelund.ezexpense.reconciliation.ReceiptNotFoundException;
import dev.pekelund.ezexpense.storage.ReceiptStorageException;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@RestControllerAdvice
public class ReconciliationExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconciliationExceptionHandler.class);

    @ExceptionHandler({ExpenseNotFoundException.class, ReceiptNotFoundException.class})
    public ResponseEntity<ApiError> handleNotFound(RuntimeException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ApiError("not_found", ex.getMessage()));
    }

    @ExceptionHandler(MatchingServiceException.class)
    public ResponseEntity<ApiError> handleMatchingFailure(MatchingServiceException ex) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body(new ApiError("matching_failed", ex.getMessage() + ". Nothing was changed, please retry."));
    }

    @ExceptionHandler(ReceiptStorageException.class)
    public ResponseEntity<ApiError> handleStorageFailure(ReceiptStorageException ex) {
        LOGGER.error("Receipt storage failed", ex);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(new ApiError("storage_failed", ex.getMessage()));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiError> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
            .body(new ApiError("upload_rejected", "Upload exceeds the maximum allowed size"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .findFirst()
            .orElse("Request body is invalid");
        return ResponseEntity.badRequest().body(new ApiError("bad_request", message));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
        MissingServletRequestPartException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleMalformedRequest(Exception ex) {
        return ResponseEntity.badRequest().body(new ApiError("bad_request", ex.getMessage()));
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ApiError> handleUnreadableUpload(IOException ex) {
        LOGGER.warn("Unable to read uploaded file", ex);
        return ResponseEntity.badRequest().body(new ApiError("bad_request", "Uploaded file could not be read"));
    }
}
