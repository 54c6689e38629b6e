package com.simod.discovery.service.api.advice;

import com.simod.discovery.service.api.dto.ApiResponse;
import com.simod.discovery.service.exception.DiscoveryException;
import com.simod.discovery.service.exception.InvalidTransitionException;
import com.simod.discovery.service.exception.JobNotFoundException;
import com.simod.discovery.service.exception.JobNotReadyException;
import com.simod.discovery.service.exception.StorageException;
import com.simod.discovery.service.exception.UnsupportedMediaTypeException;
import com.simod.discovery.service.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Global exception handler for REST controllers.
 *
 * Maps the discovery error codes onto HTTP statuses inside the standard
 * response envelope.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(DiscoveryException.class)
    public ResponseEntity<ApiResponse<Void>> handleDiscoveryException(DiscoveryException ex) {
        HttpStatus status = statusFor(ex);

        if (status.is5xxServerError()) {
            log.error("Discovery request failed: {} [{}]", ex.getMessage(), ex.getErrorCode(), ex);
        } else {
            log.warn("Discovery request rejected: {} [{}]", ex.getMessage(), ex.getErrorCode());
        }

        String details = ex instanceof JobNotReadyException notReady
                ? "status: " + notReady.getStatus()
                : null;
        return ResponseEntity.status(status).body(ApiResponse.error(ex, details));
    }

    static HttpStatus statusFor(DiscoveryException ex) {
        return switch (ex.getErrorCode()) {
            case ValidationException.CODE -> HttpStatus.BAD_REQUEST;
            case UnsupportedMediaTypeException.CODE -> HttpStatus.UNSUPPORTED_MEDIA_TYPE;
            case JobNotFoundException.CODE -> HttpStatus.NOT_FOUND;
            case JobNotReadyException.CODE, InvalidTransitionException.CODE -> HttpStatus.CONFLICT;
            case StorageException.CODE -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    /**
     * Handles a missing multipart part, such as the event log.
     */
    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingPart(MissingServletRequestPartException ex) {
        log.warn("Missing request part: {}", ex.getRequestPartName());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Missing required file '" + ex.getRequestPartName() + "'",
                        ValidationException.CODE));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingParameter(MissingServletRequestParameterException ex) {
        log.warn("Missing request parameter: {}", ex.getParameterName());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Missing required parameter '" + ex.getParameterName() + "'",
                        ValidationException.CODE));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        log.warn("Upload too large: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(ApiResponse.error("Uploaded file is too large", ValidationException.CODE));
    }

    /**
     * Handles requests that are not valid multipart submissions.
     */
    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<ApiResponse<Void>> handleMultipartException(MultipartException ex) {
        log.warn("Invalid multipart request: {}", ex.getMessage());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error("Invalid multipart request", ValidationException.CODE, ex.getMessage()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResourceFoundException(
            NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error("Resource not found", JobNotFoundException.CODE));
    }

    /**
     * Handles all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(
                        "An unexpected error occurred",
                        "INTERNAL_ERROR",
                        ex.getMessage()
                ));
    }
}
