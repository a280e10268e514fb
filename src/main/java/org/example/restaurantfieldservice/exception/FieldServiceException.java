package org.example.restaurantfieldservice.exception;

/**
 * Base exception for all field-service business errors.
 * Carries a machine-readable error code next to the message.
 */
public abstract class FieldServiceException extends RuntimeException {

    private final String errorCode;

    protected FieldServiceException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    protected FieldServiceException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
