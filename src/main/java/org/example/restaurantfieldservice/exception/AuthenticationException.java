package org.example.restaurantfieldservice.exception;

/**
 * Missing, expired or revoked credentials.
 */
public class AuthenticationException extends FieldServiceException {

    private static final String ERROR_CODE = "AUTHENTICATION_FAILED";

    public AuthenticationException(String message) {
        super(message, ERROR_CODE);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, ERROR_CODE, cause);
    }
}
