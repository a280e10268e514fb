package org.example.restaurantfieldservice.exception;

public class PermissionDeniedException extends FieldServiceException {

    private static final String ERROR_CODE = "PERMISSION_DENIED";

    public PermissionDeniedException(String message) {
        super(message, ERROR_CODE);
    }
}
