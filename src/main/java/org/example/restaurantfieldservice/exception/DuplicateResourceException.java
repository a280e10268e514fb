package org.example.restaurantfieldservice.exception;

public class DuplicateResourceException extends FieldServiceException {

    private static final String ERROR_CODE = "DUPLICATE_RESOURCE";

    public DuplicateResourceException(String resource, String field, String value) {
        super(resource + " already exists with " + field + ": " + value, ERROR_CODE);
    }
}
