package org.example.restaurantfieldservice.exception;

/**
 * Thrown when a row looked up by id or business key does not exist.
 */
public class ResourceNotFoundException extends FieldServiceException {

    private static final String ERROR_CODE = "RESOURCE_NOT_FOUND";

    public ResourceNotFoundException(String resource, Long id) {
        super(resource + " not found with id: " + id, ERROR_CODE);
    }

    public ResourceNotFoundException(String resource, String field, String value) {
        super(resource + " not found with " + field + ": " + value, ERROR_CODE);
    }
}
