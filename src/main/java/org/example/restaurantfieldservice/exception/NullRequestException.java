package org.example.restaurantfieldservice.exception;

import lombok.Getter;

/**
 * Thrown when a required request body or field is null or missing.
 */
@Getter
public class NullRequestException extends FieldServiceException {

    private static final String ERROR_CODE = "NULL_REQUEST";

    /**
     * The field name that was null.
     */
    private final String field;

    public NullRequestException(String field) {
        super(String.format("%s request cannot be null or empty", field), ERROR_CODE);
        this.field = field;
    }

    public NullRequestException(String field, String message) {
        super(message, ERROR_CODE);
        this.field = field;
    }
}
