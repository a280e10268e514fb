package org.example.restaurantfieldservice.enums;

/**
 * Kind of row change carried by an entity change event.
 */
public enum ChangeOperation {
    INSERT,
    UPDATE,
    DELETE
}
