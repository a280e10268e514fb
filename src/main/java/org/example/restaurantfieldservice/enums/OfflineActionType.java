package org.example.restaurantfieldservice.enums;

public enum OfflineActionType {
    CREATE,
    UPDATE,
    DELETE
}
