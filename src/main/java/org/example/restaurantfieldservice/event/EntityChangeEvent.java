package org.example.restaurantfieldservice.event;

import lombok.Getter;
import org.example.restaurantfieldservice.enums.ChangeOperation;
import org.springframework.context.ApplicationEvent;

/**
 * Row-level change of any table, forwarded to the change stream after commit.
 */
@Getter
public class EntityChangeEvent extends ApplicationEvent {

    private final String table;
    private final Long rowId;
    private final ChangeOperation operation;

    public EntityChangeEvent(Object source, String table, Long rowId, ChangeOperation operation) {
        super(source);
        this.table = table;
        this.rowId = rowId;
        this.operation = operation;
    }

    @Override
    public String toString() {
        return String.format("EntityChangeEvent[%s %s#%d]", operation, table, rowId);
    }
}
