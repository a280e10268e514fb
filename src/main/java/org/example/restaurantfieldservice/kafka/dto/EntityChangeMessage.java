package org.example.restaurantfieldservice.kafka.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.restaurantfieldservice.enums.ChangeOperation;
import org.example.restaurantfieldservice.event.EntityChangeEvent;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Wire form of a row change on the {@code entity-changes} topic.
 * Keyed by {@code table:rowId} so changes to one row stay ordered on a partition.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityChangeMessage implements Serializable {

    private static final long serialVersionUID = 1L;

    private String eventId;
    private String table;
    private Long rowId;
    private ChangeOperation operation;
    private LocalDateTime occurredAt;

    public static EntityChangeMessage from(EntityChangeEvent event, LocalDateTime occurredAt) {
        return EntityChangeMessage.builder()
                .eventId(UUID.randomUUID().toString())
                .table(event.getTable())
                .rowId(event.getRowId())
                .operation(event.getOperation())
                .occurredAt(occurredAt)
                .build();
    }

    public String messageKey() {
        return table + ":" + rowId;
    }
}
