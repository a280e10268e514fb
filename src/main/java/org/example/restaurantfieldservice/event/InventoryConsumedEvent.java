package org.example.restaurantfieldservice.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.util.List;

/**
 * Stock was drawn down by a completed intervention.
 */
@Getter
public class InventoryConsumedEvent extends ApplicationEvent {

    private final Long ticketId;
    private final Long interventionId;
    private final List<Long> equipmentIds;

    public InventoryConsumedEvent(Object source, Long ticketId, Long interventionId, List<Long> equipmentIds) {
        super(source);
        this.ticketId = ticketId;
        this.interventionId = interventionId;
        this.equipmentIds = List.copyOf(equipmentIds);
    }
}
