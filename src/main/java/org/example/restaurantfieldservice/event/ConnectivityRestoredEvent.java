package org.example.restaurantfieldservice.event;

import org.springframework.context.ApplicationEvent;

/**
 * The database became reachable again after a connectivity failure.
 */
public class ConnectivityRestoredEvent extends ApplicationEvent {

    public ConnectivityRestoredEvent(Object source) {
        super(source);
    }
}
