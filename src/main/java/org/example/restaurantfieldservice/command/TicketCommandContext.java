package org.example.restaurantfieldservice.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Value;
import org.example.restaurantfieldservice.lifecycle.TicketAuthorizationPolicy;
import org.example.restaurantfieldservice.lifecycle.TicketLifecycle;
import org.example.restaurantfieldservice.service.TicketService;

import java.time.LocalDateTime;

/**
 * Collaborators handed to each command by {@link TicketCommandExecutor}.
 */
@Value
class TicketCommandContext {

    TicketService ticketService;
    TicketLifecycle lifecycle;
    TicketAuthorizationPolicy authorizationPolicy;
    ObjectMapper objectMapper;
    LocalDateTime now;
}
