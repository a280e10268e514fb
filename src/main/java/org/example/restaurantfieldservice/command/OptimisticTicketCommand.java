package org.example.restaurantfieldservice.command;

import org.example.restaurantfieldservice.dto.TicketDTO;
import org.example.restaurantfieldservice.offline.OfflineAction;

import java.util.List;

/**
 * A ticket mutation that can be shown before the database confirms it.
 *
 * <p>{@link TicketCommandExecutor} applies {@link #applyLocally} to the cached
 * view, then runs {@link #executeRemote}. On failure the cached view is replaced
 * by a fresh fetch; on a connectivity failure the command may instead be queued
 * through {@link #toOfflineActions}.</p>
 */
public interface OptimisticTicketCommand {

    Long ticketId();

    String description();

    /**
     * Projection of {@code current} after this change, or {@code null} when the
     * change cannot be shown locally (invalid, not permitted, or a no-op).
     */
    TicketDTO applyLocally(TicketDTO current);

    /**
     * Runs the change against the database and returns the committed view.
     */
    TicketDTO executeRemote();

    /**
     * Writes to replay later. An empty list means the command cannot be queued.
     */
    List<OfflineAction> toOfflineActions(TicketDTO optimistic);
}
