package org.example.restaurantfieldservice.lifecycle;

import org.example.restaurantfieldservice.entity.Ticket;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.exception.InvalidTicketOperationException;
import org.example.restaurantfieldservice.exception.TicketNotAssignedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TicketLifecycle")
class TicketLifecycleTest {

    private final TicketLifecycle lifecycle = new TicketLifecycle();

    private Ticket ticket(TicketStatus status, Long assignee) {
        return Ticket.builder().id(1L).ticketNumber("TKT-1").status(status).assignedTo(assignee).build();
    }

    @Nested
    @DisplayName("allowed steps")
    class AllowedSteps {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "NEW, ASSIGNED",
                "ASSIGNED, IN_PROGRESS",
                "ASSIGNED, SCHEDULED",
                "SCHEDULED, IN_PROGRESS",
                "IN_PROGRESS, RESOLVED",
                "RESOLVED, CLOSED"
        })
        void forwardStepsAreAllowed(TicketStatus from, TicketStatus to) {
            assertThat(lifecycle.isAllowed(from, to)).isTrue();
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "ASSIGNED, NEW",
                "IN_PROGRESS, ASSIGNED",
                "RESOLVED, IN_PROGRESS",
                "CLOSED, RESOLVED",
                "NEW, IN_PROGRESS",
                "NEW, RESOLVED",
                "SCHEDULED, RESOLVED"
        })
        void backwardAndSkippingStepsAreRejected(TicketStatus from, TicketStatus to) {
            assertThat(lifecycle.isAllowed(from, to)).isFalse();
        }

        @Test
        @DisplayName("closed is terminal")
        void closedHasNoNextStatus() {
            assertThat(lifecycle.nextStatuses(TicketStatus.CLOSED)).isEmpty();
        }
    }

    @Nested
    @DisplayName("validateTransition")
    class ValidateTransition {

        @Test
        @DisplayName("in-progress without an assignee is rejected as not assigned")
        void inProgressNeedsAssignee() {
            Ticket unassigned = ticket(TicketStatus.NEW, null);

            assertThatThrownBy(() -> lifecycle.validateTransition(unassigned, TicketStatus.IN_PROGRESS, null))
                    .isInstanceOf(TicketNotAssignedException.class)
                    .hasMessageContaining("Ticket not assigned");
            assertThat(unassigned.getStatus()).isEqualTo(TicketStatus.NEW);
        }

        @Test
        @DisplayName("requesting the current status is a no-op")
        void sameStatusIsNoOp() {
            assertThat(lifecycle.validateTransition(ticket(TicketStatus.RESOLVED, 5L), TicketStatus.RESOLVED, "done"))
                    .isFalse();
        }

        @Test
        @DisplayName("moving backwards is an invalid operation")
        void backwardsIsInvalid() {
            assertThatThrownBy(() -> lifecycle.validateTransition(
                    ticket(TicketStatus.RESOLVED, 5L), TicketStatus.IN_PROGRESS, null))
                    .isInstanceOf(InvalidTicketOperationException.class)
                    .hasMessageContaining("Cannot transition from 'resolved' to 'in-progress'");
        }

        @Test
        @DisplayName("resolving needs a resolution text")
        void resolveNeedsResolution() {
            assertThatThrownBy(() -> lifecycle.validateTransition(
                    ticket(TicketStatus.IN_PROGRESS, 5L), TicketStatus.RESOLVED, "  "))
                    .isInstanceOf(InvalidTicketOperationException.class)
                    .hasMessageContaining("Resolution is required");
        }

        @Test
        void validForwardStepReturnsTrue() {
            assertThat(lifecycle.validateTransition(ticket(TicketStatus.ASSIGNED, 5L), TicketStatus.SCHEDULED, null))
                    .isTrue();
        }
    }
}
