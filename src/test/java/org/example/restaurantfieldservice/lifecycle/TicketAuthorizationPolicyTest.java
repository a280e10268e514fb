package org.example.restaurantfieldservice.lifecycle;

import org.example.restaurantfieldservice.entity.Ticket;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.enums.UserRole;
import org.example.restaurantfieldservice.exception.PermissionDeniedException;
import org.example.restaurantfieldservice.session.SessionContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TicketAuthorizationPolicy")
class TicketAuthorizationPolicyTest {

    private final TicketAuthorizationPolicy policy = new TicketAuthorizationPolicy(new TicketLifecycle());

    private final SessionContext technician = session(7L, UserRole.TECHNICIAN);
    private final SessionContext otherTechnician = session(8L, UserRole.TECHNICIAN);
    private final SessionContext admin = session(1L, UserRole.ADMIN);

    private static SessionContext session(Long id, UserRole role) {
        return SessionContext.builder().userId(id).name("User " + id).email(id + "@test").role(role).build();
    }

    private static Ticket ticket(TicketStatus status, Long assignee) {
        return Ticket.builder().id(10L).ticketNumber("TKT-10").status(status).assignedTo(assignee).build();
    }

    @Nested
    @DisplayName("from new")
    class FromNew {

        @Test
        void technicianMayAssignThemselves() {
            assertThat(policy.canTransition(technician, ticket(TicketStatus.NEW, null), TicketStatus.ASSIGNED, 7L))
                    .isTrue();
        }

        @Test
        void technicianMayNotAssignSomeoneElse() {
            assertThat(policy.canTransition(technician, ticket(TicketStatus.NEW, null), TicketStatus.ASSIGNED, 8L))
                    .isFalse();
        }

        @Test
        void adminMayAssignAnyone() {
            assertThat(policy.canTransition(admin, ticket(TicketStatus.NEW, null), TicketStatus.ASSIGNED, 8L))
                    .isTrue();
        }
    }

    @Nested
    @DisplayName("after assignment")
    class AfterAssignment {

        @Test
        void assigneeMayStartWork() {
            assertThat(policy.canTransition(technician, ticket(TicketStatus.ASSIGNED, 7L), TicketStatus.IN_PROGRESS))
                    .isTrue();
        }

        @Test
        void otherTechnicianIsRefused() {
            Ticket ticket = ticket(TicketStatus.IN_PROGRESS, 7L);

            assertThat(policy.canTransition(otherTechnician, ticket, TicketStatus.RESOLVED)).isFalse();
            assertThatThrownBy(() -> policy.requireTransition(otherTechnician, ticket, TicketStatus.RESOLVED, 7L))
                    .isInstanceOf(PermissionDeniedException.class)
                    .hasMessageContaining("TKT-10");
        }

        @Test
        void anonymousCallerIsRefused() {
            assertThat(policy.canTransition(null, ticket(TicketStatus.ASSIGNED, 7L), TicketStatus.IN_PROGRESS))
                    .isFalse();
        }
    }

    @Nested
    @DisplayName("allowedTargets")
    class AllowedTargets {

        @Test
        void newTicketOffersSelfAssignment() {
            assertThat(policy.allowedTargets(technician, ticket(TicketStatus.NEW, null)))
                    .containsExactly(TicketStatus.ASSIGNED);
        }

        @Test
        void assigneeSeesBothNextSteps() {
            assertThat(policy.allowedTargets(technician, ticket(TicketStatus.ASSIGNED, 7L)))
                    .containsExactlyInAnyOrder(TicketStatus.IN_PROGRESS, TicketStatus.SCHEDULED);
        }

        @Test
        void strangerSeesNothing() {
            assertThat(policy.allowedTargets(otherTechnician, ticket(TicketStatus.ASSIGNED, 7L))).isEmpty();
        }
    }
}
