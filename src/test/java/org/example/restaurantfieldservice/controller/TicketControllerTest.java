package org.example.restaurantfieldservice.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.restaurantfieldservice.command.TicketCommandExecutor;
import org.example.restaurantfieldservice.dto.TicketCreateRequest;
import org.example.restaurantfieldservice.dto.TicketDTO;
import org.example.restaurantfieldservice.dto.TicketTransitionRequest;
import org.example.restaurantfieldservice.enums.TicketPriority;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.enums.UserRole;
import org.example.restaurantfieldservice.exception.AuthenticationException;
import org.example.restaurantfieldservice.exception.InvalidTicketOperationException;
import org.example.restaurantfieldservice.exception.PermissionDeniedException;
import org.example.restaurantfieldservice.exception.ResourceNotFoundException;
import org.example.restaurantfieldservice.exception.TicketNotAssignedException;
import org.example.restaurantfieldservice.security.AuthService;
import org.example.restaurantfieldservice.service.InterventionService;
import org.example.restaurantfieldservice.service.TicketService;
import org.example.restaurantfieldservice.session.SessionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.EnumSet;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TicketController.class)
@DisplayName("TicketController")
class TicketControllerTest {

    private static final String TOKEN = "Bearer test-token";

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;

    @MockBean private TicketService ticketService;
    @MockBean private TicketCommandExecutor commandExecutor;
    @MockBean private InterventionService interventionService;
    @MockBean private AuthService authService;

    private final SessionContext technician = SessionContext.builder()
            .userId(7L).name("Tina").email("tech@test").role(UserRole.TECHNICIAN).build();

    @BeforeEach
    void setUp() {
        when(authService.resolveSession("test-token")).thenReturn(technician);
    }

    private TicketDTO ticket(TicketStatus status, Long assignee) {
        return TicketDTO.builder()
                .id(10L)
                .ticketNumber("TKT-20260302-ABC123")
                .title("Fryer not heating")
                .status(status)
                .priority(TicketPriority.HIGH)
                .assignedTo(assignee)
                .slaDueAt(LocalDateTime.of(2026, 3, 2, 14, 0))
                .build();
    }

    @Nested
    @DisplayName("session")
    class Session {

        @Test
        @DisplayName("requests without a bearer token are rejected with 401")
        void missingToken() throws Exception {
            mockMvc.perform(get("/api/tickets/10"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.message").value("Missing bearer token"));

            verifyNoInteractions(ticketService);
        }

        @Test
        void revokedToken() throws Exception {
            when(authService.resolveSession("revoked")).thenThrow(new AuthenticationException("Session has been signed out"));

            mockMvc.perform(get("/api/tickets/10").header(HttpHeaders.AUTHORIZATION, "Bearer revoked"))
                    .andExpect(status().isUnauthorized());
        }
    }

    @Nested
    @DisplayName("create and read")
    class CreateAndRead {

        @Test
        @DisplayName("POST /api/tickets returns 201 with the new ticket")
        void createTicket() throws Exception {
            TicketCreateRequest request = TicketCreateRequest.builder()
                    .title("Fryer not heating").priority(TicketPriority.HIGH).deviceId(3L).restaurantId(2L).build();
            when(ticketService.createTicket(any(TicketCreateRequest.class), eq(technician)))
                    .thenReturn(ticket(TicketStatus.NEW, null));

            mockMvc.perform(post("/api/tickets")
                            .header(HttpHeaders.AUTHORIZATION, TOKEN)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(request)))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.status").value("new"))
                    .andExpect(jsonPath("$.priority").value("high"))
                    .andExpect(jsonPath("$.ticketNumber").value("TKT-20260302-ABC123"));
        }

        @Test
        @DisplayName("GET /api/tickets filters with the lowercase status and priority values")
        void filtersWithWireValues() throws Exception {
            mockMvc.perform(get("/api/tickets")
                            .param("status", "in-progress")
                            .param("priority", "high")
                            .header(HttpHeaders.AUTHORIZATION, TOKEN))
                    .andExpect(status().isOk());

            verify(ticketService).getTicketsWithFilters(eq(TicketStatus.IN_PROGRESS), eq(TicketPriority.HIGH),
                    isNull(), isNull(), isNull(), isNull(), eq(0), eq(20), eq("createdAt"), eq("desc"));
        }

        @Test
        @DisplayName("GET /api/tickets still accepts the constant names")
        void filtersWithConstantNames() throws Exception {
            mockMvc.perform(get("/api/tickets")
                            .param("status", "IN_PROGRESS")
                            .header(HttpHeaders.AUTHORIZATION, TOKEN))
                    .andExpect(status().isOk());

            verify(ticketService).getTicketsWithFilters(eq(TicketStatus.IN_PROGRESS), isNull(),
                    isNull(), isNull(), isNull(), isNull(), eq(0), eq(20), eq("createdAt"), eq("desc"));
        }

        @Test
        @DisplayName("GET /api/tickets rejects an unknown status with 400")
        void unknownStatusFilter() throws Exception {
            mockMvc.perform(get("/api/tickets")
                            .param("status", "waiting")
                            .header(HttpHeaders.AUTHORIZATION, TOKEN))
                    .andExpect(status().isBadRequest());

            verifyNoInteractions(ticketService);
        }

        @Test
        void unknownTicketIs404() throws Exception {
            when(ticketService.getTicketById(99L)).thenThrow(new ResourceNotFoundException("Ticket", 99L));

            mockMvc.perform(get("/api/tickets/99").header(HttpHeaders.AUTHORIZATION, TOKEN))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.message").value("Ticket not found with id: 99"));
        }

        @Test
        @DisplayName("GET /transitions lists the caller's next steps")
        void allowedTransitions() throws Exception {
            when(ticketService.getAllowedTransitions(10L, technician))
                    .thenReturn(EnumSet.of(TicketStatus.IN_PROGRESS, TicketStatus.SCHEDULED));

            mockMvc.perform(get("/api/tickets/10/transitions").header(HttpHeaders.AUTHORIZATION, TOKEN))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.length()").value(2))
                    .andExpect(jsonPath("$[0]").value("in-progress"));
        }
    }

    @Nested
    @DisplayName("status changes")
    class StatusChanges {

        @Test
        @DisplayName("self-assign assigns the ticket to the caller")
        void selfAssign() throws Exception {
            when(commandExecutor.assign(10L, 7L, null, technician)).thenReturn(ticket(TicketStatus.ASSIGNED, 7L));

            mockMvc.perform(post("/api/tickets/10/self-assign").header(HttpHeaders.AUTHORIZATION, TOKEN))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("assigned"))
                    .andExpect(jsonPath("$.assignedTo").value(7));
        }

        @Test
        @DisplayName("starting an unassigned ticket is a 400")
        void startUnassigned() throws Exception {
            when(commandExecutor.transition(10L, TicketStatus.IN_PROGRESS, "Intervention started", null, technician))
                    .thenThrow(new TicketNotAssignedException(10L));

            mockMvc.perform(post("/api/tickets/10/start").header(HttpHeaders.AUTHORIZATION, TOKEN))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.errorCode").value("TICKET_NOT_ASSIGNED"));
        }

        @Test
        void patchStatusAcceptsWireValue() throws Exception {
            when(commandExecutor.transition(eq(10L), eq(TicketStatus.RESOLVED), isNull(), eq("Replaced element"),
                    eq(technician))).thenReturn(ticket(TicketStatus.RESOLVED, 7L));

            mockMvc.perform(patch("/api/tickets/10/status")
                            .header(HttpHeaders.AUTHORIZATION, TOKEN)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"status\":\"resolved\",\"resolution\":\"Replaced element\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("resolved"));
        }

        @Test
        @DisplayName("a status change without a target is rejected before reaching the executor")
        void missingTarget() throws Exception {
            mockMvc.perform(patch("/api/tickets/10/status")
                            .header(HttpHeaders.AUTHORIZATION, TOKEN)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(new TicketTransitionRequest())))
                    .andExpect(status().isBadRequest());

            verify(commandExecutor, never()).transition(any(), any(), any(), any(), any());
        }

        @Test
        void backwardsMoveIs400() throws Exception {
            when(commandExecutor.transition(10L, TicketStatus.NEW, null, null, technician))
                    .thenThrow(new InvalidTicketOperationException("transition", "Cannot transition from 'assigned' to 'new'"));

            mockMvc.perform(patch("/api/tickets/10/status")
                            .header(HttpHeaders.AUTHORIZATION, TOKEN)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"status\":\"new\"}"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        void forbiddenMoveIs403() throws Exception {
            when(commandExecutor.assign(10L, 8L, null, technician))
                    .thenThrow(new PermissionDeniedException("Not allowed to assign ticket TKT-20260302-ABC123"));

            mockMvc.perform(post("/api/tickets/10/assign")
                            .header(HttpHeaders.AUTHORIZATION, TOKEN)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"assigneeId\":8}"))
                    .andExpect(status().isForbidden());
        }

        @Test
        @DisplayName("a change queued offline is returned with pendingSync set")
        void pendingSyncIsExposed() throws Exception {
            TicketDTO queued = ticket(TicketStatus.IN_PROGRESS, 7L);
            queued.setPendingSync(true);
            when(commandExecutor.transition(10L, TicketStatus.IN_PROGRESS, "Intervention started", null, technician))
                    .thenReturn(queued);

            mockMvc.perform(post("/api/tickets/10/start").header(HttpHeaders.AUTHORIZATION, TOKEN))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.pendingSync").value(true));
        }
    }
}
