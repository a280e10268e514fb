package org.example.restaurantfieldservice.service;

import org.example.restaurantfieldservice.dto.TicketDTO;
import org.example.restaurantfieldservice.entity.AppUser;
import org.example.restaurantfieldservice.entity.Notification;
import org.example.restaurantfieldservice.entity.Restaurant;
import org.example.restaurantfieldservice.enums.NotificationType;
import org.example.restaurantfieldservice.enums.TicketPriority;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.enums.UserRole;
import org.example.restaurantfieldservice.exception.PermissionDeniedException;
import org.example.restaurantfieldservice.mapper.ResourceMapper;
import org.example.restaurantfieldservice.repository.AppUserRepository;
import org.example.restaurantfieldservice.repository.NotificationRepository;
import org.example.restaurantfieldservice.repository.RestaurantRepository;
import org.example.restaurantfieldservice.session.SessionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock private NotificationRepository notificationRepository;
    @Mock private AppUserRepository userRepository;
    @Mock private RestaurantRepository restaurantRepository;

    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        notificationService = new NotificationService(notificationRepository, userRepository, restaurantRepository,
                new ResourceMapper());
    }

    private static AppUser user(long id, UserRole role) {
        return AppUser.builder().id(id).name("User " + id).role(role).build();
    }

    @Test
    void helpdeskTicketReachesEveryTechnician() {
        TicketDTO ticket = TicketDTO.builder()
                .id(10L).title("Walk-in cooler warm").priority(TicketPriority.CRITICAL).restaurantId(2L).build();
        when(restaurantRepository.findById(2L)).thenReturn(Optional.of(Restaurant.builder().id(2L).name("Downtown").build()));
        when(userRepository.findByRoleIn(EnumSet.of(UserRole.TECHNICIAN, UserRole.SOFTWARE_TECH)))
                .thenReturn(List.of(user(7L, UserRole.TECHNICIAN), user(8L, UserRole.SOFTWARE_TECH)));

        int sent = notificationService.notifyFieldTicketAvailable(ticket);

        assertThat(sent).isEqualTo(2);
        ArgumentCaptor<Notification> saved = ArgumentCaptor.forClass(Notification.class);
        verify(notificationRepository, times(2)).save(saved.capture());
        assertThat(saved.getValue().getType()).isEqualTo(NotificationType.WARNING);
        assertThat(saved.getValue().getMessage()).isEqualTo("Walk-in cooler warm at Downtown - CRITICAL priority");
    }

    @Test
    void mediumPriorityFieldTicketIsInformational() {
        TicketDTO ticket = TicketDTO.builder()
                .id(11L).title("Espresso pressure low").priority(TicketPriority.MEDIUM).restaurantId(2L).build();
        when(restaurantRepository.findById(2L)).thenReturn(Optional.of(Restaurant.builder().id(2L).name("Downtown").build()));
        when(userRepository.findByRoleIn(EnumSet.of(UserRole.TECHNICIAN, UserRole.SOFTWARE_TECH)))
                .thenReturn(List.of(user(7L, UserRole.TECHNICIAN)));

        notificationService.notifyFieldTicketAvailable(ticket);

        ArgumentCaptor<Notification> saved = ArgumentCaptor.forClass(Notification.class);
        verify(notificationRepository).save(saved.capture());
        assertThat(saved.getValue().getType()).isEqualTo(NotificationType.INFO);
    }

    @Test
    void creatorIsNotToldAboutTheirOwnTicket() {
        TicketDTO ticket = TicketDTO.builder().id(10L).title("Fryer").restaurantId(2L).createdBy(1L).build();
        when(restaurantRepository.findById(2L)).thenReturn(Optional.empty());
        when(userRepository.findByRoleIn(EnumSet.of(UserRole.ADMIN, UserRole.MANAGER)))
                .thenReturn(List.of(user(1L, UserRole.ADMIN), user(2L, UserRole.MANAGER)));

        assertThat(notificationService.notifyTicketCreated(ticket)).isEqualTo(1);
    }

    @Test
    void statusChangeWithoutAssigneeIsDropped() {
        notificationService.notifyStatusChanged(TicketDTO.builder().id(10L)
                .status(TicketStatus.NEW).build());

        verify(notificationRepository, never()).save(any());
    }

    @Test
    void cannotMarkSomeoneElsesNotification() {
        when(notificationRepository.findById(3L)).thenReturn(Optional.of(Notification.builder().id(3L).userId(8L).build()));
        SessionContext session = SessionContext.builder().userId(7L).role(UserRole.TECHNICIAN).build();

        assertThatThrownBy(() -> notificationService.markRead(3L, session))
                .isInstanceOf(PermissionDeniedException.class);
    }
}
