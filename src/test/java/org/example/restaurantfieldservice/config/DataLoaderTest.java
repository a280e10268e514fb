package org.example.restaurantfieldservice.config;

import org.example.restaurantfieldservice.lifecycle.SlaPolicy;
import org.example.restaurantfieldservice.repository.AppUserRepository;
import org.example.restaurantfieldservice.repository.DeviceRepository;
import org.example.restaurantfieldservice.repository.EquipmentItemRepository;
import org.example.restaurantfieldservice.repository.KnowledgeArticleRepository;
import org.example.restaurantfieldservice.repository.RestaurantRepository;
import org.example.restaurantfieldservice.repository.TicketRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.annotation.Profile;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.transaction.CannotCreateTransactionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DataLoader")
class DataLoaderTest {

    @Mock private AppUserRepository userRepository;
    @Mock private RestaurantRepository restaurantRepository;
    @Mock private DeviceRepository deviceRepository;
    @Mock private EquipmentItemRepository equipmentRepository;
    @Mock private KnowledgeArticleRepository articleRepository;
    @Mock private TicketRepository ticketRepository;
    @Mock private PasswordEncoder passwordEncoder;
    @Mock private SlaPolicy slaPolicy;

    @InjectMocks
    private DataLoader dataLoader;

    @Test
    @DisplayName("is not active without an explicit dev or test profile")
    void notActiveByDefault() {
        Profile profile = DataLoader.class.getAnnotation(Profile.class);

        assertThat(profile.value()).containsExactlyInAnyOrder("dev", "test");
    }

    @Test
    @DisplayName("an unreachable database skips seeding instead of failing startup")
    void unreachableDatabaseSkipsSeeding() {
        when(userRepository.count()).thenThrow(new CannotCreateTransactionException("Connection refused"));

        assertThatCode(() -> dataLoader.run()).doesNotThrowAnyException();

        verify(userRepository, never()).saveAll(anyList());
        verifyNoInteractions(passwordEncoder, restaurantRepository, ticketRepository);
    }

    @Test
    @DisplayName("an existing user base is left untouched")
    void existingDataIsKept() {
        when(userRepository.count()).thenReturn(3L);

        dataLoader.run();

        verify(userRepository, never()).saveAll(anyList());
        verifyNoInteractions(passwordEncoder);
    }
}
