package org.example.restaurantfieldservice.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.entity.AppUser;
import org.example.restaurantfieldservice.entity.Device;
import org.example.restaurantfieldservice.entity.EquipmentItem;
import org.example.restaurantfieldservice.entity.KnowledgeArticle;
import org.example.restaurantfieldservice.entity.Restaurant;
import org.example.restaurantfieldservice.entity.Ticket;
import org.example.restaurantfieldservice.enums.DeviceStatus;
import org.example.restaurantfieldservice.enums.TicketPriority;
import org.example.restaurantfieldservice.enums.TicketSource;
import org.example.restaurantfieldservice.enums.TicketStatus;
import org.example.restaurantfieldservice.enums.UserRole;
import org.example.restaurantfieldservice.lifecycle.SlaPolicy;
import org.example.restaurantfieldservice.repository.AppUserRepository;
import org.example.restaurantfieldservice.repository.DeviceRepository;
import org.example.restaurantfieldservice.repository.EquipmentItemRepository;
import org.example.restaurantfieldservice.repository.KnowledgeArticleRepository;
import org.example.restaurantfieldservice.repository.RestaurantRepository;
import org.example.restaurantfieldservice.repository.TicketRepository;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataAccessException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Seeds demo accounts, two restaurants with their equipment, some stock and a
 * handful of tickets. Only active for the dev and test profiles.
 * Every seeded account uses the password {@code password123}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Profile({"dev", "test"})
public class DataLoader implements CommandLineRunner {

    static final String DEMO_PASSWORD = "password123";

    private final AppUserRepository userRepository;
    private final RestaurantRepository restaurantRepository;
    private final DeviceRepository deviceRepository;
    private final EquipmentItemRepository equipmentRepository;
    private final KnowledgeArticleRepository articleRepository;
    private final TicketRepository ticketRepository;
    private final PasswordEncoder passwordEncoder;
    private final SlaPolicy slaPolicy;

    @Override
    public void run(String... args) {
        long existingUsers;
        try {
            existingUsers = userRepository.count();
        } catch (DataAccessException | TransactionException e) {
            log.warn("⚠️ Database unavailable, skipping demo data: {}", e.getMessage());
            return;
        }
        if (existingUsers > 0) {
            log.info("Database already contains {} users. Skipping data loading.", existingUsers);
            return;
        }
        log.info("Loading demo field service data...");

        String hash = passwordEncoder.encode(DEMO_PASSWORD);
        List<AppUser> users = userRepository.saveAll(Arrays.asList(
                user("Alice Admin", "admin@fieldservice.local", UserRole.ADMIN, hash),
                user("Marco Manager", "manager@fieldservice.local", UserRole.MANAGER, hash),
                user("Tina Technician", "tech@fieldservice.local", UserRole.TECHNICIAN, hash),
                user("Sam Software", "software@fieldservice.local", UserRole.SOFTWARE_TECH, hash),
                user("Walt Warehouse", "warehouse@fieldservice.local", UserRole.WAREHOUSE, hash)
        ));
        AppUser manager = users.get(1);
        AppUser technician = users.get(2);

        List<Restaurant> restaurants = restaurantRepository.saveAll(Arrays.asList(
                Restaurant.builder().name("Downtown Diner").address("12 Main Street").city("Springfield")
                        .phone("555-0101").managerId(manager.getId()).build(),
                Restaurant.builder().name("Harbor Grill").address("4 Pier Road").city("Shelbyville")
                        .phone("555-0202").managerId(manager.getId()).build()
        ));

        List<Device> devices = deviceRepository.saveAll(Arrays.asList(
                device("Fryer 1", "fryer", "FRY-1001", restaurants.get(0)),
                device("Walk-in Cooler", "refrigeration", "COOL-2001", restaurants.get(0)),
                device("Espresso Machine", "coffee", "ESP-3001", restaurants.get(1)),
                device("POS Terminal 2", "pos", "POS-4002", restaurants.get(1))
        ));

        equipmentRepository.saveAll(Arrays.asList(
                item("Heating element 3kW", "fryer", 10, 3, "12.50"),
                item("Compressor relay", "refrigeration", 2, 3, "48.00"),
                item("Group head gasket", "coffee", 25, 5, "3.20"),
                item("Thermostat probe", "refrigeration", 7, 2, "19.90")
        ));

        articleRepository.save(KnowledgeArticle.builder()
                .title("Fryer does not heat up")
                .summary("Checklist before replacing the heating element")
                .content("1. Check the high-limit reset.\n2. Measure element resistance.\n3. Replace if open circuit.")
                .tags(new LinkedHashSet<>(List.of("fryer", "heating")))
                .authorId(technician.getId())
                .build());

        ticketRepository.saveAll(Arrays.asList(
                ticket("Fryer not heating", TicketPriority.HIGH, devices.get(0), manager, null),
                ticket("Cooler temperature alarm", TicketPriority.CRITICAL, devices.get(1), manager, technician),
                ticket("Espresso pressure low", TicketPriority.MEDIUM, devices.get(2), manager, null)
        ));

        log.info("Demo data loaded: {} users, {} restaurants, {} devices, {} tickets",
                userRepository.count(), restaurantRepository.count(), deviceRepository.count(),
                ticketRepository.count());
    }

    private AppUser user(String name, String email, UserRole role, String hash) {
        return AppUser.builder().name(name).email(email).role(role).passwordHash(hash).build();
    }

    private Device device(String name, String type, String serial, Restaurant restaurant) {
        return Device.builder()
                .name(name)
                .type(type)
                .serialNumber(serial)
                .status(DeviceStatus.OPERATIONAL)
                .restaurantId(restaurant.getId())
                .build();
    }

    private EquipmentItem item(String name, String type, int stock, int minStock, String unitCost) {
        return EquipmentItem.builder()
                .name(name)
                .type(type)
                .stockLevel(stock)
                .minStockLevel(minStock)
                .maxStockLevel(stock * 4)
                .warehouseLocation("Central")
                .unitCost(new BigDecimal(unitCost))
                .build();
    }

    private Ticket ticket(String title, TicketPriority priority, Device device, AppUser creator, AppUser assignee) {
        return Ticket.builder()
                .ticketNumber("TKT-DEMO-" + device.getSerialNumber())
                .title(title)
                .priority(priority)
                .status(assignee != null ? TicketStatus.ASSIGNED : TicketStatus.NEW)
                .source(TicketSource.STANDARD)
                .deviceId(device.getId())
                .restaurantId(device.getRestaurantId())
                .createdBy(creator.getId())
                .assignedTo(assignee != null ? assignee.getId() : null)
                .assignedAt(assignee != null ? slaPolicy.now() : null)
                .createdAt(slaPolicy.now())
                .slaDueAt(slaPolicy.standardDueDate(priority))
                .photos(new ArrayList<>())
                .build();
    }
}
