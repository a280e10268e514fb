package org.example.restaurantfieldservice.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.RestaurantDTO;
import org.example.restaurantfieldservice.dto.RestaurantRequest;
import org.example.restaurantfieldservice.entity.Restaurant;
import org.example.restaurantfieldservice.enums.ChangeOperation;
import org.example.restaurantfieldservice.enums.UserRole;
import org.example.restaurantfieldservice.event.EntityChangeEvent;
import org.example.restaurantfieldservice.exception.ResourceNotFoundException;
import org.example.restaurantfieldservice.mapper.ResourceMapper;
import org.example.restaurantfieldservice.repository.RestaurantRepository;
import org.example.restaurantfieldservice.session.AccessGuard;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class RestaurantService {

    static final String TABLE = "restaurants";

    private final RestaurantRepository restaurantRepository;
    private final ResourceMapper mapper;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional(readOnly = true)
    public List<RestaurantDTO> getRestaurants(String search) {
        List<Restaurant> restaurants = StringUtils.hasText(search)
                ? restaurantRepository.findByNameContainingIgnoreCaseOrCityContainingIgnoreCaseOrderByNameAsc(
                        search.trim(), search.trim())
                : restaurantRepository.findAll(Sort.by("name").ascending());
        return restaurants.stream().map(mapper::toDTO).toList();
    }

    @Transactional(readOnly = true)
    public RestaurantDTO getRestaurant(Long id) {
        return mapper.toDTO(findRestaurant(id));
    }

    public RestaurantDTO createRestaurant(RestaurantRequest request, SessionContext session) {
        AccessGuard.requireAnyRole(session, "create restaurant", UserRole.ADMIN, UserRole.MANAGER);
        Restaurant restaurant = new Restaurant();
        apply(restaurant, request);
        Restaurant saved = restaurantRepository.save(restaurant);
        eventPublisher.publishEvent(new EntityChangeEvent(this, TABLE, saved.getId(), ChangeOperation.INSERT));
        log.info("✅ Restaurant created - id: {}, name: {}", saved.getId(), saved.getName());
        return mapper.toDTO(saved);
    }

    public RestaurantDTO updateRestaurant(Long id, RestaurantRequest request, SessionContext session) {
        AccessGuard.requireAnyRole(session, "edit restaurant", UserRole.ADMIN, UserRole.MANAGER);
        Restaurant restaurant = findRestaurant(id);
        apply(restaurant, request);
        Restaurant saved = restaurantRepository.save(restaurant);
        eventPublisher.publishEvent(new EntityChangeEvent(this, TABLE, saved.getId(), ChangeOperation.UPDATE));
        log.info("✅ Restaurant updated - id: {}", id);
        return mapper.toDTO(saved);
    }

    private Restaurant findRestaurant(Long id) {
        return restaurantRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Restaurant", id));
    }

    private void apply(Restaurant restaurant, RestaurantRequest request) {
        restaurant.setName(request.getName().trim());
        restaurant.setAddress(request.getAddress());
        restaurant.setCity(request.getCity());
        restaurant.setPhone(request.getPhone());
        restaurant.setManagerId(request.getManagerId());
    }
}
