package org.example.restaurantfieldservice.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.RestaurantDTO;
import org.example.restaurantfieldservice.dto.RestaurantRequest;
import org.example.restaurantfieldservice.service.RestaurantService;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/restaurants")
@RequiredArgsConstructor
public class RestaurantController {

    private final RestaurantService restaurantService;

    @GetMapping
    public ResponseEntity<List<RestaurantDTO>> getRestaurants(@RequestParam(required = false) String search,
                                                              SessionContext session) {
        return ResponseEntity.ok(restaurantService.getRestaurants(search));
    }

    @GetMapping("/{id:\\d+}")
    public ResponseEntity<RestaurantDTO> getRestaurant(@PathVariable Long id, SessionContext session) {
        return ResponseEntity.ok(restaurantService.getRestaurant(id));
    }

    @PostMapping
    public ResponseEntity<RestaurantDTO> createRestaurant(@Valid @RequestBody RestaurantRequest request,
                                                          SessionContext session) {
        log.info("POST /api/restaurants - {}", request.getName());
        return new ResponseEntity<>(restaurantService.createRestaurant(request, session), HttpStatus.CREATED);
    }

    @PutMapping("/{id:\\d+}")
    public ResponseEntity<RestaurantDTO> updateRestaurant(@PathVariable Long id,
                                                          @Valid @RequestBody RestaurantRequest request,
                                                          SessionContext session) {
        log.info("PUT /api/restaurants/{}", id);
        return ResponseEntity.ok(restaurantService.updateRestaurant(id, request, session));
    }
}
