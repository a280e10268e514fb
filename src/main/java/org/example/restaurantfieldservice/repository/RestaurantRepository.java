package org.example.restaurantfieldservice.repository;

import org.example.restaurantfieldservice.entity.Restaurant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RestaurantRepository extends JpaRepository<Restaurant, Long> {

    List<Restaurant> findByNameContainingIgnoreCaseOrCityContainingIgnoreCaseOrderByNameAsc(String name, String city);
}
